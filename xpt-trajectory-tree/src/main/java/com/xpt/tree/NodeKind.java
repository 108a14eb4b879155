package com.xpt.tree;

public enum NodeKind {
    GROUP,
    LEAF
}
