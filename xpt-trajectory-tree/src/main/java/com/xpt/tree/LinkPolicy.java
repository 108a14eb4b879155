package com.xpt.tree;

/**
 * What removal does with links from outside the removed subtree that point into it.
 */
public enum LinkPolicy {
    /** Drop those links along with the subtree. */
    CASCADE,
    /** Refuse the removal. */
    FAIL
}
