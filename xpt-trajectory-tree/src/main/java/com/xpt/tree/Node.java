package com.xpt.tree;

import com.xpt.tree.naming.PathNames;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Node of a {@link NodeTree}: a {@link GroupNode} holding children or a {@link LeafNode} holding an item.
 * Each non-root node has exactly one owning parent; its full name is the dot path from the root.
 */
public abstract class Node {

    private final String name;
    private GroupNode parent;
    private NodeTree tree;
    private String comment = "";
    private final Map<String, Object> annotations = new LinkedHashMap<>();
    private volatile boolean stored;

    protected Node(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    /** Dot path from the root; empty for the root. */
    public String getFullName() {
        if (parent == null) return isRoot() ? "" : name;
        return PathNames.join(parent.getFullName(), name);
    }

    public GroupNode getParent() {
        return parent;
    }

    public NodeTree getTree() {
        return tree;
    }

    public boolean isRoot() {
        return tree != null && tree.getRoot() == this;
    }

    /** Whether this node is reachable from its tree's root through children. */
    public boolean isAttached() {
        if (tree == null) return false;
        if (isRoot()) return true;
        return parent != null && parent.isAttached();
    }

    /** Number of edges from the root. */
    public int getDepth() {
        int depth = 0;
        for (GroupNode p = parent; p != null; p = p.getParent()) depth++;
        return depth;
    }

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment == null ? "" : comment;
    }

    public Map<String, Object> getAnnotations() {
        return Collections.unmodifiableMap(annotations);
    }

    public Object getAnnotation(String key) {
        return annotations.get(key);
    }

    public void setAnnotation(String key, Object value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        annotations.put(key, value);
    }

    public void setAnnotations(Map<String, ?> values) {
        annotations.clear();
        if (values != null) annotations.putAll(values);
    }

    /** Whether this node has been written to storage at least once. */
    public boolean isStored() {
        return stored;
    }

    public void setStored(boolean stored) {
        this.stored = stored;
    }

    public abstract NodeKind getKind();

    public abstract Branch getBranch();

    public abstract boolean isLocked();

    void attach(NodeTree tree, GroupNode parent) {
        this.tree = tree;
        this.parent = parent;
    }

    void detach() {
        this.tree = null;
        this.parent = null;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + getFullName() + "}";
    }
}
