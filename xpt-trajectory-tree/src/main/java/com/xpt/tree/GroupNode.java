package com.xpt.tree;

import com.xpt.tree.item.ItemContract;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Group node. Children are kept in insertion order. The convenience methods forward to the owning
 * tree with this group as the starting point.
 */
public final class GroupNode extends Node {

    private final Branch branch;
    private final Map<String, Node> children = new LinkedHashMap<>();

    public GroupNode(String name, Branch branch) {
        super(name);
        this.branch = Objects.requireNonNull(branch, "branch");
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.GROUP;
    }

    @Override
    public Branch getBranch() {
        return branch;
    }

    @Override
    public boolean isLocked() {
        return false;
    }

    public Node getChild(String name) {
        return children.get(name);
    }

    public boolean hasChild(String name) {
        return children.containsKey(name);
    }

    public Collection<Node> getChildren() {
        return Collections.unmodifiableCollection(children.values());
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    void putChild(Node child) {
        children.put(child.getName(), child);
    }

    Node removeChildEntry(String name) {
        return children.remove(name);
    }

    public Node get(String path) {
        NodeTree t = requireTree();
        return t.get(this, path, t.defaultOptions());
    }

    public boolean contains(String path) {
        NodeTree t = requireTree();
        return t.contains(this, path, t.isWithLinks());
    }

    public GroupNode addGroup(String path) {
        return requireTree().addGroup(this, path, null);
    }

    public LeafNode addLeaf(String path, ItemContract item) {
        return requireTree().addLeaf(this, path, item, false);
    }

    public void addLink(String name, Node target) {
        requireTree().addLink(this, name, target);
    }

    public void removeLink(String name) {
        requireTree().removeLink(this, name);
    }

    public void removeChild(String name, boolean recursive) {
        requireTree().removeChild(this, name, recursive);
    }

    public Iterable<Node> iterNodes(boolean recursive) {
        NodeTree t = requireTree();
        return t.iterNodes(this, recursive, t.isWithLinks());
    }

    /** Links owned by this group, by link name. */
    public Map<String, Node> getLinks() {
        return requireTree().getLinkIndex().targetsOf(this);
    }

    private NodeTree requireTree() {
        NodeTree t = getTree();
        if (t == null) {
            throw new IllegalStateException("Group `" + getName() + "` is not attached to a tree");
        }
        return t;
    }
}
