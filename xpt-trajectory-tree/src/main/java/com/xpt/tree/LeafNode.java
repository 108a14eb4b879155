package com.xpt.tree;

import com.xpt.tree.item.ItemContract;

import java.util.Objects;

/**
 * Leaf node holding one item. The leaf is locked when its item is.
 */
public final class LeafNode extends Node {

    private ItemContract item;

    public LeafNode(String name, ItemContract item) {
        super(name);
        this.item = Objects.requireNonNull(item, "item");
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LEAF;
    }

    @Override
    public Branch getBranch() {
        GroupNode parent = getParent();
        return parent == null ? Branch.GENERIC : parent.getBranch();
    }

    @Override
    public boolean isLocked() {
        return item.isLocked();
    }

    public ItemContract getItem() {
        return item;
    }

    /**
     * Item cast to the expected type.
     *
     * @throws NodeTypeMismatchException if the item is of another type
     */
    public <T extends ItemContract> T getItem(Class<T> type) {
        if (!type.isInstance(item)) {
            throw new NodeTypeMismatchException(getFullName(), type.getSimpleName(), item.typeName());
        }
        return type.cast(item);
    }

    void setItem(ItemContract item) {
        this.item = Objects.requireNonNull(item, "item");
    }
}
