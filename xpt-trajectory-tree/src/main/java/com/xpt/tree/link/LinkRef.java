package com.xpt.tree.link;

import com.xpt.tree.GroupNode;

/**
 * One link edge seen from its target: the owning group and the link name.
 */
public record LinkRef(GroupNode owner, String name) {

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LinkRef other)) return false;
        return owner == other.owner && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(owner) + name.hashCode();
    }
}
