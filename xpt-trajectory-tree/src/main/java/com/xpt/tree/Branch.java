package com.xpt.tree;

import com.xpt.tree.item.ItemContract;
import com.xpt.tree.item.Parameter;
import com.xpt.tree.item.Result;

import java.util.Optional;

/**
 * Top-level branch a group belongs to. The root's children named after a branch start that branch;
 * every group below inherits it. Groups elsewhere are {@link #GENERIC}.
 */
public enum Branch {
    PARAMETERS("parameters", "par"),
    DERIVED_PARAMETERS("derived_parameters", "dpar"),
    RESULTS("results", "res"),
    CONFIG("config", "conf"),
    GENERIC(null, null);

    private final String groupName;
    private final String alias;

    Branch(String groupName, String alias) {
        this.groupName = groupName;
        this.alias = alias;
    }

    /** Name of the root child that starts this branch; null for {@link #GENERIC}. */
    public String getGroupName() {
        return groupName;
    }

    public String getAlias() {
        return alias;
    }

    /** Branch started by a root child with the given name. */
    public static Optional<Branch> ofGroupName(String name) {
        for (Branch b : values()) {
            if (b.groupName != null && b.groupName.equals(name)) return Optional.of(b);
        }
        return Optional.empty();
    }

    /** Whether leaves holding {@code item} may live in this branch. */
    public boolean accepts(ItemContract item) {
        switch (this) {
            case PARAMETERS:
            case DERIVED_PARAMETERS:
            case CONFIG:
                return item instanceof Parameter;
            case RESULTS:
                return item instanceof Result;
            default:
                return true;
        }
    }
}
