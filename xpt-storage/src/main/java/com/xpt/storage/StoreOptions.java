package com.xpt.storage;

import java.util.List;
import java.util.Objects;

/**
 * Options of a store call. Depth 0 stores only the node, N stores N extra levels; a non-recursive
 * store is depth 0. {@code overwriteFields} are rewritten at every payload level.
 */
public record StoreOptions(boolean recursive, int maxDepth, StoreDataLevel dataLevel, List<String> overwriteFields) {

    public static final int UNLIMITED = Integer.MAX_VALUE;

    public StoreOptions {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0, got: " + maxDepth);
        Objects.requireNonNull(dataLevel, "dataLevel");
        overwriteFields = overwriteFields != null ? List.copyOf(overwriteFields) : List.of();
    }

    /** Recursive, unlimited depth, {@link StoreDataLevel#PAYLOAD}. */
    public static StoreOptions defaults() {
        return new StoreOptions(true, UNLIMITED, StoreDataLevel.PAYLOAD, null);
    }

    public StoreOptions withRecursive(boolean value) {
        return new StoreOptions(value, maxDepth, dataLevel, overwriteFields);
    }

    public StoreOptions withMaxDepth(int value) {
        return new StoreOptions(recursive, value, dataLevel, overwriteFields);
    }

    public StoreOptions withDataLevel(StoreDataLevel value) {
        return new StoreOptions(recursive, maxDepth, value, overwriteFields);
    }

    public StoreOptions withOverwriteFields(List<String> value) {
        return new StoreOptions(recursive, maxDepth, dataLevel, value);
    }

    public int effectiveDepth() {
        return recursive ? maxDepth : 0;
    }
}
