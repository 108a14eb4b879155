package com.xpt.storage;

import java.util.Objects;
import java.util.Set;

/**
 * Options of a load call. Depth counts like {@link StoreOptions}; link targets are loaded only with
 * {@code withLinks} and do not use up depth. {@code loadOnly} and {@code loadExcept} filter payload
 * fields and cannot be combined. {@code force} skips the format version check.
 */
public record LoadOptions(boolean recursive, int maxDepth, LoadDataLevel dataLevel,
                          Set<String> loadOnly, Set<String> loadExcept, boolean withLinks, boolean force) {

    public static final int UNLIMITED = Integer.MAX_VALUE;

    public LoadOptions {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0, got: " + maxDepth);
        Objects.requireNonNull(dataLevel, "dataLevel");
        loadOnly = loadOnly != null ? Set.copyOf(loadOnly) : Set.of();
        loadExcept = loadExcept != null ? Set.copyOf(loadExcept) : Set.of();
        if (!loadOnly.isEmpty() && !loadExcept.isEmpty()) {
            throw new IllegalArgumentException("loadOnly and loadExcept cannot be used together");
        }
    }

    /** Recursive, unlimited depth, {@link LoadDataLevel#PAYLOAD}, with links, version checked. */
    public static LoadOptions defaults() {
        return new LoadOptions(true, UNLIMITED, LoadDataLevel.PAYLOAD, null, null, true, false);
    }

    public LoadOptions withRecursive(boolean value) {
        return new LoadOptions(value, maxDepth, dataLevel, loadOnly, loadExcept, withLinks, force);
    }

    public LoadOptions withMaxDepth(int value) {
        return new LoadOptions(recursive, value, dataLevel, loadOnly, loadExcept, withLinks, force);
    }

    public LoadOptions withDataLevel(LoadDataLevel value) {
        return new LoadOptions(recursive, maxDepth, value, loadOnly, loadExcept, withLinks, force);
    }

    public LoadOptions withLoadOnly(Set<String> value) {
        return new LoadOptions(recursive, maxDepth, dataLevel, value, loadExcept, withLinks, force);
    }

    public LoadOptions withLoadExcept(Set<String> value) {
        return new LoadOptions(recursive, maxDepth, dataLevel, loadOnly, value, withLinks, force);
    }

    public LoadOptions withLinks(boolean value) {
        return new LoadOptions(recursive, maxDepth, dataLevel, loadOnly, loadExcept, value, force);
    }

    public LoadOptions withForce(boolean value) {
        return new LoadOptions(recursive, maxDepth, dataLevel, loadOnly, loadExcept, withLinks, value);
    }

    public int effectiveDepth() {
        return recursive ? maxDepth : 0;
    }

    /** Whether a payload field passes the only/except filter. */
    public boolean accepts(String field) {
        if (!loadOnly.isEmpty()) return loadOnly.contains(field);
        return !loadExcept.contains(field);
    }
}
