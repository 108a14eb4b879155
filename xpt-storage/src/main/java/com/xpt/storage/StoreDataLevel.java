package com.xpt.storage;

/**
 * How much of a leaf's payload a store writes.
 */
public enum StoreDataLevel {
    /** Structure and metadata only. */
    SKELETON,
    /** Payload only where the backend has none yet. */
    PAYLOAD,
    /** Only the forced fields, or only fields the backend does not have yet. */
    INCREMENTAL,
    /** Rewrite the whole payload. */
    OVERWRITE
}
