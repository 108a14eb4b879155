package com.xpt.storage;

/**
 * How much of a stored leaf a load brings into memory.
 */
public enum LoadDataLevel {
    /** Nodes with empty items. */
    SKELETON,
    /** Fill items that are still empty. */
    PAYLOAD,
    /** Replace in-memory item contents. */
    OVERWRITE
}
