package com.xpt.tree.item;

import java.util.Collection;
import java.util.Map;

/**
 * Payload carried by a leaf node. Implementations turn their state into ordered, JSON-friendly
 * fields for storage and rebuild themselves from such fields.
 */
public interface ItemContract {

    /** Payload fields to persist; empty when the item holds no data. */
    Map<String, Object> store();

    /** Replaces the fields present in {@code representation}. Bypasses the lock. */
    void load(Map<String, Object> representation);

    boolean isLocked();

    void lock();

    void unlock();

    boolean isEmpty();

    /** Clears all data. */
    void empty();

    /** Human-readable view of the current state. */
    Map<String, Object> toDict();

    /** Drops the named payload fields; unknown names are ignored. */
    void removeFields(Collection<String> names);

    /** Registered type name used to recreate the item on load. */
    String typeName();

    ItemContract copy();
}
