package com.xpt.tree.item;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parameter item: a default value plus an optional explored range.
 * <p>
 * Length is 0 while unset, 1 for a plain value and the size of the range once explored.
 * Stored fields: {@code data} (default value) and {@code explored_data} (range).
 */
public final class Parameter implements ItemContract {

    private static final Logger log = LoggerFactory.getLogger(Parameter.class);

    public static final String TYPE_NAME = "Parameter";
    public static final String FIELD_DATA = "data";
    public static final String FIELD_EXPLORED = "explored_data";

    private Object data;
    private List<Object> range;
    private boolean locked;

    public Parameter() {
    }

    public Parameter(Object value) {
        set(value);
    }

    /** Sets the default value. Clears an explored range (with a warning). */
    public void set(Object value) {
        if (locked) throw new ParameterLockedException("set value");
        Objects.requireNonNull(value, "value");
        if (range != null) {
            log.warn("Parameter set | discarding explored range | size={}", range.size());
            range = null;
        }
        this.data = value;
    }

    /** The default value, or null when unset. */
    public Object get() {
        return data;
    }

    /**
     * Replaces the explored range. Every value must have the default value's type.
     *
     * @throws IllegalStateException    if no default value is set
     * @throws IllegalArgumentException if the list is empty or holds values of another type
     */
    public void explore(List<?> values) {
        requireDefault("explore");
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Cannot explore with an empty list");
        }
        checkTypes(values);
        if (locked) {
            log.warn("Parameter explore | parameter is locked, exploring anyway | size={}", values.size());
        }
        this.range = new ArrayList<>(values);
    }

    /** Appends values to the explored range. */
    public void addItems(List<?> values) {
        if (range == null) throw new ParameterNotArrayException("add items");
        if (locked) throw new ParameterLockedException("add items");
        checkTypes(values);
        range.addAll(values);
    }

    /** Replaces the explored value at {@code index}. */
    public void changeValuesInArray(int index, Object value) {
        if (range == null) throw new ParameterNotArrayException("change values");
        if (locked) throw new ParameterLockedException("change values");
        checkTypes(List.of(value));
        Objects.checkIndex(index, range.size());
        range.set(index, value);
    }

    /**
     * Single-value, locked view for row {@code n}. An unexplored parameter returns itself since its
     * value applies to every run.
     */
    public Parameter access(int n) {
        if (range == null) return this;
        Objects.checkIndex(n, range.size());
        Parameter view = new Parameter();
        view.data = range.get(n);
        view.locked = true;
        return view;
    }

    /** Value seen by run {@code n}; the default when unexplored. */
    public Object valueAt(int n) {
        if (range == null) return data;
        return range.get(n);
    }

    public int length() {
        if (data == null) return 0;
        return range == null ? 1 : range.size();
    }

    public boolean isArray() {
        return range != null;
    }

    /** Explored values, or an empty list. */
    public List<Object> getRange() {
        return range == null ? List.of() : Collections.unmodifiableList(range);
    }

    /** Drops the explored range and keeps the default. */
    public void shrink() {
        if (locked) throw new ParameterLockedException("shrink");
        range = null;
    }

    @Override
    public Map<String, Object> store() {
        Map<String, Object> out = new LinkedHashMap<>();
        if (data != null) out.put(FIELD_DATA, data);
        if (range != null) out.put(FIELD_EXPLORED, new ArrayList<>(range));
        return out;
    }

    @Override
    public void load(Map<String, Object> representation) {
        if (representation == null) return;
        if (representation.containsKey(FIELD_DATA)) {
            data = representation.get(FIELD_DATA);
        }
        Object explored = representation.get(FIELD_EXPLORED);
        if (explored instanceof Collection<?> c) {
            range = new ArrayList<>(c);
        }
    }

    @Override
    public boolean isLocked() {
        return locked;
    }

    @Override
    public void lock() {
        locked = true;
    }

    @Override
    public void unlock() {
        locked = false;
    }

    @Override
    public boolean isEmpty() {
        return data == null;
    }

    @Override
    public void empty() {
        if (locked) throw new ParameterLockedException("empty");
        data = null;
        range = null;
    }

    @Override
    public Map<String, Object> toDict() {
        Map<String, Object> out = store();
        out.put("length", length());
        out.put("locked", locked);
        return out;
    }

    @Override
    public void removeFields(Collection<String> names) {
        if (locked) throw new ParameterLockedException("remove fields");
        if (names.contains(FIELD_DATA)) {
            data = null;
            range = null;
        }
        if (names.contains(FIELD_EXPLORED)) {
            range = null;
        }
    }

    @Override
    public String typeName() {
        return TYPE_NAME;
    }

    @Override
    public Parameter copy() {
        Parameter p = new Parameter();
        p.data = data;
        p.range = range == null ? null : new ArrayList<>(range);
        p.locked = locked;
        return p;
    }

    private void requireDefault(String operation) {
        if (data == null) {
            throw new IllegalStateException("Parameter has no default value, cannot " + operation);
        }
    }

    private void checkTypes(Collection<?> values) {
        for (Object v : values) {
            if (!sameType(data, v)) {
                throw new IllegalArgumentException(String.format(
                        "Explored value %s has type %s but the default value has type %s",
                        v, v == null ? "null" : v.getClass().getSimpleName(), data.getClass().getSimpleName()));
            }
        }
    }

    /** Numbers match when both are integral or both floating; lists match lists. */
    static boolean sameType(Object reference, Object value) {
        if (reference == null || value == null) return false;
        if (reference instanceof Number && value instanceof Number) {
            return isIntegral((Number) reference) == isIntegral((Number) value);
        }
        if (reference instanceof List && value instanceof List) return true;
        if (reference instanceof Map && value instanceof Map) return true;
        return reference.getClass() == value.getClass();
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
                || n instanceof java.math.BigInteger;
    }

    @Override
    public String toString() {
        return "Parameter{" + (range == null ? String.valueOf(data) : range.toString()) + (locked ? ", locked" : "") + "}";
    }
}
