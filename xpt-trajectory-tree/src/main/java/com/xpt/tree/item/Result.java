package com.xpt.tree.item;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Result item: ordered named fields. {@link #set(Object)} and {@link #get()} use the default field {@code data}.
 */
public final class Result implements ItemContract {

    public static final String TYPE_NAME = "Result";
    public static final String DEFAULT_FIELD = "data";

    private final Map<String, Object> fields = new LinkedHashMap<>();
    private boolean locked;

    public Result() {
    }

    public Result(Object value) {
        set(value);
    }

    public Result(Map<String, ?> values) {
        values.forEach(this::set);
    }

    public void set(Object value) {
        set(DEFAULT_FIELD, value);
    }

    public void set(String field, Object value) {
        if (locked) throw new ParameterLockedException("set field " + field);
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
        fields.put(field, value);
    }

    public Object get() {
        return fields.get(DEFAULT_FIELD);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean contains(String field) {
        return fields.containsKey(field);
    }

    public void remove(String field) {
        if (locked) throw new ParameterLockedException("remove field " + field);
        fields.remove(field);
    }

    public Set<String> getFieldNames() {
        return Collections.unmodifiableSet(fields.keySet());
    }

    @Override
    public Map<String, Object> store() {
        return new LinkedHashMap<>(fields);
    }

    @Override
    public void load(Map<String, Object> representation) {
        if (representation != null) fields.putAll(representation);
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
        return fields.isEmpty();
    }

    @Override
    public void empty() {
        if (locked) throw new ParameterLockedException("empty");
        fields.clear();
    }

    @Override
    public Map<String, Object> toDict() {
        return store();
    }

    @Override
    public void removeFields(Collection<String> names) {
        if (locked) throw new ParameterLockedException("remove fields");
        fields.keySet().removeAll(names);
    }

    @Override
    public String typeName() {
        return TYPE_NAME;
    }

    @Override
    public Result copy() {
        Result r = new Result();
        r.fields.putAll(fields);
        r.locked = locked;
        return r;
    }

    @Override
    public String toString() {
        return "Result" + fields;
    }
}
