package com.spanjson.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered field name/value pairs carried by a span or event.
 *
 * A null value declares the field without a value: it is skipped when visited and
 * may be filled in later with {@link Span#record(String, Object)}.
 */
public final class ValueSet {

    private static final ValueSet EMPTY = new ValueSet(List.of(), List.of());

    private final List<String> names;
    private final List<Object> values;

    private ValueSet(List<String> names, List<Object> values) {
        this.names = names;
        this.values = values;
    }

    public static ValueSet empty() {
        return EMPTY;
    }

    /**
     * Builds a value set from alternating names and values: {@code of("a", 2, "b", "x")}.
     */
    public static ValueSet of(Object... keyValues) {
        if (keyValues == null || keyValues.length == 0) return EMPTY;
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException(
                "fields must be given as name/value pairs, got " + keyValues.length + " arguments");
        }
        List<String> names = new ArrayList<>(keyValues.length / 2);
        List<Object> values = new ArrayList<>(keyValues.length / 2);
        for (int i = 0; i < keyValues.length; i += 2) {
            if (!(keyValues[i] instanceof String name)) {
                throw new IllegalArgumentException("field name at position " + i + " is not a String: " + keyValues[i]);
            }
            names.add(name);
            values.add(keyValues[i + 1]);
        }
        return new ValueSet(Collections.unmodifiableList(names), Collections.unmodifiableList(values));
    }

    /** Returns a copy with {@code name} prepended, used to put {@code message} first. */
    public ValueSet withFirst(String name, Object value) {
        List<String> n = new ArrayList<>(names.size() + 1);
        List<Object> v = new ArrayList<>(values.size() + 1);
        n.add(name);
        v.add(value);
        n.addAll(names);
        v.addAll(values);
        return new ValueSet(Collections.unmodifiableList(n), Collections.unmodifiableList(v));
    }

    boolean isEmpty() {
        return names.isEmpty();
    }

    List<String> names() {
        return names;
    }

    /** Returns the value declared for {@code name}, or null if absent or declared empty. */
    Object get(String name) {
        int idx = names.lastIndexOf(name);
        return idx < 0 ? null : values.get(idx);
    }

    public void record(FieldVisitor visitor) {
        for (int i = 0; i < names.size(); i++) {
            Object value = values.get(i);
            if (value != null) {
                visit(visitor, names.get(i), value);
            }
        }
    }

    static void visit(FieldVisitor visitor, String name, Object value) {
        if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            visitor.recordLong(name, ((Number) value).longValue());
        } else if (value instanceof Double || value instanceof Float) {
            visitor.recordDouble(name, ((Number) value).doubleValue());
        } else if (value instanceof Boolean b) {
            visitor.recordBoolean(name, b);
        } else if (value instanceof CharSequence cs) {
            visitor.recordString(name, cs.toString());
        } else {
            visitor.recordDebug(name, value);
        }
    }
}
