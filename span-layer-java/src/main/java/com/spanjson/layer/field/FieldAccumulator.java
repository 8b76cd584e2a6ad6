package com.spanjson.layer.field;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;
import com.spanjson.registry.FieldVisitor;

import java.util.Collections;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Field values recorded on one span or event, sorted by name.
 *
 * Recording a name twice keeps the last value. Names starting with {@code log.} carry
 * logging metadata the host already handled and are dropped; names starting with the
 * raw-identifier escape {@code r#} are stored without it ({@code r#type} becomes
 * {@code type}).
 *
 * Not synchronized: the host serializes access through the span's extensions lock.
 */
public final class FieldAccumulator implements FieldVisitor {

    static final String RESERVED_PREFIX = "log.";
    static final String RAW_IDENTIFIER_PREFIX = "r#";

    private final TreeMap<String, JsonElement> fields = new TreeMap<>();
    private final DebugRenderer renderer;

    public FieldAccumulator() {
        this(DebugRenderer.defaults());
    }

    public FieldAccumulator(DebugRenderer renderer) {
        this.renderer = renderer;
    }

    @Override
    public void recordLong(String field, long value) {
        put(field, new JsonPrimitive(value));
    }

    /** NaN and infinities have no JSON form and are stored as null. */
    @Override
    public void recordDouble(String field, double value) {
        put(field, Double.isFinite(value) ? new JsonPrimitive(value) : JsonNull.INSTANCE);
    }

    @Override
    public void recordBoolean(String field, boolean value) {
        put(field, new JsonPrimitive(value));
    }

    @Override
    public void recordString(String field, String value) {
        put(field, new JsonPrimitive(value));
    }

    @Override
    public void recordDebug(String field, Object value) {
        put(field, new JsonPrimitive(renderer.render(value)));
    }

    /** Read-only live view, sorted by name. */
    public SortedMap<String, JsonElement> fields() {
        return Collections.unmodifiableSortedMap(fields);
    }

    public Optional<JsonElement> get(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    private void put(String field, JsonElement value) {
        String key = storageKey(field);
        if (key != null) {
            fields.put(key, value);
        }
    }

    /** Returns the name a field is stored under, or null if it must not be stored. */
    static String storageKey(String field) {
        if (field.startsWith(RESERVED_PREFIX)) return null;
        if (field.startsWith(RAW_IDENTIFIER_PREFIX)) return field.substring(RAW_IDENTIFIER_PREFIX.length());
        return field;
    }
}
