package com.spanjson.registry;

import java.util.Objects;

/**
 * Payload of a span creation: its metadata, initial field values and parent.
 *
 * {@code parent} is null for a contextual span, whose parent is the span current
 * on the creating thread.
 */
public record Attributes(Metadata metadata, ValueSet values, ScopeId parent) {

    public Attributes {
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(values, "values");
    }

    public boolean isContextual() {
        return parent == null;
    }

    public void record(FieldVisitor visitor) {
        values.record(visitor);
    }
}
