package com.spanjson.registry;

import java.util.Objects;

/**
 * A single logged happening. {@code parent} is null for contextual events, which belong
 * to whatever span is current on the logging thread.
 */
public record Event(Metadata metadata, ValueSet values, ScopeId parent) {

    public Event {
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
