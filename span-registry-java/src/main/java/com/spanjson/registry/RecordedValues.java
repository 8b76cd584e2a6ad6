package com.spanjson.registry;

import java.util.Objects;

/**
 * Field values recorded on an already existing span.
 */
public record RecordedValues(ValueSet values) {

    public RecordedValues {
        Objects.requireNonNull(values, "values");
    }

    public static RecordedValues of(String name, Object value) {
        return new RecordedValues(ValueSet.of(name, value));
    }

    public void record(FieldVisitor visitor) {
        values.record(visitor);
    }
}
