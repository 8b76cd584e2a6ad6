package com.spanjson.registry;

/**
 * Receives the typed values of a field payload ({@link Attributes}, {@link RecordedValues}
 * or {@link Event}).
 *
 * {@link ValueSet#record(FieldVisitor)} picks the most specific method for each value:
 * integral numbers go to {@link #recordLong}, floating point to {@link #recordDouble},
 * and anything that is not a number, boolean or character sequence to {@link #recordDebug}.
 */
public interface FieldVisitor {

    void recordLong(String field, long value);

    void recordDouble(String field, double value);

    void recordBoolean(String field, boolean value);

    void recordString(String field, String value);

    void recordDebug(String field, Object value);
}
