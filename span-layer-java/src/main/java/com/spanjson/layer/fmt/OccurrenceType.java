package com.spanjson.layer.fmt;

/**
 * Value of the {@code type} key of a record.
 */
public enum OccurrenceType {
    EVENT("event"),
    START("start"),
    END("end");

    private final String marker;

    OccurrenceType(String marker) {
        this.marker = marker;
    }

    public String marker() {
        return marker;
    }
}
