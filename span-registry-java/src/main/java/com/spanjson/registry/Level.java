package com.spanjson.registry;

/**
 * Verbosity of a span or event, most verbose first.
 */
public enum Level {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    /** Upper-case name as it appears in emitted records, e.g. {@code "INFO"}. */
    public String asString() {
        return name();
    }
}
