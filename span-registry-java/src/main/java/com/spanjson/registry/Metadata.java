package com.spanjson.registry;

import java.util.Objects;

/**
 * Static description of a callsite: the span or event name, its level and where it was declared.
 *
 * {@code file} and {@code line} are null when the callsite could not be resolved
 * (e.g. frames without debug information).
 */
public record Metadata(
    String name,
    String target,
    Level level,
    String file,
    Integer line,
    Kind kind
) {

    public enum Kind { SPAN, EVENT }

    public Metadata {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(kind, "kind");
    }

    public static Metadata span(String name, String target, Level level, String file, Integer line) {
        return new Metadata(name, target, level, file, line, Kind.SPAN);
    }

    /** Events are named after their location, {@code "event File.java:42"}. */
    public static Metadata event(String target, Level level, String file, Integer line) {
        return new Metadata("event " + file + ":" + line, target, level, file, line, Kind.EVENT);
    }

    public boolean isSpan() {
        return kind == Kind.SPAN;
    }
}
