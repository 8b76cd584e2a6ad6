package com.spanjson.layer.fmt;

/**
 * Process-wide identity stamped on every record. The pid is kept as a string since it is
 * emitted as one.
 */
public record StaticMetadata(String name, String pid) {

    public static StaticMetadata capture(String name) {
        return new StaticMetadata(name, Long.toString(ProcessHandle.current().pid()));
    }
}
