package com.spanjson.registry;

/**
 * Identifier of a span, unique among the spans currently open in one {@link Registry}.
 */
public record ScopeId(long value) {

    public ScopeId {
        if (value <= 0) {
            throw new IllegalArgumentException("span ids must be positive, got " + value);
        }
    }

    @Override
    public String toString() {
        return "ScopeId(" + value + ")";
    }
}
