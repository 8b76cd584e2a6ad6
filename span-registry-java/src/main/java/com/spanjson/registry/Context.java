package com.spanjson.registry;

import java.util.Objects;

/**
 * A layer's view of the registry it is attached to.
 */
public final class Context {

    private final LookupSpan lookup;

    public Context(LookupSpan lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    public SpanRef span(ScopeId id) {
        return lookup.span(id);
    }

    public SpanRef lookupCurrent() {
        return lookup.lookupCurrent();
    }

    /**
     * Resolves the span an event belongs to: its explicit parent if still open, otherwise
     * the span current on the calling thread. Null when the event is outside any span.
     */
    public SpanRef eventSpan(Event event) {
        SpanRef parent = event.isContextual() ? null : span(event.parent());
        return parent != null ? parent : lookupCurrent();
    }
}
