package com.spanjson.registry;

/**
 * Span lookup offered by a host engine to its layers.
 */
public interface LookupSpan {

    /** Returns the open span with this id, or null. */
    SpanRef span(ScopeId id);

    /** Returns the span current on the calling thread, or null. */
    SpanRef lookupCurrent();
}
