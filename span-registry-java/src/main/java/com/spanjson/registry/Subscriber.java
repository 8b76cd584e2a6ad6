package com.spanjson.registry;

import java.util.Optional;

/**
 * Receives every instrumentation call made through a {@link Dispatch}.
 */
public interface Subscriber {

    ScopeId newSpan(Attributes attributes);

    void record(ScopeId id, RecordedValues values);

    void enter(ScopeId id);

    void exit(ScopeId id);

    void event(Event event);

    /** Closes the span for good. Called exactly once per span. */
    void close(ScopeId id);

    /** Returns the id of the span current on the calling thread, or null. */
    ScopeId currentSpan();

    /**
     * Returns this subscriber, or a component it is composed of, viewed as {@code type}.
     * This is how code that only holds a {@link Dispatch} reaches a concrete layer.
     */
    default <T> Optional<T> downcast(Class<T> type) {
        return type.isInstance(this) ? Optional.of(type.cast(this)) : Optional.empty();
    }
}
