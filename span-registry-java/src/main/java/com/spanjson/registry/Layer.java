package com.spanjson.registry;

import java.util.Optional;

/**
 * Observer composed onto a {@link Registry}. The registry owns span storage; layers
 * only react to lifecycle callbacks and keep their own data in span {@link Extensions}.
 *
 * Callbacks run synchronously on the thread making the instrumentation call.
 */
public interface Layer {

    default void onNewSpan(Attributes attributes, ScopeId id, Context ctx) {}

    default void onRecord(ScopeId id, RecordedValues values, Context ctx) {}

    default void onEnter(ScopeId id, Context ctx) {}

    default void onExit(ScopeId id, Context ctx) {}

    default void onEvent(Event event, Context ctx) {}

    /** Called before the registry drops the span, so its extensions are still readable. */
    default void onClose(ScopeId id, Context ctx) {}

    /** Layers may expose internal capabilities here, in addition to themselves. */
    default <T> Optional<T> downcast(Class<T> type) {
        return type.isInstance(this) ? Optional.of(type.cast(this)) : Optional.empty();
    }
}
