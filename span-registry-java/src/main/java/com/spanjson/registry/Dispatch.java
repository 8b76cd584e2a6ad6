package com.spanjson.registry;

import java.util.Objects;
import java.util.Optional;

/**
 * Handle to the subscriber instrumentation calls are sent to.
 *
 * {@link #NONE} discards everything; spans created through it are disabled.
 */
public final class Dispatch {

    public static final Dispatch NONE = new Dispatch();

    private final Subscriber subscriber;

    public Dispatch(Subscriber subscriber) {
        this.subscriber = Objects.requireNonNull(subscriber, "subscriber");
    }

    private Dispatch() {
        this.subscriber = null;
    }

    public boolean isNone() {
        return subscriber == null;
    }

    public Subscriber subscriber() {
        if (subscriber == null) {
            throw new IllegalStateException("Dispatch.NONE has no subscriber");
        }
        return subscriber;
    }

    /** Returns the subscriber, or one of its layers or capabilities, as {@code type}. */
    public <T> Optional<T> downcast(Class<T> type) {
        return subscriber == null ? Optional.empty() : subscriber.downcast(type);
    }

    @Override
    public String toString() {
        return subscriber == null ? "Dispatch(none)" : "Dispatch(" + subscriber.getClass().getSimpleName() + ")";
    }
}
