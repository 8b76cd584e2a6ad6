package com.spanjson.registry;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Type-keyed slots where layers attach their own per-span data.
 *
 * Obtained locked from {@link SpanRef#extensions()} and released by {@link #close()}:
 * <pre>{@code
 * try (Extensions ext = span.extensions()) {
 *     ext.insert(MyData.class, new MyData());
 * }
 * }</pre>
 * The lock is reentrant, so a layer that logs while holding it does not deadlock itself.
 * Slots live as long as the span and are dropped with it when the registry closes it.
 */
public final class Extensions implements AutoCloseable {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Class<?>, Object> slots = new HashMap<>();

    Extensions acquire() {
        lock.lock();
        return this;
    }

    /** Returns the value stored under {@code type}, or null. */
    public <T> T get(Class<T> type) {
        checkHeld();
        return type.cast(slots.get(type));
    }

    public boolean contains(Class<?> type) {
        checkHeld();
        return slots.containsKey(type);
    }

    /**
     * Stores {@code value} under {@code type}. Each type may be inserted once per span;
     * two writers racing for the same slot is a wiring error.
     */
    public <T> void insert(Class<T> type, T value) {
        checkHeld();
        if (slots.containsKey(type)) {
            throw new ContractViolationException(
                "extensions already contain a " + type.getName() + ", this is a bug");
        }
        slots.put(type, type.cast(value));
    }

    @Override
    public void close() {
        lock.unlock();
    }

    private void checkHeld() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("span extensions used outside of SpanRef.extensions()");
        }
    }
}
