package com.spanjson.registry;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Handle to a span created through a {@link Tracer}.
 *
 * <pre>{@code
 * try (Span span = tracer.span(Level.DEBUG, "shaving_yaks", "a", 2);
 *      Span.Entered entered = span.enter()) {
 *     tracer.info("pre-shaving yaks");
 * }
 * }</pre>
 *
 * Closing the handle closes the span. Handles obtained from {@link #current()} do not own
 * the span and closing them does nothing. Disabled spans (created without a subscriber)
 * accept every call and do nothing.
 */
public final class Span implements AutoCloseable {

    private static final Span NONE = new Span(null, Dispatch.NONE, false);

    private final ScopeId id;
    private final Dispatch dispatch;
    private final boolean owning;
    private final AtomicBoolean closed = new AtomicBoolean();

    Span(ScopeId id, Dispatch dispatch, boolean owning) {
        this.id = id;
        this.dispatch = dispatch;
        this.owning = owning;
    }

    public static Span none() {
        return NONE;
    }

    /** Non-owning handle to the span current on this thread under the ambient dispatch. */
    public static Span current() {
        return current(Dispatcher.current());
    }

    public static Span current(Dispatch dispatch) {
        if (dispatch.isNone()) return NONE;
        ScopeId current = dispatch.subscriber().currentSpan();
        return current == null ? NONE : new Span(current, dispatch, false);
    }

    public ScopeId id() {
        return id;
    }

    public Dispatch dispatch() {
        return dispatch;
    }

    public boolean isDisabled() {
        return id == null;
    }

    public Entered enter() {
        if (!isDisabled()) {
            dispatch.subscriber().enter(id);
        }
        return new Entered(this);
    }

    /** Runs {@code action} with this span entered on the calling thread. */
    public <T> T inScope(Supplier<T> action) {
        try (Entered ignored = enter()) {
            return action.get();
        }
    }

    public Span record(String name, Object value) {
        if (!isDisabled() && value != null) {
            dispatch.subscriber().record(id, RecordedValues.of(name, value));
        }
        return this;
    }

    @Override
    public void close() {
        if (isDisabled() || !owning) return;
        if (closed.compareAndSet(false, true)) {
            dispatch.subscriber().close(id);
        }
    }

    @Override
    public String toString() {
        return isDisabled() ? "Span(disabled)" : "Span(" + id.value() + ")";
    }

    /**
     * Guard returned by {@link #enter()}; closing it exits the span on this thread.
     *
     * The guard is bound to the entering thread. A span resumed elsewhere is entered again
     * on that thread with its own guard.
     */
    public static final class Entered implements AutoCloseable {

        private final Span span;
        private final Thread owner = Thread.currentThread();
        private boolean exited;

        private Entered(Span span) {
            this.span = span;
        }

        @Override
        public void close() {
            if (exited || span.isDisabled()) return;
            if (Thread.currentThread() != owner) {
                throw new ContractViolationException("span " + span.id + " entered on " + owner.getName()
                    + " but exited on " + Thread.currentThread().getName() + ", this is a bug");
            }
            exited = true;
            span.dispatch.subscriber().exit(span.id);
        }
    }
}
