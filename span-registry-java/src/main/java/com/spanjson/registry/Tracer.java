package com.spanjson.registry;

import java.util.Objects;
import java.util.Optional;

/**
 * Instrumentation entry points bound to one {@link Dispatch}.
 *
 * Fields are passed as alternating names and values. The callsite (file, line and
 * declaring class as target) is taken from the caller's stack frame.
 */
public final class Tracer {

    private static final StackWalker WALKER = StackWalker.getInstance();

    private final Dispatch dispatch;

    public Tracer(Dispatch dispatch) {
        this.dispatch = Objects.requireNonNull(dispatch, "dispatch");
    }

    /** Tracer over the ambient dispatch, see {@link Dispatcher#current()}. */
    public static Tracer current() {
        return new Tracer(Dispatcher.current());
    }

    public Dispatch dispatch() {
        return dispatch;
    }

    // -----------------------------------------------------------------------
    // Spans
    // -----------------------------------------------------------------------

    /** Creates a span whose parent is the span current on this thread. */
    public Span span(Level level, String name, Object... fields) {
        return newSpan(level, name, null, fields);
    }

    /** Creates a span under an explicit parent; a disabled parent makes a contextual span. */
    public Span childSpan(Span parent, Level level, String name, Object... fields) {
        return newSpan(level, name, parent.id(), fields);
    }

    private Span newSpan(Level level, String name, ScopeId parent, Object... fields) {
        if (dispatch.isNone()) return Span.none();
        Callsite cs = callsite();
        Metadata meta = Metadata.span(name, cs.target, level, cs.file, cs.line);
        ScopeId id = dispatch.subscriber().newSpan(new Attributes(meta, ValueSet.of(fields), parent));
        return new Span(id, dispatch, true);
    }

    // -----------------------------------------------------------------------
    // Events
    // -----------------------------------------------------------------------

    /** Logs an event; a non-null {@code message} becomes its {@code message} field. */
    public void event(Level level, String message, Object... fields) {
        emit(level, null, message, fields);
    }

    public void eventIn(Span parent, Level level, String message, Object... fields) {
        emit(level, parent.id(), message, fields);
    }

    public void trace(String message, Object... fields) {
        emit(Level.TRACE, null, message, fields);
    }

    public void debug(String message, Object... fields) {
        emit(Level.DEBUG, null, message, fields);
    }

    public void info(String message, Object... fields) {
        emit(Level.INFO, null, message, fields);
    }

    public void warn(String message, Object... fields) {
        emit(Level.WARN, null, message, fields);
    }

    public void error(String message, Object... fields) {
        emit(Level.ERROR, null, message, fields);
    }

    private void emit(Level level, ScopeId parent, String message, Object... fields) {
        if (dispatch.isNone()) return;
        Callsite cs = callsite();
        ValueSet values = ValueSet.of(fields);
        if (message != null) {
            values = values.withFirst("message", message);
        }
        dispatch.subscriber().event(new Event(Metadata.event(cs.target, level, cs.file, cs.line), values, parent));
    }

    // -----------------------------------------------------------------------
    // Callsite resolution
    // -----------------------------------------------------------------------

    private record Callsite(String target, String file, Integer line) {}

    private static Callsite callsite() {
        Optional<StackWalker.StackFrame> frame = WALKER.walk(frames -> frames
            .filter(f -> !f.getClassName().equals(Tracer.class.getName()))
            .findFirst());
        return frame
            .map(f -> new Callsite(
                f.getClassName(),
                f.getFileName(),
                f.getLineNumber() >= 0 ? f.getLineNumber() : null))
            .orElse(new Callsite("unknown", null, null));
    }
}
