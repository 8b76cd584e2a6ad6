package com.spanjson.registry;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe in-memory span store: the host engine layers are composed onto.
 *
 * Tracks, per thread, the stack of spans entered and not yet exited. A span may be
 * entered on one thread and exited, re-entered or closed on another; each thread only
 * sees its own stack.
 *
 * Usage:
 * <pre>{@code
 * Layered subscriber = new Registry().with(layer);
 * Tracer tracer = new Tracer(new Dispatch(subscriber));
 * }</pre>
 */
public class Registry implements Subscriber, LookupSpan {

    private final ConcurrentHashMap<ScopeId, SpanRef> spans = new ConcurrentHashMap<>();

    private final AtomicLong nextId = new AtomicLong(1);

    // Per-thread stack of entered span ids, most recent first
    private final ThreadLocal<Deque<ScopeId>> stack = ThreadLocal.withInitial(ArrayDeque::new);

    /** Composes {@code layer} onto this registry. */
    public Layered with(Layer layer) {
        return new Layered(this).with(layer);
    }

    // -----------------------------------------------------------------------
    // Span lifecycle
    // -----------------------------------------------------------------------

    @Override
    public ScopeId newSpan(Attributes attributes) {
        SpanRef parent;
        if (attributes.isContextual()) {
            parent = lookupCurrent();
        } else {
            parent = require(attributes.parent(), "newSpan parent");
        }
        ScopeId id = new ScopeId(nextId.getAndIncrement());
        spans.put(id, new SpanRef(id, attributes.metadata(), parent));
        return id;
    }

    @Override
    public void record(ScopeId id, RecordedValues values) {
        require(id, "record");
    }

    @Override
    public void enter(ScopeId id) {
        require(id, "enter");
        stack.get().push(id);
    }

    /** Removes the most recent entry of {@code id}; exits need not be strictly nested. */
    @Override
    public void exit(ScopeId id) {
        stack.get().removeFirstOccurrence(id);
    }

    @Override
    public void event(Event event) {
        // events are not stored
    }

    @Override
    public void close(ScopeId id) {
        if (spans.remove(id) == null) {
            throw new ContractViolationException("span " + id + " closed twice or never opened, this is a bug");
        }
        stack.get().removeIf(id::equals);
    }

    // -----------------------------------------------------------------------
    // Lookup
    // -----------------------------------------------------------------------

    /** Entries of spans closed on another thread are dropped as they are passed over. */
    @Override
    public ScopeId currentSpan() {
        Iterator<ScopeId> it = stack.get().iterator();
        while (it.hasNext()) {
            ScopeId id = it.next();
            if (spans.containsKey(id)) return id;
            it.remove();
        }
        return null;
    }

    /** Depth of the calling thread's entered-span stack. */
    int stackDepth() {
        return stack.get().size();
    }

    @Override
    public SpanRef span(ScopeId id) {
        return id == null ? null : spans.get(id);
    }

    @Override
    public SpanRef lookupCurrent() {
        return span(currentSpan());
    }

    /** Number of spans created and not yet closed. */
    public int openSpans() {
        return spans.size();
    }

    SpanRef require(ScopeId id, String operation) {
        SpanRef span = span(id);
        if (span == null) {
            throw new ContractViolationException(
                "span " + id + " not found on '" + operation + "', this is a bug");
        }
        return span;
    }
}
