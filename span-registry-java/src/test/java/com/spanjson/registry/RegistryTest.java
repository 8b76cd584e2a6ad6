package com.spanjson.registry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RegistryTest {

    private Registry registry;
    private RecordingLayer layer;
    private Tracer tracer;

    @BeforeEach
    void setUp() {
        registry = new Registry();
        layer = new RecordingLayer();
        tracer = new Tracer(new Dispatch(registry.with(layer)));
    }

    // --- Current span stack ---

    @Test
    void enterExitTracksCurrentSpan() {
        Span outer = tracer.span(Level.INFO, "outer");
        Span inner = tracer.span(Level.INFO, "inner");
        try (Span.Entered e1 = outer.enter()) {
            assertEquals(outer.id(), registry.currentSpan());
            try (Span.Entered e2 = inner.enter()) {
                assertEquals(inner.id(), registry.currentSpan());
            }
            assertEquals(outer.id(), registry.currentSpan());
        }
        assertNull(registry.currentSpan());
    }

    @Test
    void lookupCurrentOnEmptyStackReturnsNull() {
        assertNull(registry.lookupCurrent());
    }

    @Test
    void outOfOrderExitRemovesMostRecentEntry() {
        Span a = tracer.span(Level.INFO, "a");
        Span b = tracer.span(Level.INFO, "b");
        Span.Entered ea = a.enter();
        Span.Entered eb = b.enter();
        ea.close();
        assertEquals(b.id(), registry.currentSpan());
        eb.close();
        assertNull(registry.currentSpan());
    }

    @Test
    void threadLocalStacksAreIsolated() throws InterruptedException {
        Span span = tracer.span(Level.INFO, "main-thread");
        try (Span.Entered ignored = span.enter()) {
            AtomicReference<ScopeId> seen = new AtomicReference<>(new ScopeId(99));
            Thread other = new Thread(() -> seen.set(registry.currentSpan()));
            other.start();
            other.join();
            assertNull(seen.get(), "Thread should not see main thread's current span");
        }
    }

    // --- Parents ---

    @Test
    void contextualSpanTakesCurrentAsParent() {
        Span outer = tracer.span(Level.INFO, "outer");
        try (Span.Entered ignored = outer.enter()) {
            Span inner = tracer.span(Level.INFO, "inner");
            assertSame(registry.span(outer.id()), registry.span(inner.id()).parent());
        }
    }

    @Test
    void explicitParentIgnoresCurrentSpan() {
        Span a = tracer.span(Level.INFO, "a");
        Span b = tracer.span(Level.INFO, "b");
        try (Span.Entered ignored = b.enter()) {
            Span child = tracer.childSpan(a, Level.INFO, "child");
            assertEquals("a", registry.span(child.id()).parent().name());
        }
    }

    @Test
    void scopeFromRootListsAncestorsRootFirst() {
        Span a = tracer.span(Level.INFO, "a");
        Span.Entered ea = a.enter();
        Span b = tracer.span(Level.INFO, "b");
        Span.Entered eb = b.enter();
        Span c = tracer.span(Level.INFO, "c");

        SpanRef ref = registry.span(c.id());
        assertEquals(List.of("a", "b", "c"), ref.scopeFromRoot().stream().map(SpanRef::name).collect(Collectors.toList()));
        assertEquals(List.of("c", "b", "a"), ref.scope().stream().map(SpanRef::name).collect(Collectors.toList()));
        eb.close();
        ea.close();
    }

    @Test
    void ancestorChainSurvivesParentClose() {
        Span outer = tracer.span(Level.INFO, "outer");
        Span inner = tracer.childSpan(outer, Level.INFO, "inner");
        outer.close();
        assertNull(registry.span(outer.id()));
        assertEquals("outer", registry.span(inner.id()).parent().name());
    }

    // --- Layer callbacks ---

    @Test
    void layerSeesCallbacksInOrder() {
        try (Span span = tracer.span(Level.INFO, "work", "a", 1)) {
            try (Span.Entered ignored = span.enter()) {
                span.record("b", 2);
                tracer.info("hello");
            }
        }
        assertEquals(List.of(
            "new:work", "enter:work", "record:work:b", "event:hello@work", "exit:work", "close:work"),
            layer.calls);
    }

    @Test
    void eventWithExplicitParentResolvesThatSpan() {
        Span a = tracer.span(Level.INFO, "a");
        tracer.eventIn(a, Level.INFO, "explicit");
        tracer.info("contextual");
        assertTrue(layer.calls.contains("event:explicit@a"));
        assertTrue(layer.calls.contains("event:contextual@-"));
    }

    @Test
    void closeIsIdempotentOnHandle() {
        Span span = tracer.span(Level.INFO, "once");
        span.close();
        span.close();
        assertEquals(1, layer.calls.stream().filter(c -> c.startsWith("close:")).count());
        assertEquals(0, registry.openSpans());
    }

    @Test
    void currentHandleDoesNotCloseSpan() {
        Span span = tracer.span(Level.INFO, "owned");
        try (Span.Entered ignored = span.enter()) {
            Span.current(tracer.dispatch()).close();
            assertNotNull(registry.span(span.id()));
        }
    }

    // --- Contract violations ---

    @Test
    void enterUnknownSpanIsContractViolation() {
        assertThrows(ContractViolationException.class, () -> registry.enter(new ScopeId(42)));
    }

    @Test
    void closeUnknownSpanIsContractViolation() {
        Layered layered = registry.with(layer);
        assertThrows(ContractViolationException.class, () -> layered.close(new ScopeId(42)));
        assertTrue(layer.calls.isEmpty(), "layers must not see a close for an unknown span");
    }

    // --- Concurrency ---

    @Test
    void concurrentSpanCreationYieldsUniqueIds() throws InterruptedException {
        int threadCount = 50;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        ExecutorService pool = Executors.newFixedThreadPool(threadCount);
        Set<ScopeId> ids = ConcurrentHashMap.newKeySet();

        for (int i = 0; i < threadCount; i++) {
            pool.submit(() -> {
                try {
                    start.await();
                    ids.add(tracer.span(Level.INFO, "concurrent").id());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        done.await(5, TimeUnit.SECONDS);
        pool.shutdown();

        assertEquals(threadCount, ids.size());
        assertEquals(threadCount, registry.openSpans());
    }

    @Test
    void spanEnteredOnOneThreadCanBeClosedOnAnother() throws Exception {
        Span span = tracer.span(Level.INFO, "hop");
        span.inScope(() -> null);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            pool.submit(() -> {
                span.inScope(() -> null);
                span.close();
            }).get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdown();
        }
        assertEquals(List.of("new:hop", "enter:hop", "exit:hop", "enter:hop", "exit:hop", "close:hop"), layer.calls);
    }

    @Test
    void guardClosedOnForeignThreadIsContractViolation() throws Exception {
        Span span = tracer.span(Level.INFO, "pinned");
        Span.Entered entered = span.enter();
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> exit = pool.submit(entered::close);
            ExecutionException e = assertThrows(ExecutionException.class, () -> exit.get(5, TimeUnit.SECONDS));
            assertInstanceOf(ContractViolationException.class, e.getCause());
        } finally {
            pool.shutdown();
        }
        assertEquals(span.id(), registry.currentSpan(), "span stays entered on the owning thread");
        entered.close();
        assertNull(registry.currentSpan());
    }

    @Test
    void closePrunesStackOfClosingThread() {
        Span span = tracer.span(Level.INFO, "left-open");
        span.enter();
        span.close();
        assertEquals(0, registry.stackDepth());
        assertNull(registry.currentSpan());
    }

    @Test
    void spanClosedElsewhereDropsOutOfEnteringThreadsStack() throws Exception {
        Span outer = tracer.span(Level.INFO, "outer");
        Span moved = tracer.span(Level.INFO, "moved");
        try (Span.Entered e = outer.enter()) {
            moved.enter();
            ExecutorService pool = Executors.newSingleThreadExecutor();
            try {
                pool.submit(moved::close).get(5, TimeUnit.SECONDS);
            } finally {
                pool.shutdown();
            }
            assertEquals(outer.id(), registry.currentSpan());
            assertEquals(1, registry.stackDepth());
        }
        assertEquals(0, registry.stackDepth());
    }
}
