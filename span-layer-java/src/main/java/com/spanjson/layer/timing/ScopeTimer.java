package com.spanjson.layer.timing;

import com.spanjson.registry.ContractViolationException;
import com.spanjson.registry.Extensions;
import com.spanjson.registry.SpanRef;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Measures a span's total lifetime, from its first entry to its close.
 *
 * A span can be entered many times (e.g. resumed on several threads between suspension
 * points); only the first entry is timed, so the result is wall-clock lifetime and not
 * the sum of active periods.
 */
public final class ScopeTimer {

    /** Slot type, private so no other layer can read or clobber it. */
    private record StartInstant(long nanos) {}

    private final LongSupplier clock;

    public ScopeTimer() {
        this(System::nanoTime);
    }

    /** @param clock monotonic nanosecond source */
    public ScopeTimer(LongSupplier clock) {
        this.clock = clock;
    }

    /**
     * Stores the start instant unless one is already attached.
     *
     * @return true if this call attached it, i.e. this is the span's first entry
     */
    public boolean attachIfAbsent(SpanRef span) {
        try (Extensions ext = span.extensions()) {
            if (ext.contains(StartInstant.class)) {
                return false;
            }
            ext.insert(StartInstant.class, new StartInstant(clock.getAsLong()));
            return true;
        }
    }

    /** Time since the first entry. A span closed without ever being entered is a host bug. */
    public Duration elapsedSinceStart(SpanRef span) {
        StartInstant start;
        try (Extensions ext = span.extensions()) {
            start = ext.get(StartInstant.class);
        }
        if (start == null) {
            throw new ContractViolationException(
                "start not found for span '" + span.name() + "' on close, this is a bug");
        }
        return Duration.ofNanos(clock.getAsLong() - start.nanos());
    }
}
