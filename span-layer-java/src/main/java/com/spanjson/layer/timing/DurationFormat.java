package com.spanjson.layer.timing;

import java.time.Duration;
import java.util.Locale;

/**
 * Human-readable durations in the coarsest unit that keeps three significant digits:
 * {@code 500ns}, {@code 1.500us}, {@code 12.35ms}, {@code 1.000s}.
 */
public final class DurationFormat {

    private DurationFormat() {}

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    public static String format(Duration duration) {
        long nanos;
        try {
            nanos = Math.addExact(
                Math.multiplyExact(duration.getSeconds(), NANOS_PER_SECOND),
                duration.getNano());
        } catch (ArithmeticException e) {
            // beyond ~292 years of nanoseconds
            return duration.getSeconds() + "s";
        }

        if (nanos < 1_000L) {
            return nanos + "ns";
        } else if (nanos < 1_000_000L) {
            return fraction(nanos / 1_000.0, "us");
        } else if (nanos < NANOS_PER_SECOND) {
            return fraction(nanos / 1_000_000.0, "ms");
        } else {
            return fraction(nanos / (double) NANOS_PER_SECOND, "s");
        }
    }

    private static String fraction(double value, String unit) {
        int decimals;
        if (value < 10.0) {
            decimals = 3;
        } else if (value < 100.0) {
            decimals = 2;
        } else if (value < 1000.0) {
            decimals = 1;
        } else {
            decimals = 0;
        }
        return String.format(Locale.ROOT, "%." + decimals + "f%s", value, unit);
    }
}
