package com.phillippitts.duplexvoice.util;

import java.time.Instant;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * <p>Latency is measured with {@link System#nanoTime()}; turn timing is kept as epoch
 * milliseconds so it can be converted to {@link Instant} for events.
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds.
     *
     * @param nanos time in nanoseconds
     * @return time in milliseconds (truncated)
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Calculates elapsed nanoseconds since a {@link System#nanoTime()} timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed nanoseconds since startNanos
     */
    public static long elapsedNanos(long startNanos) {
        return System.nanoTime() - startNanos;
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return elapsedNanos(startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Converts epoch milliseconds to an {@link Instant}; {@code 0} maps to {@link Instant#EPOCH}.
     */
    public static Instant toInstant(long epochMillis) {
        return Instant.ofEpochMilli(epochMillis);
    }
}
