package com.phillippitts.scantomack.util;

import java.time.Duration;

/**
 * Helpers for {@link System#nanoTime()} based timing and deadlines.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Deadline in {@link System#nanoTime()} units, saturating instead of overflowing.
     */
    public static long deadlineAfter(Duration timeout) {
        long now = System.nanoTime();
        long nanos = timeout.toNanos();
        return Long.MAX_VALUE - now < nanos ? Long.MAX_VALUE : now + nanos;
    }

    /**
     * @return nanoseconds left until the deadline, never negative
     */
    public static long remainingNanos(long deadlineNanos) {
        return Math.max(0L, deadlineNanos - System.nanoTime());
    }
}
