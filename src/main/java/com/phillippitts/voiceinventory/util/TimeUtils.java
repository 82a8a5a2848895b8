package com.phillippitts.voiceinventory.util;

/**
 * Elapsed-time and backoff helpers for {@link System#nanoTime()} based timing.
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
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
     * Exponential backoff before retry number {@code attempt}: {@code initial * 2^(attempt-1)},
     * capped at {@code max}.
     *
     * @param attempt 1 for the delay after the first failure
     */
    public static long backoffMillis(long initialMs, long maxMs, int attempt) {
        if (attempt < 1 || initialMs <= 0) {
            return 0L;
        }
        long delay = initialMs;
        for (int i = 1; i < attempt && delay < maxMs; i++) {
            delay *= 2;
        }
        return Math.min(delay, maxMs);
    }
}
