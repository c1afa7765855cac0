package com.phillippitts.hybridinference.util;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * <p>Routing latencies are reported in fractional milliseconds, measured with
 * {@link System#nanoTime()}.
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
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Elapsed time since a nanosecond timestamp as fractional milliseconds.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds, sub-millisecond precision
     */
    public static double elapsedMillisPrecise(long startNanos) {
        return (System.nanoTime() - startNanos) / (double) NANOS_PER_MILLI;
    }
}
