package com.phillippitts.liveagent.util;

import java.time.Duration;

/**
 * Utility methods for monotonic time arithmetic.
 *
 * <p>Pipeline timers (vision FPS throttling, snapshot age, idle timeout, session duration) work on
 * {@link System#nanoTime()} values so wall-clock adjustments never affect them.
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
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Returns {@code true} when {@code window} has fully elapsed between two monotonic readings.
     * A zero or negative window always counts as elapsed.
     */
    public static boolean hasElapsed(long sinceNanos, long nowNanos, Duration window) {
        return nowNanos - sinceNanos >= window.toNanos();
    }
}
