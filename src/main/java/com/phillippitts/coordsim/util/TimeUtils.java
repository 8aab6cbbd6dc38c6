package com.phillippitts.coordsim.util;

import java.time.Duration;

/**
 * Time conversions used when recording stage and session durations.
 *
 * @since 1.0
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
     * Calculates elapsed time since a nanosecond timestamp.
     *
     * <pre>
     * long startTime = System.nanoTime();
     * // ... call collaborator ...
     * Duration elapsed = TimeUtils.elapsedSince(startTime);
     * </pre>
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed duration, never negative
     */
    public static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(Math.max(0L, System.nanoTime() - startNanos));
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
     * Converts a duration to fractional seconds.
     *
     * @param duration duration to convert (null is treated as zero)
     * @return seconds with nanosecond precision
     */
    public static double toSeconds(Duration duration) {
        if (duration == null) {
            return 0.0;
        }
        return duration.toNanos() / 1_000_000_000.0;
    }
}
