package com.phillippitts.peervoice.util;

import java.time.Duration;

/**
 * Utility methods for time conversions and elapsed time calculations.
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
     * Duration of {@code sampleCount} samples at {@code sampleRate} Hz.
     */
    public static Duration samplesToDuration(long sampleCount, int sampleRate) {
        return Duration.ofNanos(sampleCount * 1_000_000_000L / sampleRate);
    }

    /**
     * Number of samples covering {@code millis} at {@code sampleRate} Hz.
     */
    public static int millisToSamples(long millis, int sampleRate) {
        return (int) (millis * sampleRate / 1000L);
    }
}
