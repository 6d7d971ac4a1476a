package com.phillippitts.captionhub.util;

/**
 * Conversions for {@link System#nanoTime()} durations reported in logs.
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
     * Converts a nanosecond duration to whole milliseconds, truncating toward zero.
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }
}
