package com.llmcouncil.util;

import java.util.concurrent.TimeUnit;

/**
 * Elapsed-time helpers over {@link System#nanoTime()} timestamps, for stage and call timing.
 */
public final class TimeUtils {

    private TimeUtils() {
    }

    public static long elapsedNanos(long startNanos) {
        return System.nanoTime() - startNanos;
    }

    public static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(elapsedNanos(startNanos));
    }
}
