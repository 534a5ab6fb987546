package com.llmcouncil.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldMeasureElapsedFromPastTimestamp() {
        long startNanos = System.nanoTime() - TimeUnit.SECONDS.toNanos(1);

        assertThat(TimeUtils.elapsedMillis(startNanos)).isBetween(1000L, 1100L);
        assertThat(TimeUtils.elapsedNanos(startNanos)).isGreaterThanOrEqualTo(TimeUnit.SECONDS.toNanos(1));
    }

    @Test
    void shouldBeNearZeroForCurrentTime() {
        assertThat(TimeUtils.elapsedMillis(System.nanoTime())).isLessThan(50L);
    }
}
