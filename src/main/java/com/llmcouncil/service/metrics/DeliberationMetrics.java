package com.llmcouncil.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for council deliberations.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Per-model call latency, tagged with outcome (success or the error kind)</li>
 *   <li>Per-model failure counts by error kind</li>
 *   <li>Wall-clock duration of each stage</li>
 *   <li>Completed turns by mode and outcome</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class DeliberationMetrics {

    private static final String METRIC_PREFIX = "council";

    private final MeterRegistry registry;

    public DeliberationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordModelCallLatency(String model, String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".model.call.latency")
                .description("Time taken by a single chat-completion call")
                .tag("model", model)
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementModelFailure(String model, String kind) {
        Counter.builder(METRIC_PREFIX + ".model.call.failure")
                .description("Number of failed model calls")
                .tag("model", model)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    /**
     * Records the duration of one stage: stage1, stage2, stage3, context or title.
     */
    public void recordStageDuration(String stage, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".stage.duration")
                .description("Wall-clock duration of a deliberation stage")
                .tag("stage", stage)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts a finished turn.
     *
     * @param mode    council or chairman_direct
     * @param outcome complete (final answer present), degraded (no final answer) or cancelled
     */
    public void incrementDeliberation(String mode, String outcome) {
        Counter.builder(METRIC_PREFIX + ".deliberation")
                .description("Number of deliberation turns by mode and outcome")
                .tag("mode", mode)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
