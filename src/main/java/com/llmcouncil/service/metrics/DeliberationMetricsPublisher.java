package com.llmcouncil.service.metrics;

import com.llmcouncil.domain.ModelQueryError;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe facade over {@link DeliberationMetrics} used by the fan-out and orchestration code.
 *
 * <p>All methods are no-ops when constructed without metrics, which lets services run in unit
 * tests without a registry.
 *
 * @see DeliberationMetrics
 */
@Component
public final class DeliberationMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(DeliberationMetricsPublisher.class);

    static final String OUTCOME_SUCCESS = "success";

    /** Singleton no-op instance for tests. */
    public static final DeliberationMetricsPublisher NOOP = new DeliberationMetricsPublisher(null);

    private final DeliberationMetrics metrics;

    public DeliberationMetricsPublisher(DeliberationMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("DeliberationMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordCallSuccess(String model, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordModelCallLatency(model, OUTCOME_SUCCESS, durationNanos);
    }

    public void recordCallFailure(ModelQueryError error, long durationNanos) {
        if (metrics == null) {
            return;
        }
        String kind = error.kind().wireName();
        metrics.recordModelCallLatency(error.model(), kind, durationNanos);
        metrics.incrementModelFailure(error.model(), kind);
    }

    public void recordStage(String stage, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordStageDuration(stage, durationNanos);
    }

    public void recordDeliberation(String mode, String outcome) {
        if (metrics == null) {
            return;
        }
        metrics.incrementDeliberation(mode, outcome);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
