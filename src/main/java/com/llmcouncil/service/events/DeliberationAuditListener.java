package com.llmcouncil.service.events;

import com.llmcouncil.service.orchestration.event.DeliberationCompletedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * One audit line per finished turn. Turns without a final answer are logged at WARN.
 */
@Component
class DeliberationAuditListener {
    private static final Logger LOG = LogManager.getLogger(DeliberationAuditListener.class);

    private final AtomicLong turns = new AtomicLong();
    private final AtomicLong degraded = new AtomicLong();

    @EventListener
    void onDeliberationCompleted(DeliberationCompletedEvent e) {
        long total = turns.incrementAndGet();
        if (e.finalAnswer()) {
            LOG.info("Turn audit: conversation={}, mode={}, failedCalls={}, durationMs={}",
                    e.conversationId(), e.mode().wireName(), e.failedCalls(), e.durationMs());
        } else {
            long d = degraded.incrementAndGet();
            LOG.warn("Turn without final answer: conversation={}, mode={}, failedCalls={}, durationMs={} ({} of {} turns)",
                    e.conversationId(), e.mode().wireName(), e.failedCalls(), e.durationMs(), d, total);
        }
    }

    long turns() {
        return turns.get();
    }

    long degradedTurns() {
        return degraded.get();
    }
}
