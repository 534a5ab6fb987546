package com.llmcouncil.service.events;

import com.llmcouncil.domain.ErrorKind;
import com.llmcouncil.domain.ModelQueryError;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns model-call failures that point at an operator problem into one actionable log line.
 *
 * <p>Auth, payment and not-found failures mean the deployment is misconfigured and will keep
 * failing, so they are logged at WARN, throttled to once per minute per model and kind.
 * Transient kinds are logged at DEBUG only; the per-stage summary already reports them.
 */
@Component
class ModelFailureEventsListener {
    private static final Logger LOG = LogManager.getLogger(ModelFailureEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    @EventListener
    void onModelCallFailed(ModelCallFailedEvent e) {
        ModelQueryError error = e.error();
        ErrorKind kind = error.kind();
        if (kind == ErrorKind.AUTH || kind == ErrorKind.PAYMENT || kind == ErrorKind.NOT_FOUND) {
            if (shouldLog(kind.wireName() + '-' + error.model())) {
                LOG.warn("Model call rejected: model={}, kind={}. {}", error.model(), kind.wireName(),
                        actionFor(kind));
            }
        } else if (LOG.isDebugEnabled()) {
            LOG.debug("Model call failed: model={}, kind={}, message={}",
                    error.model(), kind.wireName(), error.message());
        }
    }

    private static String actionFor(ErrorKind kind) {
        return switch (kind) {
            case AUTH -> "Check council.openrouter.api-key.";
            case PAYMENT -> "Add credits to the OpenRouter account.";
            default -> "Check the model id in council.models or the conversation config.";
        };
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
