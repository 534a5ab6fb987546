package com.llmcouncil.service.council;

import com.llmcouncil.domain.ModelQueryError;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

final class StageLogging {

    private static final Logger LOG = LogManager.getLogger(StageLogging.class);

    private StageLogging() {
    }

    static void logOutcome(String stage, int successes, List<ModelQueryError> errors) {
        LOG.info("{} complete: successes={}, failures={}", stage, successes, errors.size());
        for (ModelQueryError e : errors) {
            LOG.warn("{} member failed: model={}, kind={}, message={}", stage, e.model(),
                    e.kind().wireName(), e.message());
        }
    }
}
