package com.llmcouncil.service.events;

import com.llmcouncil.domain.ModelQueryError;

import java.time.Instant;
import java.util.Objects;

/**
 * Published for every classified model-call failure, whichever stage issued the call.
 */
public record ModelCallFailedEvent(ModelQueryError error, Instant at) {

    public ModelCallFailedEvent {
        Objects.requireNonNull(error, "error");
        at = at == null ? Instant.now() : at;
    }

    public static ModelCallFailedEvent of(ModelQueryError error) {
        return new ModelCallFailedEvent(error, Instant.now());
    }
}
