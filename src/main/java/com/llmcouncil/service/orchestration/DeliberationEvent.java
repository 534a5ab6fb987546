package com.llmcouncil.service.orchestration;

import com.llmcouncil.domain.ModelQueryError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One observational checkpoint of a turn.
 *
 * @param type     checkpoint
 * @param data     stage output ({@code null} for start events)
 * @param metadata extra stage output, e.g. label map and aggregates after Stage 2
 * @param errors   model errors of the stage just completed
 * @param message  human-readable text for {@link DeliberationEventType#ERROR}
 */
public record DeliberationEvent(DeliberationEventType type, Object data, Map<String, Object> metadata,
                                List<ModelQueryError> errors, String message) {

    public DeliberationEvent {
        Objects.requireNonNull(type, "type");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static DeliberationEvent of(DeliberationEventType type) {
        return new DeliberationEvent(type, null, null, null, null);
    }

    public static DeliberationEvent completed(DeliberationEventType type, Object data, List<ModelQueryError> errors) {
        return new DeliberationEvent(type, data, null, errors, null);
    }

    public static DeliberationEvent error(String message, List<ModelQueryError> errors) {
        return new DeliberationEvent(DeliberationEventType.ERROR, null, null, errors, message);
    }
}
