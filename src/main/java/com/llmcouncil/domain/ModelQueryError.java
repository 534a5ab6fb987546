package com.llmcouncil.domain;

import java.util.Objects;

/**
 * Immutable description of one failed model call.
 *
 * <p>Produced by the model caller and surfaced unchanged through every stage of a deliberation.
 *
 * @param model      configured model identifier that failed
 * @param kind       failure classification
 * @param message    human-readable reason (preserved verbatim for {@link ErrorKind#UNKNOWN})
 * @param statusCode HTTP status when one was received, otherwise {@code null}
 */
public record ModelQueryError(
        String model,
        ErrorKind kind,
        String message,
        Integer statusCode
) {

    public ModelQueryError {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(kind, "kind");
        message = message == null ? "" : message;
    }

    public static ModelQueryError of(String model, ErrorKind kind, String message) {
        return new ModelQueryError(model, kind, message, null);
    }
}
