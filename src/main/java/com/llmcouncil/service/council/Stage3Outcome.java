package com.llmcouncil.service.council;

import com.llmcouncil.domain.ModelQueryError;
import com.llmcouncil.domain.Stage3Result;

import java.util.List;

/**
 * Chairman outcome: {@code result} is {@code null} exactly when {@code errors} is non-empty,
 * or when the chairman was never asked.
 */
public record Stage3Outcome(Stage3Result result, List<ModelQueryError> errors) {

    public static final Stage3Outcome SKIPPED = new Stage3Outcome(null, List.of());

    public Stage3Outcome {
        errors = List.copyOf(errors);
    }
}
