package com.llmcouncil.service.council;

import com.llmcouncil.domain.ModelQueryError;
import com.llmcouncil.domain.Stage1Result;

import java.util.List;

/**
 * Stage 1 batch: successes in call-issue order plus the failed members.
 */
public record Stage1Outcome(List<Stage1Result> results, List<ModelQueryError> errors) {

    public Stage1Outcome {
        results = List.copyOf(results);
        errors = List.copyOf(errors);
    }
}
