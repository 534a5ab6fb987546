package com.llmcouncil.service.council;

import com.llmcouncil.domain.ModelQueryError;
import com.llmcouncil.domain.RawRanking;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record Stage2Outcome(List<RawRanking> rankings, Map<String, String> labelToModel,
                            List<ModelQueryError> errors) {

    public Stage2Outcome {
        rankings = List.copyOf(rankings);
        labelToModel = Collections.unmodifiableMap(new LinkedHashMap<>(labelToModel));
        errors = List.copyOf(errors);
    }
}
