package com.llmcouncil.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything one user turn produced.
 *
 * <p>Every stage's output is kept next to that stage's errors, so a caller always sees which
 * members failed and why. {@code stage3} is {@code null} when the chairman failed or was never
 * asked; in that case {@code failureSummary} explains the degradation. In chairman-direct mode
 * the stage 1 and stage 2 fields are empty.
 */
public record DeliberationResult(
        DeliberationMode mode,
        List<Stage1Result> stage1,
        List<ModelQueryError> stage1Errors,
        List<RawRanking> stage2,
        List<ModelQueryError> stage2Errors,
        Map<String, String> labelToModel,
        List<AggregateRankingEntry> aggregateRankings,
        List<TournamentRankingEntry> tournamentRankings,
        Stage3Result stage3,
        List<ModelQueryError> stage3Errors,
        String failureSummary
) {

    public DeliberationResult {
        Objects.requireNonNull(mode, "mode");
        stage1 = copy(stage1);
        stage1Errors = copy(stage1Errors);
        stage2 = copy(stage2);
        stage2Errors = copy(stage2Errors);
        labelToModel = labelToModel == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(labelToModel));
        aggregateRankings = copy(aggregateRankings);
        tournamentRankings = copy(tournamentRankings);
        stage3Errors = copy(stage3Errors);
    }

    /**
     * Builds the subset returned by chairman-direct mode: no ranking metadata.
     */
    public static DeliberationResult chairmanDirect(Stage3Result stage3,
                                                    List<ModelQueryError> stage3Errors,
                                                    String failureSummary) {
        return new DeliberationResult(DeliberationMode.CHAIRMAN_DIRECT,
                List.of(), List.of(), List.of(), List.of(), Map.of(), List.of(), List.of(),
                stage3, stage3Errors, failureSummary);
    }

    public boolean hasFinalAnswer() {
        return stage3 != null;
    }

    /**
     * All errors in stage order.
     */
    public List<ModelQueryError> allErrors() {
        int size = stage1Errors.size() + stage2Errors.size() + stage3Errors.size();
        ArrayList<ModelQueryError> all = new ArrayList<>(size);
        all.addAll(stage1Errors);
        all.addAll(stage2Errors);
        all.addAll(stage3Errors);
        return List.copyOf(all);
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}
