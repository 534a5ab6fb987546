package com.llmcouncil.domain;

import java.util.List;
import java.util.Objects;

/**
 * Council configuration frozen for the duration of one turn.
 *
 * <p>Captured once when a turn starts and passed explicitly to every stage, so a configuration
 * change made while a deliberation is in flight never produces a torn read.
 *
 * @param councilModels    council members in call-issue order (at least one)
 * @param chairmanModel    synthesizing model, not necessarily a council member
 * @param webSearchEnabled whether every call of this turn requests the web-search capability
 */
public record CouncilSnapshot(List<String> councilModels, String chairmanModel, boolean webSearchEnabled) {

    public CouncilSnapshot {
        Objects.requireNonNull(councilModels, "councilModels");
        if (councilModels.isEmpty()) {
            throw new IllegalArgumentException("council must have at least one member");
        }
        for (String model : councilModels) {
            if (model == null || model.isBlank()) {
                throw new IllegalArgumentException("council member ids must be non-empty");
            }
        }
        if (chairmanModel == null || chairmanModel.isBlank()) {
            throw new IllegalArgumentException("chairman model id must be non-empty");
        }
        councilModels = List.copyOf(councilModels);
    }
}
