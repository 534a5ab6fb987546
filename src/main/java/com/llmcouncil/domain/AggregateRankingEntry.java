package com.llmcouncil.domain;

/**
 * Mean-position aggregate for one model; lower {@code averageRank} is better.
 *
 * @param model         de-anonymized model identifier
 * @param averageRank   mean 1-indexed position across the rankings that mention the model
 * @param rankingsCount number of rankings that contributed a position
 */
public record AggregateRankingEntry(String model, double averageRank, int rankingsCount) {
}
