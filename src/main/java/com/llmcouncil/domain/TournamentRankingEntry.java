package com.llmcouncil.domain;

/**
 * Pairwise tournament standing for one model.
 *
 * @param model         de-anonymized model identifier
 * @param wins          head-to-head matchups won (majority of rankers preferred this model)
 * @param losses        head-to-head matchups lost
 * @param ties          matchups where the rankers split evenly
 * @param score         {@code wins - losses}
 * @param pairwiseWins  raw count of individual ranker preferences won across all pairs
 * @param rankingsCount number of rankings that mention the model
 */
public record TournamentRankingEntry(
        String model,
        int wins,
        int losses,
        int ties,
        int score,
        int pairwiseWins,
        int rankingsCount
) {
}
