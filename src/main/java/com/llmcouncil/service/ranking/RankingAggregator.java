package com.llmcouncil.service.ranking;

import com.llmcouncil.domain.RawRanking;

import java.util.List;
import java.util.Map;

/**
 * Strategy interface for combining per-member peer rankings into one ordering.
 *
 * <p>Rankings arrive label-indexed; implementations return entries already de-anonymized
 * through {@code labelToModel}. Every call recomputes from scratch and keeps no state, so
 * implementations are thread-safe.
 *
 * <p><b>Available Strategies:</b>
 * <ul>
 *   <li>{@link com.llmcouncil.service.ranking.impl.MeanPositionAggregator} - average
 *       1-indexed position, lower is better</li>
 *   <li>{@link com.llmcouncil.service.ranking.impl.TournamentAggregator} - pairwise
 *       head-to-head majorities, robust to a single outlier ranking</li>
 * </ul>
 *
 * @param <E> entry type produced by the strategy
 */
public interface RankingAggregator<E> {

    /**
     * @param rankings     stage 2 rankings; unparseable ones carry an empty {@code parsedRanking}
     * @param labelToModel label code to model id, iterated in label assignment order
     * @return entries sorted best first; never {@code null}
     */
    List<E> aggregate(List<RawRanking> rankings, Map<String, String> labelToModel);
}
