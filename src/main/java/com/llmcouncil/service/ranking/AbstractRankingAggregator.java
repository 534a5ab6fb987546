package com.llmcouncil.service.ranking;

import com.llmcouncil.domain.RawRanking;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Template base for ranking aggregators.
 *
 * <p>{@link #aggregate(List, Map)} sanitizes the input and delegates to
 * {@link #doAggregate(List, List, Map)}:
 * <ul>
 *   <li>labels absent from {@code labelToModel} are dropped</li>
 *   <li>a label repeated within one ranking keeps its first position only</li>
 *   <li>rankings left empty are skipped entirely</li>
 * </ul>
 * Subclasses therefore only see clean orderings over known labels.
 *
 * @param <E> entry type produced by the strategy
 */
public abstract class AbstractRankingAggregator<E> implements RankingAggregator<E> {

    @Override
    public final List<E> aggregate(List<RawRanking> rankings, Map<String, String> labelToModel) {
        if (rankings == null || rankings.isEmpty() || labelToModel == null || labelToModel.isEmpty()) {
            return List.of();
        }
        List<List<String>> orderings = new ArrayList<>(rankings.size());
        for (RawRanking ranking : rankings) {
            List<String> clean = sanitize(ranking.parsedRanking(), labelToModel);
            if (!clean.isEmpty()) {
                orderings.add(clean);
            }
        }
        if (orderings.isEmpty()) {
            return List.of();
        }
        List<String> labelOrder = List.copyOf(labelToModel.keySet());
        return Collections.unmodifiableList(doAggregate(orderings, labelOrder, labelToModel));
    }

    /**
     * @param orderings    sanitized, non-empty orderings, one per contributing ranker
     * @param labelOrder   every known label in assignment order; used for deterministic tie-breaks
     * @param labelToModel de-anonymization map
     * @return entries sorted best first
     */
    protected abstract List<E> doAggregate(List<List<String>> orderings, List<String> labelOrder,
                                           Map<String, String> labelToModel);

    private static List<String> sanitize(List<String> parsed, Map<String, String> labelToModel) {
        Set<String> seen = new LinkedHashSet<>();
        for (String label : parsed) {
            if (labelToModel.containsKey(label)) {
                seen.add(label);
            }
        }
        return new ArrayList<>(seen);
    }

    /**
     * Index of each label in assignment order.
     */
    protected static Map<String, Integer> labelIndex(List<String> labelOrder) {
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < labelOrder.size(); i++) {
            index.put(labelOrder.get(i), i);
        }
        return index;
    }
}
