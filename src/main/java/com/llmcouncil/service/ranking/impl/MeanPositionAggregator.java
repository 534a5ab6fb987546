package com.llmcouncil.service.ranking.impl;

import com.llmcouncil.domain.AggregateRankingEntry;
import com.llmcouncil.service.ranking.AbstractRankingAggregator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Ranks models by their average 1-indexed position.
 *
 * <p>A label contributes only to the rankings that mention it; a ranking that omits a label
 * neither penalizes nor rewards it. Labels never mentioned are left out of the result. Ties on
 * the average are broken by label assignment order.
 */
public final class MeanPositionAggregator extends AbstractRankingAggregator<AggregateRankingEntry> {

    @Override
    protected List<AggregateRankingEntry> doAggregate(List<List<String>> orderings, List<String> labelOrder,
                                                      Map<String, String> labelToModel) {
        Map<String, Integer> index = labelIndex(labelOrder);
        int n = labelOrder.size();
        long[] sum = new long[n];
        int[] count = new int[n];

        for (List<String> ordering : orderings) {
            for (int pos = 0; pos < ordering.size(); pos++) {
                int i = index.get(ordering.get(pos));
                sum[i] += pos + 1;
                count[i]++;
            }
        }

        List<Scored> scored = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (count[i] > 0) {
                scored.add(new Scored(i, (double) sum[i] / count[i], count[i]));
            }
        }
        scored.sort(Comparator.comparingDouble(Scored::average).thenComparingInt(Scored::labelIndex));

        List<AggregateRankingEntry> out = new ArrayList<>(scored.size());
        for (Scored s : scored) {
            String model = labelToModel.get(labelOrder.get(s.labelIndex()));
            out.add(new AggregateRankingEntry(model, s.average(), s.count()));
        }
        return out;
    }

    private record Scored(int labelIndex, double average, int count) {
    }
}
