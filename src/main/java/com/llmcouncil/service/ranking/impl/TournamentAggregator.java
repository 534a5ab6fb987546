package com.llmcouncil.service.ranking.impl;

import com.llmcouncil.domain.TournamentRankingEntry;
import com.llmcouncil.service.ranking.AbstractRankingAggregator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Pairwise (Condorcet-style) tournament over peer rankings.
 *
 * <p>For every pair of labels that appear together in a ranking, the one placed earlier gets
 * one pairwise preference. Preferences are summed over all rankings, which makes the result
 * independent of the order rankings arrive in. Each pair is then decided by majority: the label
 * preferred by more rankers wins the matchup, an even split with at least one preference is a
 * tie, and a pair never seen together is no matchup at all.
 *
 * <p>Because a single ranker can move each matchup by at most one vote, one reversed ranking
 * cannot overturn a pair the other rankers agree on; a mean position can be dragged by it.
 *
 * <p>Ordering: score ({@code wins - losses}) descending, then raw pairwise preferences
 * descending, then label assignment order. Labels that no ranking mentions are omitted.
 */
public final class TournamentAggregator extends AbstractRankingAggregator<TournamentRankingEntry> {

    @Override
    protected List<TournamentRankingEntry> doAggregate(List<List<String>> orderings, List<String> labelOrder,
                                                       Map<String, String> labelToModel) {
        Map<String, Integer> index = labelIndex(labelOrder);
        int n = labelOrder.size();
        // prefer[i][j] = number of rankings placing label i above label j
        int[][] prefer = new int[n][n];
        int[] mentions = new int[n];

        for (List<String> ordering : orderings) {
            int[] idx = new int[ordering.size()];
            for (int k = 0; k < idx.length; k++) {
                idx[k] = index.get(ordering.get(k));
                mentions[idx[k]]++;
            }
            for (int a = 0; a < idx.length; a++) {
                for (int b = a + 1; b < idx.length; b++) {
                    prefer[idx[a]][idx[b]]++;
                }
            }
        }

        int[] wins = new int[n];
        int[] losses = new int[n];
        int[] ties = new int[n];
        int[] pairwise = new int[n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                int ij = prefer[i][j];
                int ji = prefer[j][i];
                pairwise[i] += ij;
                pairwise[j] += ji;
                if (ij > ji) {
                    wins[i]++;
                    losses[j]++;
                } else if (ji > ij) {
                    wins[j]++;
                    losses[i]++;
                } else if (ij > 0) {
                    ties[i]++;
                    ties[j]++;
                }
            }
        }

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (mentions[i] > 0) {
                order.add(i);
            }
        }
        order.sort(Comparator.<Integer>comparingInt(i -> -(wins[i] - losses[i]))
                .thenComparingInt(i -> -pairwise[i])
                .thenComparingInt(i -> i));

        List<TournamentRankingEntry> out = new ArrayList<>(order.size());
        for (int i : order) {
            out.add(new TournamentRankingEntry(labelToModel.get(labelOrder.get(i)),
                    wins[i], losses[i], ties[i], wins[i] - losses[i], pairwise[i], mentions[i]));
        }
        return out;
    }
}
