package com.llmcouncil.config.ranking;

import com.llmcouncil.domain.AggregateRankingEntry;
import com.llmcouncil.domain.TournamentRankingEntry;
import com.llmcouncil.service.ranking.RankingAggregator;
import com.llmcouncil.service.ranking.impl.MeanPositionAggregator;
import com.llmcouncil.service.ranking.impl.TournamentAggregator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Both aggregation schemes are always computed, so both are always wired.
 */
@Configuration
public class RankingConfig {

    @Bean
    public RankingAggregator<AggregateRankingEntry> meanPositionAggregator() {
        return new MeanPositionAggregator();
    }

    @Bean
    public RankingAggregator<TournamentRankingEntry> tournamentAggregator() {
        return new TournamentAggregator();
    }
}
