package com.llmcouncil.service.council;

import com.llmcouncil.domain.AggregateRankingEntry;
import com.llmcouncil.domain.ChatMessage;
import com.llmcouncil.domain.CouncilSnapshot;
import com.llmcouncil.domain.ModelCallResult;
import com.llmcouncil.domain.RawRanking;
import com.llmcouncil.domain.Stage1Result;
import com.llmcouncil.domain.Stage3Result;
import com.llmcouncil.domain.TournamentRankingEntry;
import com.llmcouncil.service.model.ParallelModelQueryService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stage 3: the chairman turns everything the council produced into one answer.
 *
 * <p>Exactly one call, never retried. A failed call yields a {@code null} result and one error;
 * the earlier stages stay valid.
 *
 * <p>Only members that answered in Stage 1 are named to the chairman: a ranking from a member
 * without a Stage 1 answer still counts in the aggregates but its text and model id are left
 * out of the prompt.
 */
@Component
public class Stage3Synthesizer {

    private static final Logger LOG = LogManager.getLogger(Stage3Synthesizer.class);

    private final ParallelModelQueryService queryService;

    public Stage3Synthesizer(ParallelModelQueryService queryService) {
        this.queryService = Objects.requireNonNull(queryService);
    }

    public Stage3Outcome synthesize(String question, List<Stage1Result> stage1, List<RawRanking> stage2,
                                    List<AggregateRankingEntry> aggregate, List<TournamentRankingEntry> tournament,
                                    CouncilSnapshot snapshot) {
        Set<String> answered = stage1.stream().map(Stage1Result::model).collect(Collectors.toSet());
        List<RawRanking> rankings = stage2.stream().filter(r -> answered.contains(r.model())).toList();
        if (rankings.size() < stage2.size() && LOG.isDebugEnabled()) {
            LOG.debug("Stage 3: leaving out {} rankings from members without a Stage 1 answer",
                    stage2.size() - rankings.size());
        }
        String prompt = PromptTemplates.chairman(question, stage1, rankings, aggregate, tournament);
        LOG.info("Stage 3: chairman {} synthesizing from {} responses and {} rankings",
                snapshot.chairmanModel(), stage1.size(), rankings.size());
        return ask(List.of(ChatMessage.user(prompt)), snapshot);
    }

    /**
     * Chairman-direct mode: the chairman answers from the conversation context alone.
     */
    public Stage3Outcome chairmanDirect(List<ChatMessage> context, CouncilSnapshot snapshot) {
        List<ChatMessage> messages = new ArrayList<>(context.size() + 1);
        messages.add(ChatMessage.system(PromptTemplates.chairmanDirectSystem()));
        messages.addAll(context);
        LOG.info("Chairman-direct: {} answering with {} context messages", snapshot.chairmanModel(), context.size());
        return ask(messages, snapshot);
    }

    private Stage3Outcome ask(List<ChatMessage> messages, CouncilSnapshot snapshot) {
        ModelCallResult r = queryService.queryOne(snapshot.chairmanModel(), messages,
                snapshot.webSearchEnabled(), null);
        if (r.isSuccess()) {
            StageLogging.logOutcome("Stage 3", 1, List.of());
            return new Stage3Outcome(new Stage3Result(r.model(), r.content()), List.of());
        }
        StageLogging.logOutcome("Stage 3", 0, List.of(r.error()));
        return new Stage3Outcome(null, List.of(r.error()));
    }
}
