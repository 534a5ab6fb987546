package com.llmcouncil.service.council;

import com.llmcouncil.domain.ChatMessage;
import com.llmcouncil.domain.CouncilSnapshot;
import com.llmcouncil.domain.ModelCallResult;
import com.llmcouncil.domain.ModelQueryError;
import com.llmcouncil.domain.RawRanking;
import com.llmcouncil.domain.Stage1Result;
import com.llmcouncil.service.model.ParallelModelQueryService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stage 2: every council member ranks all anonymized Stage 1 answers, its own included.
 *
 * <p>Rankers see labels only. A reply whose ranking cannot be parsed is kept with an empty
 * {@code parsedRanking}; it is not an error. With no Stage 1 answers there is nothing to rank
 * and no call is made.
 */
@Component
public class Stage2Collector {

    private static final Logger LOG = LogManager.getLogger(Stage2Collector.class);

    private final ParallelModelQueryService queryService;

    public Stage2Collector(ParallelModelQueryService queryService) {
        this.queryService = Objects.requireNonNull(queryService);
    }

    public Stage2Outcome collect(String question, List<Stage1Result> stage1, CouncilSnapshot snapshot) {
        if (stage1.isEmpty()) {
            LOG.info("Stage 2 skipped: no Stage 1 responses to rank");
            return new Stage2Outcome(List.of(), Map.of(), List.of());
        }
        ResponseAnonymizer.AnonymizedSet anonymized = ResponseAnonymizer.anonymize(stage1);
        List<String> labels = anonymized.labels();
        List<ChatMessage> prompt = List.of(
                ChatMessage.user(PromptTemplates.ranking(question, anonymized.responses())));

        List<String> models = snapshot.councilModels();
        LOG.info("Stage 2: querying {} council models for rankings of {} responses", models.size(), labels.size());
        List<ModelCallResult> responses = queryService.queryAll(models, prompt, snapshot.webSearchEnabled());

        List<RawRanking> rankings = new ArrayList<>();
        List<ModelQueryError> errors = new ArrayList<>();
        for (ModelCallResult r : responses) {
            if (r.isSuccess()) {
                List<String> parsed = RankingParser.parse(r.content(), labels);
                if (parsed.isEmpty()) {
                    LOG.debug("No ranking could be parsed from {}", r.model());
                }
                rankings.add(new RawRanking(r.model(), r.content(), parsed));
            } else {
                errors.add(r.error());
            }
        }
        StageLogging.logOutcome("Stage 2", rankings.size(), errors);
        return new Stage2Outcome(rankings, anonymized.labelToModel(), errors);
    }
}
