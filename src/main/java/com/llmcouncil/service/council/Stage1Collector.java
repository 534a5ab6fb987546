package com.llmcouncil.service.council;

import com.llmcouncil.domain.ChatMessage;
import com.llmcouncil.domain.CouncilSnapshot;
import com.llmcouncil.domain.ModelCallResult;
import com.llmcouncil.domain.ModelQueryError;
import com.llmcouncil.domain.Stage1Result;
import com.llmcouncil.service.model.ParallelModelQueryService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Stage 1: every council member answers the question independently.
 *
 * <p>Successes keep call-issue order, which later becomes the label order for peer ranking.
 * An empty success list is a valid outcome, not a failure of the stage.
 */
@Component
public class Stage1Collector {

    private static final Logger LOG = LogManager.getLogger(Stage1Collector.class);

    private final ParallelModelQueryService queryService;

    public Stage1Collector(ParallelModelQueryService queryService) {
        this.queryService = Objects.requireNonNull(queryService);
    }

    public Stage1Outcome collect(List<ChatMessage> context, CouncilSnapshot snapshot) {
        List<String> models = snapshot.councilModels();
        LOG.info("Stage 1: querying {} council models: {}", models.size(), String.join(", ", models));

        List<ModelCallResult> responses = queryService.queryAll(models, context, snapshot.webSearchEnabled());

        List<Stage1Result> results = new ArrayList<>();
        List<ModelQueryError> errors = new ArrayList<>();
        for (ModelCallResult r : responses) {
            if (r.isSuccess()) {
                results.add(new Stage1Result(r.model(), r.content()));
            } else {
                errors.add(r.error());
            }
        }
        StageLogging.logOutcome("Stage 1", results.size(), errors);
        return new Stage1Outcome(results, errors);
    }
}
