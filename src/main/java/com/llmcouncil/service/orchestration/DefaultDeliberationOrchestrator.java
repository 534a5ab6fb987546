package com.llmcouncil.service.orchestration;

import com.llmcouncil.domain.AggregateRankingEntry;
import com.llmcouncil.domain.ChatMessage;
import com.llmcouncil.domain.CouncilSnapshot;
import com.llmcouncil.domain.DeliberationMode;
import com.llmcouncil.domain.DeliberationResult;
import com.llmcouncil.domain.TournamentRankingEntry;
import com.llmcouncil.exception.DeliberationCancelledException;
import com.llmcouncil.service.context.ContextBuilder;
import com.llmcouncil.service.council.ErrorSummary;
import com.llmcouncil.service.council.Stage1Collector;
import com.llmcouncil.service.council.Stage1Outcome;
import com.llmcouncil.service.council.Stage2Collector;
import com.llmcouncil.service.council.Stage2Outcome;
import com.llmcouncil.service.council.Stage3Outcome;
import com.llmcouncil.service.council.Stage3Synthesizer;
import com.llmcouncil.service.metrics.DeliberationMetricsPublisher;
import com.llmcouncil.service.orchestration.DeliberationStateMachine.State;
import com.llmcouncil.service.orchestration.event.DeliberationCompletedEvent;
import com.llmcouncil.service.ranking.RankingAggregator;
import com.llmcouncil.util.LogSanitizer;
import com.llmcouncil.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sequences the three council stages for one turn.
 *
 * <p>Stages run strictly one after another; each stage's errors are accumulated into the
 * result instead of stopping the pipeline. The snapshot in the request is the only source of
 * configuration for the whole turn.
 *
 * <p><b>Degradation:</b>
 * <ul>
 *   <li>Some members fail: they are left out of later stages and listed in the stage's errors.</li>
 *   <li>No Stage 1 answers: Stage 2 makes no calls, aggregates are empty, the chairman is not
 *       asked, and {@link DeliberationResult#failureSummary()} explains why.</li>
 *   <li>Chairman fails: {@code stage3} is {@code null}; stages 1 and 2 are still returned.</li>
 * </ul>
 *
 * <p>MDC keys {@code conversationId} and {@code stage} are set for the duration of the turn and
 * reach worker threads through the executor's task decorator.
 */
@Service
public class DefaultDeliberationOrchestrator implements DeliberationOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultDeliberationOrchestrator.class);

    static final String MDC_CONVERSATION = "conversationId";
    static final String MDC_STAGE = "stage";

    private final ContextBuilder contextBuilder;
    private final Stage1Collector stage1;
    private final Stage2Collector stage2;
    private final Stage3Synthesizer stage3;
    private final RankingAggregator<AggregateRankingEntry> meanPosition;
    private final RankingAggregator<TournamentRankingEntry> tournament;
    private final DeliberationMetricsPublisher metrics;
    private final ApplicationEventPublisher publisher;

    public DefaultDeliberationOrchestrator(ContextBuilder contextBuilder,
                                           Stage1Collector stage1,
                                           Stage2Collector stage2,
                                           Stage3Synthesizer stage3,
                                           RankingAggregator<AggregateRankingEntry> meanPositionAggregator,
                                           RankingAggregator<TournamentRankingEntry> tournamentAggregator,
                                           DeliberationMetricsPublisher metrics,
                                           ApplicationEventPublisher publisher) {
        this.contextBuilder = Objects.requireNonNull(contextBuilder);
        this.stage1 = Objects.requireNonNull(stage1);
        this.stage2 = Objects.requireNonNull(stage2);
        this.stage3 = Objects.requireNonNull(stage3);
        this.meanPosition = Objects.requireNonNull(meanPositionAggregator);
        this.tournament = Objects.requireNonNull(tournamentAggregator);
        this.metrics = metrics == null ? DeliberationMetricsPublisher.NOOP : metrics;
        this.publisher = publisher == null ? e -> { } : publisher;
    }

    @Override
    public DeliberationResult deliberate(DeliberationRequest request, DeliberationListener listener) {
        Objects.requireNonNull(request, "request");
        DeliberationListener out = listener == null ? DeliberationListener.NOOP : listener;
        DeliberationStateMachine sm = new DeliberationStateMachine();
        long t0 = System.nanoTime();

        String previousConversation = ThreadContext.get(MDC_CONVERSATION);
        ThreadContext.put(MDC_CONVERSATION, request.conversationId());
        try {
            LOG.info("Deliberation started: mode={}, members={}, chairman={}, webSearch={}, question='{}'",
                    request.mode().wireName(), request.snapshot().councilModels().size(),
                    request.snapshot().chairmanModel(), request.snapshot().webSearchEnabled(),
                    LogSanitizer.preview(request.newMessage()));

            DeliberationResult result = request.mode() == DeliberationMode.CHAIRMAN_DIRECT
                    ? runChairmanDirect(request, sm, out)
                    : runCouncil(request, sm, out);

            String outcome = result.hasFinalAnswer() ? "complete" : "degraded";
            metrics.recordDeliberation(request.mode().wireName(), outcome);
            long ms = TimeUtils.elapsedMillis(t0);
            LOG.info("Deliberation finished: outcome={}, failedCalls={}, path={}, durationMs={}",
                    outcome, result.allErrors().size(), sm.path(), ms);
            publisher.publishEvent(new DeliberationCompletedEvent(request.conversationId(), request.mode(),
                    result.hasFinalAnswer(), result.allErrors().size(), ms, Instant.now()));
            return result;
        } catch (DeliberationCancelledException e) {
            sm.fail();
            metrics.recordDeliberation(request.mode().wireName(), "cancelled");
            LOG.warn("Deliberation cancelled in state {}", sm.path());
            throw e;
        } catch (RuntimeException e) {
            sm.fail();
            metrics.recordDeliberation(request.mode().wireName(), "failed");
            throw e;
        } finally {
            ThreadContext.remove(MDC_STAGE);
            if (previousConversation != null) {
                ThreadContext.put(MDC_CONVERSATION, previousConversation);
            } else {
                ThreadContext.remove(MDC_CONVERSATION);
            }
        }
    }

    private DeliberationResult runCouncil(DeliberationRequest request, DeliberationStateMachine sm,
                                          DeliberationListener out) {
        CouncilSnapshot snapshot = request.snapshot();
        List<ChatMessage> context = buildContext(request);

        sm.transitionTo(State.STAGE1);
        enterStage("stage1");
        emit(out, DeliberationEvent.of(DeliberationEventType.STAGE1_START));
        long s1 = System.nanoTime();
        Stage1Outcome o1 = stage1.collect(context, snapshot);
        metrics.recordStage("stage1", TimeUtils.elapsedNanos(s1));
        emit(out, DeliberationEvent.completed(DeliberationEventType.STAGE1_COMPLETE, o1.results(), o1.errors()));

        sm.transitionTo(State.STAGE2);
        enterStage("stage2");
        emit(out, DeliberationEvent.of(DeliberationEventType.STAGE2_START));
        long s2 = System.nanoTime();
        Stage2Outcome o2 = stage2.collect(request.newMessage(), o1.results(), snapshot);
        List<AggregateRankingEntry> aggregate = meanPosition.aggregate(o2.rankings(), o2.labelToModel());
        List<TournamentRankingEntry> tournamentRanking = tournament.aggregate(o2.rankings(), o2.labelToModel());
        metrics.recordStage("stage2", TimeUtils.elapsedNanos(s2));
        Map<String, Object> stage2Meta = new LinkedHashMap<>();
        stage2Meta.put("label_to_model", o2.labelToModel());
        stage2Meta.put("aggregate_rankings", aggregate);
        stage2Meta.put("tournament_rankings", tournamentRanking);
        emit(out, new DeliberationEvent(DeliberationEventType.STAGE2_COMPLETE, o2.rankings(), stage2Meta,
                o2.errors(), null));

        Stage3Outcome o3;
        String failureSummary = null;
        if (o1.results().isEmpty()) {
            failureSummary = ErrorSummary.allMembersFailed(o1.errors());
            LOG.warn("No council member answered; chairman not asked. {}", failureSummary);
            o3 = Stage3Outcome.SKIPPED;
            emit(out, DeliberationEvent.error(failureSummary, o1.errors()));
            sm.transitionTo(State.DONE);
        } else {
            sm.transitionTo(State.STAGE3);
            enterStage("stage3");
            emit(out, DeliberationEvent.of(DeliberationEventType.STAGE3_START));
            long s3 = System.nanoTime();
            o3 = stage3.synthesize(request.newMessage(), o1.results(), o2.rankings(), aggregate,
                    tournamentRanking, snapshot);
            metrics.recordStage("stage3", TimeUtils.elapsedNanos(s3));
            if (o3.result() == null) {
                failureSummary = "Chairman failed to synthesize a final answer. " + ErrorSummary.summarize(o3.errors());
            }
            emit(out, DeliberationEvent.completed(DeliberationEventType.STAGE3_COMPLETE, o3.result(), o3.errors()));
            sm.transitionTo(State.DONE);
        }

        return new DeliberationResult(DeliberationMode.COUNCIL,
                o1.results(), o1.errors(),
                o2.rankings(), o2.errors(), o2.labelToModel(),
                aggregate, tournamentRanking,
                o3.result(), o3.errors(), failureSummary);
    }

    private DeliberationResult runChairmanDirect(DeliberationRequest request, DeliberationStateMachine sm,
                                                 DeliberationListener out) {
        List<ChatMessage> context = buildContext(request);

        sm.transitionTo(State.STAGE3_ONLY);
        enterStage("stage3");
        emit(out, DeliberationEvent.of(DeliberationEventType.STAGE3_START));
        long s3 = System.nanoTime();
        Stage3Outcome o3 = stage3.chairmanDirect(context, request.snapshot());
        metrics.recordStage("stage3", TimeUtils.elapsedNanos(s3));
        emit(out, DeliberationEvent.completed(DeliberationEventType.STAGE3_COMPLETE, o3.result(), o3.errors()));
        sm.transitionTo(State.DONE);

        String failureSummary = o3.result() == null
                ? "Chairman failed to answer. " + ErrorSummary.summarize(o3.errors())
                : null;
        return DeliberationResult.chairmanDirect(o3.result(), o3.errors(), failureSummary);
    }

    private List<ChatMessage> buildContext(DeliberationRequest request) {
        enterStage("context");
        long t = System.nanoTime();
        List<ChatMessage> context = contextBuilder.build(request.conversationId(), request.history(),
                request.newMessage(), request.snapshot());
        metrics.recordStage("context", TimeUtils.elapsedNanos(t));
        LOG.debug("Context built: {} messages from {} history entries", context.size(),
                request.history() == null ? 0 : request.history().size());
        return context;
    }

    private static void enterStage(String stage) {
        ThreadContext.put(MDC_STAGE, stage);
    }

    private static void emit(DeliberationListener listener, DeliberationEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            LOG.warn("Deliberation listener failed on {}: {}", event.type().wireName(), e.toString());
        }
    }
}
