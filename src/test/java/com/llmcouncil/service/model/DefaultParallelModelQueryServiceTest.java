package com.llmcouncil.service.model;

import com.llmcouncil.domain.ChatMessage;
import com.llmcouncil.domain.ErrorKind;
import com.llmcouncil.domain.ModelCallResult;
import com.llmcouncil.exception.DeliberationCancelledException;
import com.llmcouncil.service.events.ModelCallFailedEvent;
import com.llmcouncil.service.metrics.DeliberationMetrics;
import com.llmcouncil.service.metrics.DeliberationMetricsPublisher;
import com.llmcouncil.testutil.EventCapturingPublisher;
import com.llmcouncil.testutil.ScriptedModelCaller;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class DefaultParallelModelQueryServiceTest {

    private static final List<ChatMessage> MESSAGES = List.of(ChatMessage.user("What is 2+2?"));

    private ExecutorService pool;
    private ScriptedModelCaller caller;
    private EventCapturingPublisher events;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(8);
        caller = new ScriptedModelCaller();
        events = new EventCapturingPublisher();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private DefaultParallelModelQueryService service(Duration timeout) {
        return new DefaultParallelModelQueryService(caller, pool, timeout, null, events);
    }

    @Test
    void returnsResultsInIssueOrderRegardlessOfCompletionOrder() {
        caller.reply("a", "from a").delay("a", 150)
                .reply("b", "from b")
                .reply("c", "from c").delay("c", 50);

        List<ModelCallResult> results = service(Duration.ofSeconds(5)).queryAll(List.of("a", "b", "c"), MESSAGES, false);

        assertThat(results).extracting(ModelCallResult::model).containsExactly("a", "b", "c");
        assertThat(results).extracting(ModelCallResult::content).containsExactly("from a", "from b", "from c");
    }

    @Test
    void slowMemberTimesOutWithoutDelayingOthers() {
        caller.reply("fast", "quick").reply("slow", "too late").delay("slow", 3000);

        long t0 = System.nanoTime();
        List<ModelCallResult> results = service(Duration.ofMillis(200)).queryAll(List.of("fast", "slow"), MESSAGES, false);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

        assertThat(results.get(0).isSuccess()).isTrue();
        assertThat(results.get(1).isSuccess()).isFalse();
        assertThat(results.get(1).error().kind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(results.get(1).error().model()).isEqualTo("slow");
        assertThat(elapsedMs).isLessThan(2000);
    }

    @Test
    void deadlinesRunConcurrentlyNotInSequence() {
        caller.reply("a", "x").delay("a", 3000)
                .reply("b", "y").delay("b", 3000)
                .reply("c", "z").delay("c", 3000);

        long t0 = System.nanoTime();
        List<ModelCallResult> results = service(Duration.ofMillis(300)).queryAll(List.of("a", "b", "c"), MESSAGES, false);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

        assertThat(results).allMatch(r -> r.error() != null && r.error().kind() == ErrorKind.TIMEOUT);
        assertThat(elapsedMs).isLessThan(900);
    }

    @Test
    void deadlineStartsWhenTheCallIsIssued() {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            caller.reply("a", "x").delay("a", 300)
                    .reply("b", "y").delay("b", 300);
            DefaultParallelModelQueryService svc =
                    new DefaultParallelModelQueryService(caller, single, Duration.ofMillis(500), null, events);

            List<ModelCallResult> results = svc.queryAll(List.of("a", "b"), MESSAGES, false);

            assertThat(results).allMatch(ModelCallResult::isSuccess);
            assertThat(events.eventsOfType(ModelCallFailedEvent.class)).isEmpty();
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void throwingCallerIsConfinedToItsOwnMember() {
        ModelCaller throwing = (model, messages, webSearch) -> {
            if (model.equals("boom")) {
                throw new IllegalStateException("kaboom");
            }
            return ModelCallResult.success(model, "ok");
        };
        DefaultParallelModelQueryService svc =
                new DefaultParallelModelQueryService(throwing, pool, Duration.ofSeconds(5), null, events);

        List<ModelCallResult> results = svc.queryAll(List.of("ok1", "boom", "ok2"), MESSAGES, false);

        assertThat(results.get(0).isSuccess()).isTrue();
        assertThat(results.get(2).isSuccess()).isTrue();
        assertThat(results.get(1).error().kind()).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(results.get(1).error().message()).isEqualTo("kaboom");
    }

    @Test
    void nullResultBecomesUnknownError() {
        ModelCaller nothing = (model, messages, webSearch) -> null;
        DefaultParallelModelQueryService svc =
                new DefaultParallelModelQueryService(nothing, pool, Duration.ofSeconds(5), null, null);

        ModelCallResult r = svc.queryOne("m", MESSAGES, false, null);

        assertThat(r.error().kind()).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(r.error().message()).isEqualTo("No result");
    }

    @Test
    void failuresArePublishedAndCounted() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        DeliberationMetricsPublisher metrics = new DeliberationMetricsPublisher(new DeliberationMetrics(registry));
        caller.reply("ok", "fine").fail("bad", ErrorKind.RATE_LIMIT, "Rate limited");
        DefaultParallelModelQueryService svc =
                new DefaultParallelModelQueryService(caller, pool, Duration.ofSeconds(5), metrics, events);

        svc.queryAll(List.of("ok", "bad"), MESSAGES, false);

        List<ModelCallFailedEvent> failed = events.eventsOfType(ModelCallFailedEvent.class);
        assertThat(failed).hasSize(1);
        assertThat(failed.get(0).error().model()).isEqualTo("bad");
        assertThat(registry.find("council.model.call.failure").tag("model", "bad").tag("kind", "rate_limit")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.find("council.model.call.latency").tag("model", "ok").tag("outcome", "success")
                .timer().count()).isEqualTo(1);
    }

    @Test
    void queryOneHonoursExplicitTimeout() {
        caller.reply("chair", "summary").delay("chair", 2000);

        ModelCallResult r = service(Duration.ofSeconds(30)).queryOne("chair", MESSAGES, false, Duration.ofMillis(100));

        assertThat(r.error().kind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(r.error().message()).contains("100 ms");
    }

    @Test
    void webSearchFlagReachesCaller() {
        caller.reply("m", "ok");

        service(Duration.ofSeconds(5)).queryAll(List.of("m"), MESSAGES, true);

        assertThat(caller.calls()).singleElement().satisfies(c -> assertThat(c.webSearch()).isTrue());
    }

    @Test
    void interruptCancelsTheBatch() throws InterruptedException {
        caller.reply("slow", "late").delay("slow", 5000);
        DefaultParallelModelQueryService svc = service(Duration.ofSeconds(10));
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        AtomicBoolean stillInterrupted = new AtomicBoolean();

        Thread turn = new Thread(() -> {
            try {
                svc.queryAll(List.of("slow"), MESSAGES, false);
            } catch (RuntimeException e) {
                thrown.set(e);
                stillInterrupted.set(Thread.currentThread().isInterrupted());
            }
        });
        turn.start();
        await().atMost(Duration.ofSeconds(2)).until(() -> !caller.calls().isEmpty());
        turn.interrupt();
        turn.join(2000);

        assertThat(thrown.get()).isInstanceOf(DeliberationCancelledException.class);
        assertThat(stillInterrupted).isTrue();
    }
}
