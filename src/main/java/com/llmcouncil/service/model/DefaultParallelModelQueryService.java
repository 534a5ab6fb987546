package com.llmcouncil.service.model;

import com.llmcouncil.config.properties.OpenRouterProperties;
import com.llmcouncil.domain.ChatMessage;
import com.llmcouncil.domain.ErrorKind;
import com.llmcouncil.domain.ModelCallResult;
import com.llmcouncil.domain.ModelQueryError;
import com.llmcouncil.exception.DeliberationCancelledException;
import com.llmcouncil.service.events.ModelCallFailedEvent;
import com.llmcouncil.service.metrics.DeliberationMetricsPublisher;
import com.llmcouncil.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Default fan-out over a {@link ModelCaller}.
 *
 * <p><b>Thread Model:</b> every call runs as its own task on {@code councilExecutor}. The
 * calling thread blocks on one barrier ({@code allOf}) until every task has succeeded, failed or
 * hit its own deadline. Deadlines are per call, so a stage takes as long as its slowest member,
 * never the sum.
 *
 * <p><b>Timeouts:</b> each task is completed with a {@link ErrorKind#TIMEOUT} error when its
 * deadline passes. The deadline starts when the task starts running, so a call that waited for a
 * thread is never reported as timed out before it was issued. The HTTP read timeout fires at
 * about the same moment and frees the thread.
 *
 * <p><b>Error Handling:</b> the caller contract forbids exceptions, but an unexpected
 * {@link RuntimeException} escaping it is still confined to its own task and recorded as
 * {@link ErrorKind#UNKNOWN}. Each failure is counted and published as a
 * {@link ModelCallFailedEvent}.
 *
 * <p><b>Cancellation:</b> interrupting the waiting thread cancels the whole batch and raises
 * {@link DeliberationCancelledException}; partial results of an aborted batch are discarded.
 */
@Service
public class DefaultParallelModelQueryService implements ParallelModelQueryService {
    private static final Logger LOG = LogManager.getLogger(DefaultParallelModelQueryService.class);

    private final ModelCaller caller;
    private final Executor executor;
    private final Duration defaultTimeout;
    private final DeliberationMetricsPublisher metrics;
    private final ApplicationEventPublisher events;

    @Autowired
    public DefaultParallelModelQueryService(ModelCaller caller,
                                            @Qualifier("councilExecutor") Executor executor,
                                            OpenRouterProperties props,
                                            DeliberationMetricsPublisher metrics,
                                            ApplicationEventPublisher events) {
        this(caller, executor, props.getRequestTimeout(), metrics, events);
    }

    public DefaultParallelModelQueryService(ModelCaller caller, Executor executor, Duration defaultTimeout,
                                            DeliberationMetricsPublisher metrics,
                                            ApplicationEventPublisher events) {
        this.caller = Objects.requireNonNull(caller);
        this.executor = Objects.requireNonNull(executor);
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout);
        this.metrics = metrics == null ? DeliberationMetricsPublisher.NOOP : metrics;
        this.events = events == null ? e -> { } : events;
    }

    @Override
    public List<ModelCallResult> queryAll(List<String> models, List<ChatMessage> messages, boolean webSearch) {
        Objects.requireNonNull(models, "models");
        Objects.requireNonNull(messages, "messages");
        List<CompletableFuture<ModelCallResult>> futures = new ArrayList<>(models.size());
        for (String model : models) {
            futures.add(submit(model, messages, webSearch, defaultTimeout));
        }
        awaitAll(futures);

        List<ModelCallResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<ModelCallResult> f : futures) {
            results.add(f.join());
        }
        return results;
    }

    @Override
    public ModelCallResult queryOne(String model, List<ChatMessage> messages, boolean webSearch, Duration timeout) {
        CompletableFuture<ModelCallResult> future = submit(model, messages, webSearch,
                timeout == null ? defaultTimeout : timeout);
        awaitAll(List.of(future));
        return future.join();
    }

    private CompletableFuture<ModelCallResult> submit(String model, List<ChatMessage> messages,
                                                      boolean webSearch, Duration timeout) {
        long timeoutMs = timeout.toMillis();
        long t0 = System.nanoTime();
        CompletableFuture<ModelCallResult> call = new CompletableFuture<>();
        CompletableFuture<ModelCallResult> recorded = call.thenApply(result -> record(result, TimeUtils.elapsedNanos(t0)));
        ModelCallResult timedOut = ModelCallResult.failure(ModelErrorClassifier.timeout(model, timeoutMs));
        try {
            executor.execute(() -> {
                if (recorded.isDone()) {
                    return;
                }
                // the deadline counts from the moment the call is issued, not from submission
                call.completeOnTimeout(timedOut, timeoutMs, TimeUnit.MILLISECONDS);
                call.complete(invoke(model, messages, webSearch));
            });
        } catch (RejectedExecutionException ree) {
            LOG.error("{} call rejected by council executor", model, ree);
            call.complete(ModelCallResult.failure(
                    ModelQueryError.of(model, ErrorKind.UNKNOWN, "Council executor rejected the call")));
        }
        return recorded;
    }

    private ModelCallResult invoke(String model, List<ChatMessage> messages, boolean webSearch) {
        try {
            ModelCallResult result = caller.call(model, messages, webSearch);
            return result != null
                    ? result
                    : ModelCallResult.failure(ModelQueryError.of(model, ErrorKind.UNKNOWN, "No result"));
        } catch (RuntimeException re) {
            LOG.error("{} unexpected error from model caller", model, re);
            return ModelCallResult.failure(ModelErrorClassifier.classify(model, re));
        }
    }

    private ModelCallResult record(ModelCallResult result, long elapsedNanos) {
        if (result.isSuccess()) {
            metrics.recordCallSuccess(result.model(), elapsedNanos);
        } else {
            metrics.recordCallFailure(result.error(), elapsedNanos);
            events.publishEvent(ModelCallFailedEvent.of(result.error()));
        }
        return result;
    }

    private static void awaitAll(List<CompletableFuture<ModelCallResult>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get();
        } catch (InterruptedException ie) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new DeliberationCancelledException("Model fan-out interrupted", ie);
        } catch (ExecutionException ee) {
            // Tasks convert every failure into a result value; reaching here is a programming error
            throw new IllegalStateException("Model call task failed unexpectedly", ee.getCause());
        }
    }
}
