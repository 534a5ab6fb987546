package com.llmcouncil.service.model;

import com.llmcouncil.domain.ChatMessage;
import com.llmcouncil.domain.ModelCallResult;

import java.time.Duration;
import java.util.List;

/**
 * Fans one message list out to several models and joins the results at a single barrier.
 *
 * <p>Every call is independent: a failure or timeout of one model is recorded in that model's
 * result and never cancels or delays a sibling. Results come back in the order the models were
 * given, regardless of completion order.
 */
public interface ParallelModelQueryService {

    /**
     * Queries every model concurrently with the default per-call timeout.
     *
     * @throws com.llmcouncil.exception.DeliberationCancelledException if the calling thread is
     *         interrupted while waiting; outstanding calls are cancelled and nothing is returned
     */
    List<ModelCallResult> queryAll(List<String> models, List<ChatMessage> messages, boolean webSearch);

    /**
     * Single call bounded by {@code timeout}.
     */
    ModelCallResult queryOne(String model, List<ChatMessage> messages, boolean webSearch, Duration timeout);
}
