package com.llmcouncil.service.orchestration.event;

import com.llmcouncil.domain.DeliberationMode;

import java.time.Instant;

/**
 * Emitted after every finished turn, whether or not it produced a final answer.
 *
 * @param conversationId conversation the turn belongs to
 * @param mode           council or chairman-direct
 * @param finalAnswer    whether the chairman produced an answer
 * @param failedCalls    number of failed model calls across all stages
 * @param durationMs     wall-clock duration of the turn
 * @param timestamp      when the turn finished
 */
public record DeliberationCompletedEvent(
        String conversationId,
        DeliberationMode mode,
        boolean finalAnswer,
        int failedCalls,
        long durationMs,
        Instant timestamp
) {}
