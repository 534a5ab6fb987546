package com.llmcouncil.service.orchestration;

import com.llmcouncil.domain.DeliberationResult;

/**
 * Runs one deliberation turn.
 *
 * <p>Model failures never escape as exceptions: they are collected per stage in the returned
 * {@link DeliberationResult}. Only the turn-fatal conditions throw.
 */
public interface DeliberationOrchestrator {

    /**
     * @throws com.llmcouncil.exception.ConversationHistoryException if the history cannot be used
     * @throws com.llmcouncil.exception.DeliberationCancelledException if the calling thread is interrupted
     */
    DeliberationResult deliberate(DeliberationRequest request, DeliberationListener listener);

    default DeliberationResult deliberate(DeliberationRequest request) {
        return deliberate(request, DeliberationListener.NOOP);
    }
}
