package com.llmcouncil.service.orchestration;

import com.llmcouncil.domain.ConversationMessage;
import com.llmcouncil.domain.CouncilSnapshot;
import com.llmcouncil.domain.DeliberationMode;

import java.util.List;
import java.util.Objects;

/**
 * Input of one turn.
 *
 * @param conversationId conversation the turn belongs to, used for logging and errors
 * @param history        prior entries, oldest first, not including {@code newMessage}
 * @param newMessage     the user's question
 * @param mode           full council or chairman-direct
 * @param snapshot       council configuration frozen for this turn
 */
public record DeliberationRequest(String conversationId, List<ConversationMessage> history, String newMessage,
                                  DeliberationMode mode, CouncilSnapshot snapshot) {

    public DeliberationRequest {
        Objects.requireNonNull(conversationId, "conversationId");
        Objects.requireNonNull(newMessage, "newMessage");
        Objects.requireNonNull(snapshot, "snapshot");
        mode = mode == null ? DeliberationMode.COUNCIL : mode;
    }
}
