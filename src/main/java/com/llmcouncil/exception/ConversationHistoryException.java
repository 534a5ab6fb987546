package com.llmcouncil.exception;

/**
 * Thrown when prior conversation history cannot be loaded or is malformed.
 * Fatal for the turn: no stage runs.
 */
public class ConversationHistoryException extends CouncilException {

    private final String conversationId;

    public ConversationHistoryException(String message, String conversationId) {
        super(message + " (conversation: " + conversationId + ")");
        this.conversationId = conversationId;
    }

    public ConversationHistoryException(String message, String conversationId, Throwable cause) {
        super(message + " (conversation: " + conversationId + ")", cause);
        this.conversationId = conversationId;
    }

    public String getConversationId() {
        return conversationId;
    }
}
