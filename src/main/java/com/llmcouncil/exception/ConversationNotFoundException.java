package com.llmcouncil.exception;

/**
 * Thrown when a conversation id does not resolve to a stored conversation.
 */
public class ConversationNotFoundException extends CouncilException {

    private final String conversationId;

    public ConversationNotFoundException(String conversationId) {
        super("Conversation not found: " + conversationId);
        this.conversationId = conversationId;
    }

    public String getConversationId() {
        return conversationId;
    }
}
