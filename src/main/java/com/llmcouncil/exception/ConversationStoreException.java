package com.llmcouncil.exception;

/**
 * Thrown when the conversation store cannot read or write its backing files.
 */
public class ConversationStoreException extends CouncilException {

    public ConversationStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConversationStoreException(String message) {
        super(message);
    }
}
