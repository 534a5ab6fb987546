package com.llmcouncil.exception;

/**
 * Thrown when a user message or configuration update fails validation.
 */
public class InvalidMessageException extends CouncilException {

    public InvalidMessageException(String message) {
        super(message);
    }
}
