package com.llmcouncil.exception;

/**
 * Thrown when the thread running a deliberation is interrupted. Outstanding model calls are
 * cancelled and their results discarded.
 */
public class DeliberationCancelledException extends CouncilException {

    public DeliberationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
