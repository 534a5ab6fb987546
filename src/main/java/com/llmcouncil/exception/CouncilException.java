package com.llmcouncil.exception;

/**
 * Base exception for all llm-council application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class CouncilException extends RuntimeException {

    public CouncilException(String message) {
        super(message);
    }

    public CouncilException(String message, Throwable cause) {
        super(message, cause);
    }

    public CouncilException(Throwable cause) {
        super(cause);
    }
}
