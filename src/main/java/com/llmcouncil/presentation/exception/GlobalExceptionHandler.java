package com.llmcouncil.presentation.exception;

import com.llmcouncil.exception.ConversationHistoryException;
import com.llmcouncil.exception.ConversationNotFoundException;
import com.llmcouncil.exception.ConversationStoreException;
import com.llmcouncil.exception.DeliberationCancelledException;
import com.llmcouncil.exception.InvalidMessageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Model failures never reach this class: they are part of a successful response body.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ConversationNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(ConversationNotFoundException ex) {
        LOG.info("Conversation not found: {}", ex.getConversationId());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Conversation not found",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler({InvalidMessageException.class, IllegalArgumentException.class})
    ResponseEntity<ApiError> handleInvalidInput(RuntimeException ex) {
        LOG.warn("Invalid request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
            .findFirst()
            .orElse("Request body failed validation");
        LOG.warn("Request validation failed: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("ValidationError", "Invalid request", details, Instant.now()));
    }

    /**
     * History unreadable: the turn cannot start. Retry may help (HTTP 503).
     */
    @ExceptionHandler(ConversationHistoryException.class)
    ResponseEntity<ApiError> handleHistory(ConversationHistoryException ex) {
        LOG.error("Conversation history unavailable: conversation={}", ex.getConversationId(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Conversation history unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    @ExceptionHandler(DeliberationCancelledException.class)
    ResponseEntity<ApiError> handleCancelled(DeliberationCancelledException ex) {
        LOG.warn("Deliberation cancelled: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Deliberation cancelled",
                "Please retry",
                Instant.now()
            ));
    }

    /**
     * Storage failure (HTTP 500). Paths stay in the log, not the response.
     */
    @ExceptionHandler(ConversationStoreException.class)
    ResponseEntity<ApiError> handleStore(ConversationStoreException ex) {
        LOG.error("Conversation store failure", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Conversation storage failure",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
