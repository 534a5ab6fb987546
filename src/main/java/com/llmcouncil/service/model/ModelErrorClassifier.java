package com.llmcouncil.service.model;

import com.llmcouncil.domain.ErrorKind;
import com.llmcouncil.domain.ModelQueryError;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * Maps transport failures onto the {@link ErrorKind} taxonomy.
 *
 * <p>HTTP 401→auth, 402→payment, 404→not_found, 429→rate_limit, 5xx→server, a local timeout
 * →timeout, anything else→unknown with the message kept verbatim.
 */
public final class ModelErrorClassifier {

    private ModelErrorClassifier() {
    }

    public static ModelQueryError classify(String model, Throwable failure) {
        if (failure instanceof HttpStatusCodeException http) {
            int status = http.getStatusCode().value();
            ErrorKind kind = ErrorKind.fromStatus(status);
            return new ModelQueryError(model, kind, describe(kind, status, http), status);
        }
        if (isTimeout(failure)) {
            return ModelQueryError.of(model, ErrorKind.TIMEOUT, "Request timed out");
        }
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
        return ModelQueryError.of(model, ErrorKind.UNKNOWN, message);
    }

    public static ModelQueryError timeout(String model, long timeoutMs) {
        return ModelQueryError.of(model, ErrorKind.TIMEOUT, "Request timed out after " + timeoutMs + " ms");
    }

    static boolean isTimeout(Throwable failure) {
        Throwable t = failure;
        while (t != null) {
            if (t instanceof SocketTimeoutException
                    || t instanceof HttpTimeoutException
                    || t instanceof TimeoutException) {
                return true;
            }
            t = t.getCause();
        }
        return failure instanceof ResourceAccessException rae
                && rae.getMessage() != null
                && rae.getMessage().toLowerCase().contains("timed out");
    }

    private static String describe(ErrorKind kind, int status, HttpStatusCodeException http) {
        return switch (kind) {
            case AUTH -> "Invalid API key";
            case PAYMENT -> "Insufficient credits";
            case NOT_FOUND -> "Model not found";
            case RATE_LIMIT -> "Rate limited";
            case SERVER -> "Server error (HTTP " + status + ")";
            default -> "HTTP " + status + ": " + http.getStatusText();
        };
    }
}
