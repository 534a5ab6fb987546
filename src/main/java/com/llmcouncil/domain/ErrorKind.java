package com.llmcouncil.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a failed model call.
 *
 * <p>The taxonomy is shared by every stage; a kind never says which stage the failure
 * happened in, only why the call failed.
 */
public enum ErrorKind {
    TIMEOUT("timeout"),
    RATE_LIMIT("rate_limit"),
    AUTH("auth"),
    PAYMENT("payment"),
    NOT_FOUND("not_found"),
    SERVER("server"),
    UNKNOWN("unknown");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Maps an HTTP status code to its error kind.
     *
     * <p>401→auth, 402→payment, 404→not_found, 429→rate_limit, 5xx→server, anything else→unknown.
     *
     * @param statusCode HTTP status code returned by the chat-completion endpoint
     * @return matching kind, {@link #UNKNOWN} for unmapped codes
     */
    public static ErrorKind fromStatus(int statusCode) {
        if (statusCode >= 500 && statusCode <= 599) {
            return SERVER;
        }
        return switch (statusCode) {
            case 401 -> AUTH;
            case 402 -> PAYMENT;
            case 404 -> NOT_FOUND;
            case 429 -> RATE_LIMIT;
            default -> UNKNOWN;
        };
    }

    /**
     * Resolves a persisted wire name back to its kind; unrecognized names become {@link #UNKNOWN}.
     */
    public static ErrorKind fromWireName(String wireName) {
        for (ErrorKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}
