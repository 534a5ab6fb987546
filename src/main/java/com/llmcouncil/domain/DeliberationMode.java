package com.llmcouncil.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a user turn is answered.
 */
public enum DeliberationMode {
    /** Full three-stage deliberation. */
    COUNCIL("council"),
    /** Chairman answers directly from the conversation context; stages 1 and 2 are skipped. */
    CHAIRMAN_DIRECT("chairman_direct");

    private final String wireName;

    DeliberationMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a request parameter. Accepts {@code council}, {@code chairman_direct} and
     * {@code chairman-direct} in any case; {@code null} or blank means {@link #COUNCIL}.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static DeliberationMode fromParam(String value) {
        if (value == null || value.isBlank()) {
            return COUNCIL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (DeliberationMode mode : values()) {
            if (mode.wireName.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown deliberation mode: " + value);
    }
}
