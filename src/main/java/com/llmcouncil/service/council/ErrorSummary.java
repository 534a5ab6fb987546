package com.llmcouncil.service.council;

import com.llmcouncil.domain.ErrorKind;
import com.llmcouncil.domain.ModelQueryError;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns a list of model errors into one human-readable sentence, grouped by kind.
 */
public final class ErrorSummary {

    static final String GENERIC = "Please try again.";

    private ErrorSummary() {
    }

    public static String summarize(List<ModelQueryError> errors) {
        if (errors == null || errors.isEmpty()) {
            return GENERIC;
        }
        Map<ErrorKind, List<ModelQueryError>> byKind = new EnumMap<>(ErrorKind.class);
        for (ModelQueryError e : errors) {
            byKind.computeIfAbsent(e.kind(), k -> new ArrayList<>()).add(e);
        }

        List<String> parts = new ArrayList<>();
        if (byKind.containsKey(ErrorKind.AUTH)) {
            parts.add("API key issue - please check your OpenRouter API key");
        }
        if (byKind.containsKey(ErrorKind.PAYMENT)) {
            parts.add("Payment required - please add credits to OpenRouter");
        }
        if (byKind.containsKey(ErrorKind.RATE_LIMIT)) {
            parts.add(byKind.get(ErrorKind.RATE_LIMIT).size() + " model(s) rate limited");
        }
        if (byKind.containsKey(ErrorKind.NOT_FOUND)) {
            parts.add("Model(s) not found: " + byKind.get(ErrorKind.NOT_FOUND).stream()
                    .map(ModelQueryError::model)
                    .collect(Collectors.joining(", ")));
        }
        if (byKind.containsKey(ErrorKind.TIMEOUT)) {
            parts.add(byKind.get(ErrorKind.TIMEOUT).size() + " model(s) timed out");
        }
        if (byKind.containsKey(ErrorKind.SERVER)) {
            parts.add("OpenRouter server error");
        }
        return parts.isEmpty() ? GENERIC : String.join("; ", parts);
    }

    /**
     * Message used when no council member produced a Stage 1 answer.
     */
    public static String allMembersFailed(List<ModelQueryError> errors) {
        return "All models failed to respond. " + summarize(errors);
    }
}
