package com.llmcouncil.service.council;

import com.llmcouncil.domain.AnonymizedResponse;
import com.llmcouncil.domain.Stage1Result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hides Stage 1 answers behind sequential labels.
 *
 * <p>Labels follow spreadsheet-column order (A..Z, AA, AB, ..) and are assigned in the order
 * the answers were collected, so the same input list always yields the same labels.
 */
public final class ResponseAnonymizer {

    private ResponseAnonymizer() {
    }

    /**
     * Result of anonymization.
     *
     * @param responses    labeled answers in label order
     * @param labelToModel label code to model id, iteration order = label order
     */
    public record AnonymizedSet(List<AnonymizedResponse> responses, Map<String, String> labelToModel) {

        public AnonymizedSet {
            responses = List.copyOf(responses);
            labelToModel = Collections.unmodifiableMap(new LinkedHashMap<>(labelToModel));
        }

        public List<String> labels() {
            return List.copyOf(labelToModel.keySet());
        }
    }

    public static AnonymizedSet anonymize(List<Stage1Result> results) {
        List<AnonymizedResponse> responses = new ArrayList<>(results.size());
        Map<String, String> labelToModel = new LinkedHashMap<>();
        for (int i = 0; i < results.size(); i++) {
            Stage1Result r = results.get(i);
            String label = labelFor(i);
            responses.add(new AnonymizedResponse(label, r.model(), r.content()));
            labelToModel.put(label, r.model());
        }
        return new AnonymizedSet(responses, labelToModel);
    }

    /**
     * Label code for a zero-based position: 0 → A, 25 → Z, 26 → AA, 51 → AZ, 52 → BA.
     */
    public static String labelFor(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0: " + index);
        }
        StringBuilder sb = new StringBuilder();
        int n = index + 1;
        while (n > 0) {
            int rem = (n - 1) % 26;
            sb.append((char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }
}
