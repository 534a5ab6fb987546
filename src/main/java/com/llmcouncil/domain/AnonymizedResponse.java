package com.llmcouncil.domain;

import java.util.Objects;

/**
 * A Stage 1 answer hidden behind a label for peer ranking.
 *
 * @param label   label code ({@code A}, {@code B}, ..., {@code AA}); shown to rankers as "Response A"
 * @param model   model that produced the answer; never shown to rankers
 * @param content answer text
 */
public record AnonymizedResponse(String label, String model, String content) {

    public static final String LABEL_PREFIX = "Response ";

    public AnonymizedResponse {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(content, "content");
    }

    public String displayLabel() {
        return LABEL_PREFIX + label;
    }
}
