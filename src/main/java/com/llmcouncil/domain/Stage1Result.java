package com.llmcouncil.domain;

import java.util.Objects;

/**
 * One council member's independent answer.
 */
public record Stage1Result(String model, String content) {

    public Stage1Result {
        Objects.requireNonNull(model, "model");
        content = content == null ? "" : content;
    }
}
