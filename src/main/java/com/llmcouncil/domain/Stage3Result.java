package com.llmcouncil.domain;

import java.util.Objects;

/**
 * The chairman's final answer.
 */
public record Stage3Result(String model, String response) {

    public Stage3Result {
        Objects.requireNonNull(model, "model");
        response = response == null ? "" : response;
    }
}
