package com.llmcouncil.domain;

import java.util.Objects;

/**
 * Tagged outcome of a single model call: either content or a classified error, never both.
 *
 * <p>Fan-out stages collect these values instead of exceptions so that one member's
 * failure can never abort its siblings.
 */
public record ModelCallResult(String model, String content, ModelQueryError error) {

    public ModelCallResult {
        Objects.requireNonNull(model, "model");
        if ((content == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of content or error must be set");
        }
    }

    public static ModelCallResult success(String model, String content) {
        return new ModelCallResult(model, content, null);
    }

    public static ModelCallResult failure(ModelQueryError error) {
        Objects.requireNonNull(error, "error");
        return new ModelCallResult(error.model(), null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
