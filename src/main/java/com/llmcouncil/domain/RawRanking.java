package com.llmcouncil.domain;

import java.util.List;
import java.util.Objects;

/**
 * A council member's peer-ranking reply.
 *
 * <p>{@code parsedRanking} is best-effort and may be empty; {@code rankingText} is always kept
 * so the evaluation can be audited.
 *
 * @param model         ranking model
 * @param rankingText   full reply text
 * @param parsedRanking label codes from best to worst
 */
public record RawRanking(String model, String rankingText, List<String> parsedRanking) {

    public RawRanking {
        Objects.requireNonNull(model, "model");
        rankingText = rankingText == null ? "" : rankingText;
        parsedRanking = parsedRanking == null ? List.of() : List.copyOf(parsedRanking);
    }
}
