package com.llmcouncil.service.council;

import com.llmcouncil.domain.ErrorKind;
import com.llmcouncil.domain.ModelQueryError;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorSummaryTest {

    @Test
    void groupsByKind() {
        String summary = ErrorSummary.summarize(List.of(
                ModelQueryError.of("a", ErrorKind.TIMEOUT, "t"),
                ModelQueryError.of("b", ErrorKind.TIMEOUT, "t"),
                ModelQueryError.of("c", ErrorKind.NOT_FOUND, "nf"),
                ModelQueryError.of("d", ErrorKind.RATE_LIMIT, "rl")));

        assertThat(summary).contains("2 model(s) timed out")
                .contains("Model(s) not found: c")
                .contains("1 model(s) rate limited");
    }

    @Test
    void authAndPaymentGiveActionableHints() {
        String summary = ErrorSummary.summarize(List.of(
                ModelQueryError.of("a", ErrorKind.AUTH, "k"),
                ModelQueryError.of("b", ErrorKind.PAYMENT, "p")));

        assertThat(summary).contains("API key").contains("credits");
    }

    @Test
    void unknownOnlyOrEmptyFallsBackToGeneric() {
        assertThat(ErrorSummary.summarize(List.of())).isEqualTo(ErrorSummary.GENERIC);
        assertThat(ErrorSummary.summarize(List.of(ModelQueryError.of("a", ErrorKind.UNKNOWN, "?"))))
                .isEqualTo(ErrorSummary.GENERIC);
    }

    @Test
    void allMembersFailedPrefixesSummary() {
        assertThat(ErrorSummary.allMembersFailed(List.of(ModelQueryError.of("a", ErrorKind.SERVER, "s"))))
                .startsWith("All models failed to respond.")
                .contains("OpenRouter server error");
    }
}
