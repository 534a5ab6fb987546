package com.llmcouncil.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorKindTest {

    @ParameterizedTest
    @CsvSource({
            "401, AUTH",
            "402, PAYMENT",
            "404, NOT_FOUND",
            "429, RATE_LIMIT",
            "500, SERVER",
            "502, SERVER",
            "503, SERVER",
            "599, SERVER",
            "400, UNKNOWN",
            "403, UNKNOWN",
            "418, UNKNOWN",
            "0, UNKNOWN"
    })
    void mapsStatusCodes(int status, ErrorKind expected) {
        assertThat(ErrorKind.fromStatus(status)).isEqualTo(expected);
    }

    @Test
    void wireNamesRoundTrip() {
        for (ErrorKind kind : ErrorKind.values()) {
            assertThat(ErrorKind.fromWireName(kind.wireName())).isEqualTo(kind);
        }
        assertThat(ErrorKind.RATE_LIMIT.wireName()).isEqualTo("rate_limit");
        assertThat(ErrorKind.NOT_FOUND.wireName()).isEqualTo("not_found");
    }

    @Test
    void unknownWireNameFallsBackToUnknown() {
        assertThat(ErrorKind.fromWireName("quota")).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(ErrorKind.fromWireName(null)).isEqualTo(ErrorKind.UNKNOWN);
    }
}
