package com.llmcouncil.testutil;

import com.llmcouncil.domain.CouncilSnapshot;

import java.util.List;

/**
 * Common council configurations for tests.
 */
public final class TestSnapshots {

    public static final String CHAIRMAN = "chair/model";

    private TestSnapshots() {
    }

    public static CouncilSnapshot council(String... members) {
        return new CouncilSnapshot(List.of(members), CHAIRMAN, false);
    }

    public static CouncilSnapshot withWebSearch(String... members) {
        return new CouncilSnapshot(List.of(members), CHAIRMAN, true);
    }
}
