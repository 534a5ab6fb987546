package com.llmcouncil.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CouncilSnapshotTest {

    @Test
    void requiresAtLeastOneMember() {
        assertThatThrownBy(() -> new CouncilSnapshot(List.of(), "chair", false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one");
    }

    @Test
    void rejectsBlankIds() {
        assertThatThrownBy(() -> new CouncilSnapshot(Arrays.asList("a", " "), "chair", false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CouncilSnapshot(List.of("a"), "", false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void isIsolatedFromLaterChangesToTheSourceList() {
        List<String> members = new ArrayList<>(List.of("a", "b"));
        CouncilSnapshot snapshot = new CouncilSnapshot(members, "chair", true);

        members.add("c");

        assertThat(snapshot.councilModels()).containsExactly("a", "b");
    }
}
