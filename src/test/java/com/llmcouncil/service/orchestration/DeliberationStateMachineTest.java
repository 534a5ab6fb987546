package com.llmcouncil.service.orchestration;

import com.llmcouncil.service.orchestration.DeliberationStateMachine.State;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeliberationStateMachineTest {

    @Test
    void followsCouncilPath() {
        DeliberationStateMachine sm = new DeliberationStateMachine();

        sm.transitionTo(State.STAGE1);
        sm.transitionTo(State.STAGE2);
        sm.transitionTo(State.STAGE3);
        sm.transitionTo(State.DONE);

        assertThat(sm.current()).isEqualTo(State.DONE);
        assertThat(sm.path()).containsExactly(State.BUILDING_CONTEXT, State.STAGE1, State.STAGE2, State.STAGE3,
                State.DONE);
    }

    @Test
    void allowsSkippingChairmanAfterStage2() {
        DeliberationStateMachine sm = new DeliberationStateMachine();
        sm.transitionTo(State.STAGE1);
        sm.transitionTo(State.STAGE2);

        sm.transitionTo(State.DONE);

        assertThat(sm.current().isTerminal()).isTrue();
    }

    @Test
    void rejectsSkippingOrRevisitingStages() {
        DeliberationStateMachine sm = new DeliberationStateMachine();

        assertThatThrownBy(() -> sm.transitionTo(State.STAGE2))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("BUILDING_CONTEXT -> STAGE2");

        sm.transitionTo(State.STAGE3_ONLY);
        assertThatThrownBy(() -> sm.transitionTo(State.STAGE1)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failIsIgnoredOnceTerminal() {
        DeliberationStateMachine sm = new DeliberationStateMachine();
        sm.transitionTo(State.STAGE3_ONLY);

        assertThat(sm.fail()).isTrue();
        assertThat(sm.fail()).isFalse();
        assertThat(sm.current()).isEqualTo(State.FAILED);
        assertThatThrownBy(() -> sm.transitionTo(State.DONE)).isInstanceOf(IllegalStateException.class);
    }
}
