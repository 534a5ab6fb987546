package com.llmcouncil.service.orchestration;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of one deliberation turn.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * BUILDING_CONTEXT → STAGE1 → STAGE2 → STAGE3 → DONE
 * BUILDING_CONTEXT → STAGE3_ONLY → DONE           (chairman-direct)
 * STAGE2 → DONE                                   (no Stage 1 answers, chairman not asked)
 * any non-terminal state → FAILED
 * </pre>
 *
 * <p>No state is ever re-entered, so nothing is retried. An illegal transition throws
 * {@link IllegalStateException}.
 *
 * <p><b>Thread Safety:</b> not thread-safe. One instance per turn, confined to the thread
 * that runs the turn.
 */
public final class DeliberationStateMachine {

    public enum State {
        BUILDING_CONTEXT, STAGE1, STAGE2, STAGE3, STAGE3_ONLY, DONE, FAILED;

        public boolean isTerminal() {
            return this == DONE || this == FAILED;
        }
    }

    private static final Map<State, Set<State>> ALLOWED = Map.of(
            State.BUILDING_CONTEXT, EnumSet.of(State.STAGE1, State.STAGE3_ONLY, State.FAILED),
            State.STAGE1, EnumSet.of(State.STAGE2, State.FAILED),
            State.STAGE2, EnumSet.of(State.STAGE3, State.DONE, State.FAILED),
            State.STAGE3, EnumSet.of(State.DONE, State.FAILED),
            State.STAGE3_ONLY, EnumSet.of(State.DONE, State.FAILED),
            State.DONE, EnumSet.noneOf(State.class),
            State.FAILED, EnumSet.noneOf(State.class));

    private final List<State> visited = new ArrayList<>();
    private State current = State.BUILDING_CONTEXT;

    public DeliberationStateMachine() {
        visited.add(current);
    }

    /**
     * @throws IllegalStateException if {@code next} is not reachable from the current state
     */
    public void transitionTo(State next) {
        if (next == null) {
            throw new NullPointerException("next cannot be null");
        }
        if (!ALLOWED.get(current).contains(next)) {
            throw new IllegalStateException("Illegal transition " + current + " -> " + next);
        }
        current = next;
        visited.add(next);
    }

    /**
     * Moves to {@link State#FAILED} unless the turn already ended.
     *
     * @return {@code true} if the state changed
     */
    public boolean fail() {
        if (current.isTerminal()) {
            return false;
        }
        current = State.FAILED;
        visited.add(State.FAILED);
        return true;
    }

    public State current() {
        return current;
    }

    /**
     * States in the order they were entered, starting with {@link State#BUILDING_CONTEXT}.
     */
    public List<State> path() {
        return List.copyOf(visited);
    }
}
