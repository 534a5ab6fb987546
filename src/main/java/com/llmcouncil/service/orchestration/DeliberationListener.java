package com.llmcouncil.service.orchestration;

/**
 * Receives stage-boundary events of a turn, on the thread running the turn.
 *
 * <p>Listeners observe; they cannot change the outcome. An exception thrown by a listener is
 * logged and otherwise ignored.
 */
@FunctionalInterface
public interface DeliberationListener {

    DeliberationListener NOOP = event -> { };

    void onEvent(DeliberationEvent event);
}
