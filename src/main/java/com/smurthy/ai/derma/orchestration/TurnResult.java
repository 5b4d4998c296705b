package com.smurthy.ai.derma.orchestration;

import com.smurthy.ai.derma.agents.Citation;
import com.smurthy.ai.derma.history.Turn;

import java.util.List;

/**
 * Outcome of a completed turn.
 *
 * @param turn       the turn as appended to history
 * @param states     visited states, {@code RECEIVED} through {@code COMPLETED}
 * @param dispatches agents dispatched, at most two
 */
public record TurnResult(
        String sessionId,
        Turn turn,
        List<TurnState> states,
        List<String> dispatches
) {
    public TurnResult {
        states = List.copyOf(states);
        dispatches = List.copyOf(dispatches);
    }

    public String answer() {
        return turn.answer();
    }

    public List<Citation> citations() {
        return turn.citations();
    }

    public String agentUsed() {
        return turn.agentUsed();
    }

    public boolean degraded() {
        return turn.evidenceBundle().degraded();
    }

    public boolean fallbackTriggered() {
        return turn.evidenceBundle().fallbackTriggered();
    }
}
