package com.smurthy.ai.derma.orchestration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Audit record of one turn: visited states and dispatched agents, in order.
 *
 * Confined to the thread running the turn.
 */
public class TurnTrace {

    private final long startNanos = System.nanoTime();
    private final List<TurnState> states = new ArrayList<>();
    private final List<String> dispatches = new ArrayList<>();

    public TurnTrace() {
        states.add(TurnState.RECEIVED);
    }

    public void transition(TurnState next) {
        TurnState current = current();
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal turn transition " + current + " -> " + next);
        }
        states.add(next);
    }

    public void dispatched(String agentName) {
        dispatches.add(agentName);
        transition(TurnState.DISPATCHED);
    }

    public TurnState current() {
        return states.get(states.size() - 1);
    }

    public List<TurnState> states() {
        return Collections.unmodifiableList(states);
    }

    public List<String> dispatches() {
        return Collections.unmodifiableList(dispatches);
    }

    public int dispatchCount() {
        return dispatches.size();
    }

    public long elapsedMillis() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    @Override
    public String toString() {
        return states + " via " + dispatches + " in " + elapsedMillis() + "ms";
    }
}
