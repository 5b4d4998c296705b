package com.smurthy.ai.derma.orchestration;

/**
 * Lifecycle of one turn. {@link #COMPLETED} and {@link #FAILED} are terminal.
 */
public enum TurnState {
    RECEIVED,
    CLASSIFIED,
    DISPATCHED,
    EVIDENCE_COLLECTED,
    SYNTHESIZED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Forward by exactly one step, or to {@link #FAILED} from any non-terminal state.
     * {@link #DISPATCHED} may repeat for the fallback hop.
     */
    public boolean canTransitionTo(TurnState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        if (this == DISPATCHED && next == DISPATCHED) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }
}
