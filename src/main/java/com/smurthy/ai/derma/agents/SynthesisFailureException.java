package com.smurthy.ai.derma.agents;

/**
 * The answer could not be generated. Fatal to the turn.
 */
public class SynthesisFailureException extends RuntimeException {

    public SynthesisFailureException(String message) {
        super(message);
    }

    public SynthesisFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
