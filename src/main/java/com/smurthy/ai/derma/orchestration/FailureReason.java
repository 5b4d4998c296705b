package com.smurthy.ai.derma.orchestration;

public enum FailureReason {
    CLASSIFICATION_FAILED,
    DISPATCH_FAILED,
    SYNTHESIS_FAILED,
    PERSISTENCE_FAILED,
    HISTORY_UNAVAILABLE,
    CANCELLED
}
