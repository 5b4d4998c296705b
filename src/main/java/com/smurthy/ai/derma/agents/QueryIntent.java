package com.smurthy.ai.derma.agents;

import com.smurthy.ai.derma.retrieval.Constraint;

import java.util.List;
import java.util.Objects;

/**
 * Routing decision for a user query: the intent selecting the specialist and the structured
 * constraints extracted from the query text.
 *
 * @param ambiguous whether no signal cleared the confidence threshold and the intent is a default
 *                  or an inherited one
 */
public record QueryIntent(
        Intent intent,
        List<Constraint> constraints,
        boolean ambiguous,
        String reasoning
) {
    public QueryIntent {
        Objects.requireNonNull(intent, "intent");
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }

    public QueryIntent withIntent(Intent newIntent, String newReasoning) {
        return new QueryIntent(newIntent, constraints, ambiguous, newReasoning);
    }
}
