package com.smurthy.ai.derma.history;

import com.smurthy.ai.derma.agents.Citation;
import com.smurthy.ai.derma.agents.EvidenceBundle;
import com.smurthy.ai.derma.agents.Intent;
import com.smurthy.ai.derma.retrieval.Constraint;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One completed query-answer exchange, the unit of conversation history.
 *
 * Created only by the orchestrator after a turn completes; never modified afterwards.
 */
public record Turn(
        String query,
        Intent intent,
        List<Constraint> constraints,
        EvidenceBundle evidenceBundle,
        String answer,
        List<Citation> citations,
        String agentUsed,
        Instant timestamp
) {
    public Turn {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(evidenceBundle, "evidenceBundle");
        Objects.requireNonNull(answer, "answer");
        Objects.requireNonNull(agentUsed, "agentUsed");
        Objects.requireNonNull(timestamp, "timestamp");
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
        citations = citations == null ? List.of() : List.copyOf(citations);
    }
}
