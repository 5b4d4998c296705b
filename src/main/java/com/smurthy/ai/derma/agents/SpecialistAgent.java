package com.smurthy.ai.derma.agents;

import com.smurthy.ai.derma.retrieval.Constraint;

import java.util.List;

/**
 * A specialist bound to one retrieval source and one intent.
 *
 * {@link #handle} never throws for retrieval failures: an unavailable source yields a bundle
 * flagged {@code degraded} carrying whatever evidence was already collected.
 */
public interface SpecialistAgent {

    Intent intent();

    default String name() {
        return intent().label();
    }

    EvidenceBundle handle(String query, List<Constraint> constraints);
}
