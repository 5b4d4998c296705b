package com.smurthy.ai.derma.agents;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.smurthy.ai.derma.retrieval.Constraint;
import com.smurthy.ai.derma.retrieval.EvidenceItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered evidence collected for one turn.
 *
 * @param agentName          specialist that produced the evidence; after a fallback hop this is
 *                           {@code "general-knowledge (fallback)"}
 * @param items              ranked evidence, source-locally ordered
 * @param degraded           a retrieval source failed while collecting this evidence
 * @param fallbackTriggered  the general-knowledge agent was dispatched as a second pass
 * @param appliedConstraints constraints in force for the search that produced the items
 */
public record EvidenceBundle(
        String agentName,
        List<EvidenceItem> items,
        boolean degraded,
        boolean fallbackTriggered,
        List<Constraint> appliedConstraints
) {
    public static final String FALLBACK_SUFFIX = " (fallback)";

    public EvidenceBundle {
        Objects.requireNonNull(agentName, "agentName");
        items = items == null ? List.of() : List.copyOf(items);
        appliedConstraints = appliedConstraints == null ? List.of() : List.copyOf(appliedConstraints);
    }

    public static EvidenceBundle of(String agentName, List<EvidenceItem> items, List<Constraint> applied) {
        return new EvidenceBundle(agentName, items, false, false, applied);
    }

    public static EvidenceBundle degraded(String agentName, List<EvidenceItem> items, List<Constraint> applied) {
        return new EvidenceBundle(agentName, items, true, false, applied);
    }

    /**
     * Combines a degraded primary bundle with the evidence of the fallback agent. Primary items
     * (if any survived) stay first; the result is always flagged degraded.
     */
    public static EvidenceBundle withFallback(EvidenceBundle primary, EvidenceBundle fallback) {
        List<EvidenceItem> merged = new ArrayList<>(primary.items());
        merged.addAll(fallback.items());
        return new EvidenceBundle(
                fallback.agentName() + FALLBACK_SUFFIX,
                merged,
                true,
                true,
                primary.appliedConstraints()
        );
    }

    @JsonIgnore
    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }
}
