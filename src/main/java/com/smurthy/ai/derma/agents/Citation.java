package com.smurthy.ai.derma.agents;

import com.smurthy.ai.derma.retrieval.EvidenceItem;
import com.smurthy.ai.derma.retrieval.SourceKind;

/**
 * An evidence item the answer actually references, identified by its source id.
 */
public record Citation(String sourceId, SourceKind sourceKind, String label, String url) {

    public static Citation of(EvidenceItem item) {
        return new Citation(item.sourceId(), item.sourceKind(), item.label(), item.url());
    }
}
