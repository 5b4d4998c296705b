package com.smurthy.ai.derma.retrieval;

import java.util.List;

/**
 * Uniform search contract over one backing store.
 *
 * Implementations return at most {@code k} items ranked by {@link EvidenceItem#RANKING}. An empty
 * list means the store answered and nothing matched; an unreachable or slow store raises
 * {@link SourceUnavailableException} instead.
 */
public interface RetrievalSourceAdapter {

    SourceKind kind();

    List<EvidenceItem> search(String queryText, List<Constraint> constraints, int k)
            throws SourceUnavailableException;
}
