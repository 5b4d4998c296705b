package com.smurthy.ai.derma.agents;

import com.smurthy.ai.derma.retrieval.Constraint;
import com.smurthy.ai.derma.retrieval.EvidenceItem;
import com.smurthy.ai.derma.retrieval.RetrievalSourceAdapter;
import com.smurthy.ai.derma.retrieval.SourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Specialized Agent for open questions, answered from web search.
 *
 * Also the fallback target when a primary specialist's source is down.
 */
public class GeneralKnowledgeAgent implements SpecialistAgent {

    private static final Logger log = LoggerFactory.getLogger(GeneralKnowledgeAgent.class);

    private final RetrievalSourceAdapter webAdapter;
    private final int topK;

    public GeneralKnowledgeAgent(RetrievalSourceAdapter webAdapter, int topK) {
        this.webAdapter = webAdapter;
        this.topK = topK;
    }

    @Override
    public Intent intent() {
        return Intent.GENERAL_KNOWLEDGE;
    }

    @Override
    public EvidenceBundle handle(String query, List<Constraint> constraints) {
        log.debug("[GeneralKnowledgeAgent] Processing: {}", query);
        long startTime = System.currentTimeMillis();

        try {
            List<EvidenceItem> items = webAdapter.search(query, List.of(), topK);
            long elapsed = System.currentTimeMillis() - startTime;
            log.info("[GeneralKnowledgeAgent] Completed in {}ms with {} web results", elapsed, items.size());
            return EvidenceBundle.of(name(), items, List.of());
        } catch (SourceUnavailableException e) {
            log.warn("[GeneralKnowledgeAgent] Web search unavailable: {}", e.getMessage());
            return EvidenceBundle.degraded(name(), List.of(), List.of());
        }
    }
}
