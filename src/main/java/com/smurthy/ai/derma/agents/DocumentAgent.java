package com.smurthy.ai.derma.agents;

import com.smurthy.ai.derma.retrieval.Constraint;
import com.smurthy.ai.derma.retrieval.EvidenceItem;
import com.smurthy.ai.derma.retrieval.RetrievalSourceAdapter;
import com.smurthy.ai.derma.retrieval.SourceSchema;
import com.smurthy.ai.derma.retrieval.SourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Specialized Agent for skincare articles
 *
 * Articles are tagged by topic rather than priced or categorized, so only skin type and concern
 * constraints carry over, both as {@code tags} constraints. Articles are stored in chunks; the
 * agent over-fetches and keeps the best-scoring chunk per article title.
 */
public class DocumentAgent implements SpecialistAgent {

    private static final Logger log = LoggerFactory.getLogger(DocumentAgent.class);

    private static final Set<String> TAG_SOURCES = Set.of(SourceSchema.SKIN_TYPE, ConstraintExtractor.CONCERN);

    private final RetrievalSourceAdapter adapter;
    private final int topK;
    private final int chunkOverfetch;

    public DocumentAgent(RetrievalSourceAdapter adapter, int topK, int chunkOverfetch) {
        this.adapter = adapter;
        this.topK = topK;
        this.chunkOverfetch = Math.max(1, chunkOverfetch);
    }

    @Override
    public Intent intent() {
        return Intent.DOCUMENT_LOOKUP;
    }

    @Override
    public EvidenceBundle handle(String query, List<Constraint> constraints) {
        log.debug("[DocumentAgent] Processing: {}", query);
        long startTime = System.currentTimeMillis();

        List<Constraint> applied = toDocumentConstraints(constraints);
        List<EvidenceItem> items;
        try {
            items = deduplicateByTitle(adapter.search(query, applied, topK * chunkOverfetch));
            if (items.isEmpty() && !applied.isEmpty()) {
                log.info("[DocumentAgent] No articles tagged {}, searching untagged", applied);
                applied = List.of();
                items = deduplicateByTitle(adapter.search(query, applied, topK * chunkOverfetch));
            }
        } catch (SourceUnavailableException e) {
            log.warn("[DocumentAgent] Article store unavailable: {}", e.getMessage());
            return EvidenceBundle.degraded(name(), List.of(), applied);
        }

        List<EvidenceItem> top = items.size() > topK ? items.subList(0, topK) : items;
        long elapsed = System.currentTimeMillis() - startTime;
        log.info("[DocumentAgent] Completed in {}ms with {} articles", elapsed, top.size());
        return EvidenceBundle.of(name(), top, applied);
    }

    static List<Constraint> toDocumentConstraints(List<Constraint> constraints) {
        Set<String> tags = new LinkedHashSet<>();
        for (Constraint constraint : constraints) {
            if (TAG_SOURCES.contains(constraint.attribute())) {
                tags.addAll(constraint.values());
            } else {
                log.debug("[DocumentAgent] {} does not apply to articles", constraint);
            }
        }
        return tags.isEmpty() ? List.of() : List.of(Constraint.containsAny(SourceSchema.TAGS, tags));
    }

    /**
     * Keeps the highest-scoring chunk per article. Input is ranked, so the first chunk seen wins.
     */
    static List<EvidenceItem> deduplicateByTitle(List<EvidenceItem> ranked) {
        Map<String, EvidenceItem> byTitle = new LinkedHashMap<>();
        for (EvidenceItem item : ranked) {
            Object title = item.metadata().get("title");
            String key = title != null && !title.toString().isBlank() ? title.toString() : item.sourceId();
            byTitle.putIfAbsent(key, item);
        }
        return new ArrayList<>(byTitle.values());
    }
}
