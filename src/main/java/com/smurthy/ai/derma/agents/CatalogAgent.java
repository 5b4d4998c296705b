package com.smurthy.ai.derma.agents;

import com.smurthy.ai.derma.retrieval.Constraint;
import com.smurthy.ai.derma.retrieval.EvidenceItem;
import com.smurthy.ai.derma.retrieval.RetrievalSourceAdapter;
import com.smurthy.ai.derma.retrieval.SourceSchema;
import com.smurthy.ai.derma.retrieval.SourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Specialized Agent for product catalog lookups
 *
 * Maps constraints onto the catalog schema and searches the catalog adapter. When fewer than
 * {@code minResults} products match, the search is relaxed step by step:
 * <ol>
 *   <li>all constraints</li>
 *   <li>only the constraints on the single most important attribute (price, then category,
 *       then whichever attribute was extracted first)</li>
 *   <li>no constraints, plain semantic search</li>
 * </ol>
 * A step identical to the previous one is skipped, so the adapter is called at most three times.
 */
public class CatalogAgent implements SpecialistAgent {

    private static final Logger log = LoggerFactory.getLogger(CatalogAgent.class);

    private static final List<String> ATTRIBUTE_PRIORITY = List.of(SourceSchema.PRICE, SourceSchema.CATEGORY);

    private final RetrievalSourceAdapter adapter;
    private final SourceSchema schema;
    private final int topK;
    private final int minResults;

    public CatalogAgent(RetrievalSourceAdapter adapter, SourceSchema schema, int topK, int minResults) {
        this.adapter = adapter;
        this.schema = schema;
        this.topK = topK;
        this.minResults = minResults;
    }

    @Override
    public Intent intent() {
        return Intent.CATALOG_LOOKUP;
    }

    @Override
    public EvidenceBundle handle(String query, List<Constraint> constraints) {
        log.debug("[CatalogAgent] Processing: {} {}", query, constraints);
        long startTime = System.currentTimeMillis();

        List<List<Constraint>> ladder = relaxationLadder(toCatalogConstraints(constraints));
        List<EvidenceItem> best = List.of();
        List<Constraint> bestApplied = List.of();

        for (int step = 0; step < ladder.size(); step++) {
            List<Constraint> applied = ladder.get(step);
            List<EvidenceItem> items;
            try {
                items = adapter.search(query, applied, topK);
            } catch (SourceUnavailableException e) {
                long elapsed = System.currentTimeMillis() - startTime;
                log.warn("[CatalogAgent] Catalog unavailable after {}ms, returning {} partial items: {}",
                        elapsed, best.size(), e.getMessage());
                return EvidenceBundle.degraded(name(), best, bestApplied);
            }

            if (items.size() > best.size()) {
                best = items;
                bestApplied = applied;
            }
            if (items.size() >= minResults) {
                break;
            }
            if (step + 1 < ladder.size()) {
                log.info("[CatalogAgent] {} results for {}, relaxing to {}", items.size(), applied, ladder.get(step + 1));
            }
        }

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("[CatalogAgent] Completed in {}ms with {} products under {}", elapsed, best.size(), bestApplied);
        return EvidenceBundle.of(name(), best, bestApplied);
    }

    /**
     * Constraints on attributes the catalog does not carry (a skin concern) are left to other
     * sources; the rest are type-checked against the catalog schema.
     */
    private List<Constraint> toCatalogConstraints(List<Constraint> constraints) {
        List<Constraint> known = new ArrayList<>();
        for (Constraint constraint : constraints) {
            if (schema.attribute(constraint.attribute()).isPresent()) {
                known.add(constraint);
            } else {
                log.debug("[CatalogAgent] {} does not apply to products", constraint);
            }
        }
        return schema.validate(known);
    }

    /**
     * Distinct constraint sets to try, strictest first.
     */
    static List<List<Constraint>> relaxationLadder(List<Constraint> constraints) {
        List<List<Constraint>> ladder = new ArrayList<>();
        ladder.add(List.copyOf(constraints));
        if (constraints.isEmpty()) {
            return ladder;
        }

        String anchor = mostImportantAttribute(constraints);
        List<Constraint> anchored = constraints.stream()
                .filter(c -> c.attribute().equals(anchor))
                .collect(Collectors.toList());
        if (!anchored.equals(ladder.get(ladder.size() - 1))) {
            ladder.add(anchored);
        }
        ladder.add(List.of());
        return ladder;
    }

    private static String mostImportantAttribute(List<Constraint> constraints) {
        for (String attribute : ATTRIBUTE_PRIORITY) {
            if (constraints.stream().anyMatch(c -> c.attribute().equals(attribute))) {
                return attribute;
            }
        }
        return constraints.get(0).attribute();
    }
}
