package com.smurthy.ai.derma.retrieval;

import com.smurthy.ai.derma.thread.MdcAwareTimeoutExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.Filter;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Retrieval adapter over a Spring AI {@link VectorStore}: similarity search combined with
 * structured filtering.
 *
 * Filtering strategy:
 * - constraints on attributes the store filters at query time are pushed down as a
 *   {@link Filter.Expression}, shrinking the candidate set before ranking
 * - every other constraint is applied in-process over an over-fetched candidate set
 *   ({@code k * overfetchFactor}), then the result is truncated to {@code k}
 *
 * With server-side filtering disabled all constraints take the post-filter path, which yields
 * the same top-k for the same candidate set.
 */
public class VectorStoreSourceAdapter implements RetrievalSourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(VectorStoreSourceAdapter.class);

    private final VectorStore vectorStore;
    private final SourceSchema schema;
    private final MdcAwareTimeoutExecutor executor;
    private final Duration timeout;
    private final int overfetchFactor;
    private final double similarityThreshold;
    private final boolean serverSideFiltering;

    public VectorStoreSourceAdapter(VectorStore vectorStore,
                                    SourceSchema schema,
                                    MdcAwareTimeoutExecutor executor,
                                    Duration timeout,
                                    int overfetchFactor,
                                    double similarityThreshold,
                                    boolean serverSideFiltering) {
        if (overfetchFactor < 1) {
            throw new IllegalArgumentException("overfetchFactor must be >= 1 but was " + overfetchFactor);
        }
        this.vectorStore = vectorStore;
        this.schema = schema;
        this.executor = executor;
        this.timeout = timeout;
        this.overfetchFactor = overfetchFactor;
        this.similarityThreshold = similarityThreshold;
        this.serverSideFiltering = serverSideFiltering;
    }

    @Override
    public SourceKind kind() {
        return schema.kind();
    }

    public SourceSchema schema() {
        return schema;
    }

    @Override
    public List<EvidenceItem> search(String queryText, List<Constraint> constraints, int k)
            throws SourceUnavailableException {
        if (k <= 0) {
            return List.of();
        }

        List<Constraint> valid = schema.validate(constraints);
        List<Constraint> pushedDown = serverSideFiltering
                ? valid.stream().filter(schema::isFilterableAtQueryTime).collect(Collectors.toList())
                : List.of();
        List<Constraint> postFiltered = valid.stream()
                .filter(c -> !pushedDown.contains(c))
                .collect(Collectors.toList());

        int fetchSize = postFiltered.isEmpty() ? k : k * overfetchFactor;

        SearchRequest.Builder request = SearchRequest.builder()
                .query(queryText)
                .topK(fetchSize)
                .similarityThreshold(similarityThreshold);
        if (!pushedDown.isEmpty()) {
            request.filterExpression(toFilterExpression(pushedDown));
        }

        long startTime = System.currentTimeMillis();
        List<Document> candidates = fetch(request.build());
        long elapsed = System.currentTimeMillis() - startTime;

        List<EvidenceItem> ranked = candidates.stream()
                .filter(doc -> ConstraintMatcher.matchesAll(postFiltered, doc.getMetadata()))
                .map(this::toEvidence)
                .sorted(EvidenceItem.RANKING)
                .limit(k)
                .collect(Collectors.toList());

        log.info("[{}] search: {} candidates in {}ms (pushed down {}, post-filtered {}) → {} items",
                schema.kind().label(), candidates.size(), elapsed, pushedDown, postFiltered, ranked.size());
        return ranked;
    }

    private List<Document> fetch(SearchRequest request) throws SourceUnavailableException {
        try {
            List<Document> documents = executor.call(() -> vectorStore.similaritySearch(request), timeout);
            return documents == null ? List.of() : documents;
        } catch (TimeoutException e) {
            log.warn("[{}] vector store timed out after {}ms", schema.kind().label(), timeout.toMillis());
            throw new SourceUnavailableException(schema.kind(),
                    schema.kind().label() + " store timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            log.warn("[{}] vector store failed: {}", schema.kind().label(), e.getCause().getMessage());
            throw new SourceUnavailableException(schema.kind(),
                    schema.kind().label() + " store unavailable", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(schema.kind(), schema.kind().label() + " search interrupted", e);
        }
    }

    private EvidenceItem toEvidence(Document document) {
        Map<String, Object> metadata = document.getMetadata();
        Object nativeId = metadata.get(schema.idKey());
        String sourceId = nativeId != null ? nativeId.toString() : document.getId();
        double score = document.getScore() != null ? document.getScore() : 0.0;
        return new EvidenceItem(
                sourceId,
                schema.kind(),
                score,
                schema.formatter().format(document.getText(), metadata),
                metadata
        );
    }

    /**
     * AND-combines the pushed-down constraints into a portable filter expression.
     */
    static Filter.Expression toFilterExpression(List<Constraint> constraints) {
        FilterExpressionBuilder b = new FilterExpressionBuilder();
        List<FilterExpressionBuilder.Op> ops = new ArrayList<>();
        for (Constraint constraint : constraints) {
            ops.add(switch (constraint.operator()) {
                case AT_MOST -> b.lte(constraint.attribute(), constraint.numericValue());
                case AT_LEAST -> b.gte(constraint.attribute(), constraint.numericValue());
                case EQUALS -> b.eq(constraint.attribute(), constraint.values().iterator().next());
                case ONE_OF -> constraint.values().size() == 1
                        ? b.eq(constraint.attribute(), constraint.values().iterator().next())
                        : b.in(constraint.attribute(), constraint.values().toArray());
                case CONTAINS_ANY -> throw new IllegalArgumentException(
                        "Set-valued constraint cannot be pushed down: " + constraint);
            });
        }
        FilterExpressionBuilder.Op combined = ops.get(0);
        for (int i = 1; i < ops.size(); i++) {
            combined = b.and(combined, ops.get(i));
        }
        return combined.build();
    }
}
