package com.smurthy.ai.derma.retrieval;

import com.smurthy.ai.derma.service.WebSearchClient;
import com.smurthy.ai.derma.service.WebSearchResult;
import com.smurthy.ai.derma.thread.MdcAwareTimeoutExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Retrieval adapter over an open web search provider.
 *
 * The web has no attribute schema, so constraints are ignored. Results are scored by provider
 * rank ({@code 1 / (rank + 1)}), which keeps the provider's order and stays on a web-local scale.
 */
public class WebSearchSourceAdapter implements RetrievalSourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(WebSearchSourceAdapter.class);

    private final WebSearchClient client;
    private final MdcAwareTimeoutExecutor executor;
    private final Duration timeout;
    private final String querySuffix;

    public WebSearchSourceAdapter(WebSearchClient client,
                                  MdcAwareTimeoutExecutor executor,
                                  Duration timeout,
                                  String querySuffix) {
        this.client = client;
        this.executor = executor;
        this.timeout = timeout;
        this.querySuffix = querySuffix;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.WEB;
    }

    @Override
    public List<EvidenceItem> search(String queryText, List<Constraint> constraints, int k)
            throws SourceUnavailableException {
        if (k <= 0) {
            return List.of();
        }
        if (constraints != null && !constraints.isEmpty()) {
            log.debug("[web] ignoring {} constraints, web search has no attribute filters", constraints.size());
        }

        String searchQuery = StringUtils.hasText(querySuffix) ? queryText + " " + querySuffix : queryText;
        List<WebSearchResult> results = fetch(searchQuery, k);

        List<EvidenceItem> items = new ArrayList<>();
        for (int rank = 0; rank < results.size() && items.size() < k; rank++) {
            WebSearchResult result = results.get(rank);
            String sourceId = StringUtils.hasText(result.url()) ? result.url() : "web-result-" + (rank + 1);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("title", result.title());
            metadata.put("url", result.url());
            metadata.put("rank", rank + 1);
            metadata.put("provider", client.providerName());

            items.add(new EvidenceItem(
                    sourceId,
                    SourceKind.WEB,
                    1.0 / (rank + 1),
                    result.title() + "\n" + result.snippet() + "\nSource: " + result.url(),
                    metadata
            ));
        }
        items.sort(EvidenceItem.RANKING);

        log.info("[web] {} returned {} results for '{}'", client.providerName(), items.size(), searchQuery);
        return items;
    }

    private List<WebSearchResult> fetch(String query, int k) throws SourceUnavailableException {
        try {
            List<WebSearchResult> results = executor.call(() -> client.search(query, k), timeout);
            return results == null ? List.of() : results;
        } catch (TimeoutException e) {
            log.warn("[web] {} timed out after {}ms", client.providerName(), timeout.toMillis());
            throw new SourceUnavailableException(SourceKind.WEB,
                    "web search timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            log.warn("[web] {} failed: {}", client.providerName(), e.getCause().getMessage());
            throw new SourceUnavailableException(SourceKind.WEB, "web search unavailable", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(SourceKind.WEB, "web search interrupted", e);
        }
    }
}
