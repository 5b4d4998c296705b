package com.smurthy.ai.derma.retrieval;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One retrieved piece of evidence.
 *
 * {@code score} is on the producing source's own scale; items from different sources are never
 * ranked against each other.
 */
public record EvidenceItem(
        String sourceId,
        SourceKind sourceKind,
        double score,
        String contentExcerpt,
        Map<String, Object> metadata
) {
    /** Score descending, then source id ascending so equal scores still order deterministically. */
    public static final Comparator<EvidenceItem> RANKING = Comparator
            .comparingDouble(EvidenceItem::score).reversed()
            .thenComparing(EvidenceItem::sourceId);

    public EvidenceItem {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(sourceKind, "sourceKind");
        contentExcerpt = contentExcerpt == null ? "" : contentExcerpt;
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Human-readable label: product name, article title or web page title.
     */
    public String label() {
        Object label = metadata.get("name");
        if (label == null) {
            label = metadata.get("title");
        }
        return label == null ? sourceId : label.toString();
    }

    public String url() {
        Object url = metadata.get("url");
        return url == null ? null : url.toString();
    }
}
