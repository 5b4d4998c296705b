package com.smurthy.ai.derma.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Configuration properties for retrieval sources and specialist agents
 *
 * @param timeout       per-search deadline, also applied as JDBC query and HTTP read timeout
 * @param workerThreads size of each source's worker pool (catalog, documents, web)
 */
@ConfigurationProperties(prefix = "derma.retrieval")
public record RetrievalProperties(
        @DefaultValue("derma_products") String catalogTable,
        @DefaultValue("derma_blogs") String documentTable,
        @DefaultValue("1536") int embeddingDimensions,
        @DefaultValue("5") int catalogTopK,
        @DefaultValue("3") int documentTopK,
        @DefaultValue("3") int webTopK,
        @DefaultValue("4") int overfetchFactor,
        @DefaultValue("2") int documentChunkOverfetch,
        @DefaultValue("1") int minCatalogResults,
        @DefaultValue("0.0") double similarityThreshold,
        @DefaultValue("true") boolean serverSideFiltering,
        @DefaultValue("3s") Duration timeout,
        @DefaultValue("4") int workerThreads
) {
}
