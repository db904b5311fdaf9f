package com.openforge.cortex.signal;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Enriched retrieval query for one core. {@code contextualHints} is optional.
 */
public record SemanticEnrichment(String enrichedQuery, List<String> keywords, JsonNode contextualHints) {

    public SemanticEnrichment {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    /** The original query unchanged and no keywords. */
    public static SemanticEnrichment unchanged(String query) {
        return new SemanticEnrichment(query, List.of(), null);
    }
}
