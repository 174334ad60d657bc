package com.example.crag.domain.model;

import java.util.Map;
import java.util.Objects;

/**
 * Arguments for one call to a search backend.
 *
 * @param extra backend-specific pass-through values, never null
 */
public record SearchRequest(String query,
                            int topK,
                            double lexicalWeight,
                            double semanticWeight,
                            Map<String, Object> extra) {

    public SearchRequest {
        Objects.requireNonNull(query, "query");
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    public static SearchRequest of(String query, RetryParameters params, Map<String, Object> extra) {
        return new SearchRequest(query, params.topK(), params.lexicalWeight(), params.semanticWeight(), extra);
    }

    public SearchRequest withQuery(String newQuery) {
        return new SearchRequest(newQuery, topK, lexicalWeight, semanticWeight, extra);
    }
}
