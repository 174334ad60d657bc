package com.example.crag.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One concrete corrective attempt.
 *
 * @param multiQueryCount number of query variants to fan out to; 0 when {@code useMultiQuery} is off
 * @param strategyName    audit label, also used for "already tried" tracking
 */
public record RetryParameters(int topK,
                              double lexicalWeight,
                              double semanticWeight,
                              boolean useMultiQuery,
                              int multiQueryCount,
                              boolean useHyde,
                              String strategyName) {

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("topK", topK);
        m.put("lexicalWeight", lexicalWeight);
        m.put("semanticWeight", semanticWeight);
        m.put("useMultiQuery", useMultiQuery);
        m.put("multiQueryCount", multiQueryCount);
        m.put("useHyde", useHyde);
        m.put("strategyName", strategyName);
        return m;
    }
}
