package com.example.crag.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;

/** Lightweight per-round hint: breadth multiplier, weight pair and strategy flags. */
public record StrategyAdjustment(double topKMultiplier,
                                 double lexicalWeight,
                                 double semanticWeight,
                                 boolean useMultiQuery,
                                 boolean useHyde) {

    public static StrategyAdjustment none() {
        return new StrategyAdjustment(1.0, 0.5, 0.5, false, false);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("topKMultiplier", topKMultiplier);
        m.put("lexicalWeight", lexicalWeight);
        m.put("semanticWeight", semanticWeight);
        m.put("useMultiQuery", useMultiQuery);
        m.put("useHyde", useHyde);
        return m;
    }
}
