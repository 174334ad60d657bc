package com.example.crag.domain.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one evidence classification. A fresh value per evaluation.
 */
public record GateEvaluation(boolean gatePassed,
                             EvidenceLevel evidenceLevel,
                             double bestScore,
                             double avgTop3Score,
                             int resultCount,
                             List<String> reasons,
                             List<String> recommendedActions) {

    public GateEvaluation {
        Objects.requireNonNull(evidenceLevel, "evidenceLevel");
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        recommendedActions = recommendedActions == null ? List.of() : List.copyOf(recommendedActions);
    }

    public double confidence() {
        return evidenceLevel.confidence();
    }

    /** Reasons joined with {@code "; "}. */
    public String reason() {
        return String.join("; ", reasons);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("gatePassed", gatePassed);
        m.put("evidenceLevel", evidenceLevel.wireValue());
        m.put("bestScore", round4(bestScore));
        m.put("avgTop3Score", round4(avgTop3Score));
        m.put("resultCount", resultCount);
        m.put("reasons", reasons);
        m.put("recommendedActions", recommendedActions);
        m.put("confidence", evidenceLevel.confidence());
        m.put("reason", reason());
        m.put("safeMode", !gatePassed);
        return m;
    }

    public static double round4(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
