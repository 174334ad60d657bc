package com.example.crag.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Record of one executed corrective attempt. {@code success} is whether the gate
 * passed on the attempt's own results.
 */
public record CorrectiveAction(String strategy,
                               boolean success,
                               long durationMs,
                               int resultCount,
                               double bestScore,
                               double avgTop3Score,
                               RetryParameters parameters,
                               String error) {

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("strategy", strategy);
        m.put("success", success);
        m.put("durationMs", durationMs);
        m.put("resultCount", resultCount);
        m.put("bestScore", GateEvaluation.round4(bestScore));
        m.put("avgTop3Score", GateEvaluation.round4(avgTop3Score));
        m.put("parameters", parameters == null ? null : parameters.toMap());
        m.put("error", error);
        return m;
    }
}
