package com.example.crag.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a single correction request tried and why.
 *
 * <p>Owned by one in-flight request; not thread-safe. Appends are rejected once
 * {@link #finalizeTrail} has been called.</p>
 */
public final class AuditTrail {

    public static final int DEFAULT_MAX_QUERY_CHARS = 200;

    private final String query;
    private final GateEvaluation initialEvaluation;
    private final List<CorrectiveAction> actions = new ArrayList<>();
    private GateEvaluation finalEvaluation;
    private long totalDurationMs;
    private int finalResultCount;
    private boolean finalized;

    public AuditTrail(String query, GateEvaluation initialEvaluation) {
        this.query = query == null ? "" : query;
        this.initialEvaluation = Objects.requireNonNull(initialEvaluation, "initialEvaluation");
    }

    public String query() {
        return query;
    }

    public GateEvaluation initialEvaluation() {
        return initialEvaluation;
    }

    public List<CorrectiveAction> actions() {
        return Collections.unmodifiableList(actions);
    }

    /** Null until finalized. */
    public GateEvaluation finalEvaluation() {
        return finalEvaluation;
    }

    public long totalDurationMs() {
        return totalDurationMs;
    }

    public int finalResultCount() {
        return finalResultCount;
    }

    public boolean isFinalized() {
        return finalized;
    }

    public void addAction(CorrectiveAction action) {
        Objects.requireNonNull(action, "action");
        if (finalized) {
            throw new IllegalStateException("AuditTrail is finalized; cannot add action " + action.strategy());
        }
        actions.add(action);
    }

    public void finalizeTrail(GateEvaluation finalEvaluation, long totalDurationMs, int finalResultCount) {
        if (finalized) {
            throw new IllegalStateException("AuditTrail already finalized");
        }
        this.finalEvaluation = Objects.requireNonNull(finalEvaluation, "finalEvaluation");
        this.totalDurationMs = totalDurationMs;
        this.finalResultCount = finalResultCount;
        this.finalized = true;
    }

    public boolean correctionAttempted() {
        return !actions.isEmpty();
    }

    /** The gate failed initially and passes on the final results. */
    public boolean correctionSuccessful() {
        return finalEvaluation != null && finalEvaluation.gatePassed() && !initialEvaluation.gatePassed();
    }

    public Map<String, Object> toMap() {
        return toMap(DEFAULT_MAX_QUERY_CHARS);
    }

    /**
     * JSON-friendly view; nested values are maps, lists, strings, numbers and booleans only.
     */
    public Map<String, Object> toMap(int maxQueryChars) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("query", clip(query, maxQueryChars));
        m.put("initialEvaluation", initialEvaluation.toMap());
        List<Map<String, Object>> actionMaps = new ArrayList<>(actions.size());
        for (CorrectiveAction action : actions) {
            actionMaps.add(action.toMap());
        }
        m.put("correctiveActions", actionMaps);
        m.put("finalEvaluation", finalEvaluation == null ? null : finalEvaluation.toMap());
        m.put("totalDurationMs", totalDurationMs);
        m.put("finalResultCount", finalResultCount);
        m.put("correctionAttempted", correctionAttempted());
        m.put("correctionSuccessful", correctionSuccessful());
        return m;
    }

    public static String clip(String s, int maxChars) {
        if (s == null) {
            return "";
        }
        if (maxChars <= 0 || s.length() <= maxChars) {
            return s;
        }
        return s.substring(0, maxChars);
    }
}
