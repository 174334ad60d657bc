package com.example.crag.service.rag.orchestrator;

import com.example.crag.config.GateConfig;
import com.example.crag.config.GateOverrides;
import com.example.crag.domain.model.GateEvaluation;
import com.example.crag.domain.model.RetrievalResult;
import com.example.crag.domain.model.RetryParameters;
import com.example.crag.telemetry.CragMetrics;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-shot entry points for callers that only need the gate verdict, or want to
 * drive their own retry loop.
 */
public class CragGateFacade {

    private final GateConfig baseConfig;
    private final CragMetrics metrics;

    public CragGateFacade(GateConfig baseConfig, CragMetrics metrics) {
        this.baseConfig = Objects.requireNonNull(baseConfig, "baseConfig");
        this.metrics = metrics == null ? CragMetrics.noop() : metrics;
    }

    public Map<String, Object> evaluateGate(List<RetrievalResult> results) {
        return evaluateGate(results, GateOverrides.none());
    }

    /** Flat, JSON-serializable evaluation summary. */
    public Map<String, Object> evaluateGate(List<RetrievalResult> results, GateOverrides overrides) {
        return evaluate(results, overrides).toMap();
    }

    public GateEvaluation evaluate(List<RetrievalResult> results, GateOverrides overrides) {
        return orchestrator(overrides).evaluateResults(results);
    }

    /** First strategy for the current evidence, empty when no retry is warranted. */
    public Optional<RetryParameters> getRetryStrategy(List<RetrievalResult> results,
                                                      int baseTopK,
                                                      boolean alreadyTriedMultiQuery,
                                                      boolean alreadyTriedHyde,
                                                      GateOverrides overrides) {
        CorrectiveRetrievalOrchestrator orchestrator = orchestrator(overrides);
        GateEvaluation evaluation = orchestrator.evaluateResults(results);
        return Optional.ofNullable(orchestrator.getRetryParameters(
                evaluation, baseTopK, alreadyTriedMultiQuery, alreadyTriedHyde, 0));
    }

    private CorrectiveRetrievalOrchestrator orchestrator(GateOverrides overrides) {
        return new CorrectiveRetrievalOrchestrator(baseConfig.withOverrides(overrides), metrics);
    }
}
