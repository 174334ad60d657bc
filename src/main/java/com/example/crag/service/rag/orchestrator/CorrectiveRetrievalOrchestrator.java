package com.example.crag.service.rag.orchestrator;

import com.example.crag.config.GateConfig;
import com.example.crag.domain.model.AuditTrail;
import com.example.crag.domain.model.CorrectiveAction;
import com.example.crag.domain.model.GateEvaluation;
import com.example.crag.domain.model.RetrievalResult;
import com.example.crag.domain.model.RetryParameters;
import com.example.crag.service.rag.gate.EvidenceClassifier;
import com.example.crag.service.rag.strategy.RetryStrategyBuilder;
import com.example.crag.telemetry.CragMetrics;

import java.util.List;
import java.util.Objects;

/**
 * Decision layer of the correction loop: evaluate, decide whether to retry, pick the
 * next strategy, and record what happened. Holds no per-request state.
 */
public class CorrectiveRetrievalOrchestrator {

    private final GateConfig config;
    private final EvidenceClassifier classifier;
    private final CragMetrics metrics;

    public CorrectiveRetrievalOrchestrator(GateConfig config) {
        this(config, CragMetrics.noop());
    }

    public CorrectiveRetrievalOrchestrator(GateConfig config, CragMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.classifier = new EvidenceClassifier(config);
        this.metrics = metrics == null ? CragMetrics.noop() : metrics;
    }

    public GateConfig config() {
        return config;
    }

    /** Same metrics, different gate settings. */
    public CorrectiveRetrievalOrchestrator withConfig(GateConfig other) {
        if (other == null || other.equals(config)) {
            return this;
        }
        return new CorrectiveRetrievalOrchestrator(other, metrics);
    }

    public GateEvaluation evaluateResults(List<RetrievalResult> results) {
        GateEvaluation evaluation = classifier.evaluate(results);
        metrics.gateEvaluated(evaluation.evidenceLevel());
        return evaluation;
    }

    public boolean shouldRetry(GateEvaluation evaluation, int round) {
        if (evaluation.gatePassed()) {
            return false;
        }
        if (round >= config.maxRetryRounds()) {
            return false;
        }
        if (evaluation.resultCount() == 0 && round > 0) {
            return false;
        }
        return evaluation.evidenceLevel().requiresCorrection();
    }

    /** The strategy for {@code round}, or null once none is left. */
    public RetryParameters getRetryParameters(GateEvaluation evaluation,
                                              int baseTopK,
                                              boolean alreadyTriedMultiQuery,
                                              boolean alreadyTriedHyde,
                                              int round) {
        if (!shouldRetry(evaluation, round)) {
            return null;
        }
        List<RetryParameters> strategies = new RetryStrategyBuilder(config, baseTopK)
                .buildStrategies(evaluation.evidenceLevel(), alreadyTriedMultiQuery, alreadyTriedHyde);
        return round < strategies.size() ? strategies.get(round) : null;
    }

    public AuditTrail createAuditTrail(String query, List<RetrievalResult> initialResults) {
        return new AuditTrail(query, evaluateResults(initialResults));
    }

    /**
     * Evaluates {@code results}, appends the action to {@code trail} and returns the evaluation.
     */
    public GateEvaluation recordAction(AuditTrail trail,
                                       String strategyName,
                                       List<RetrievalResult> results,
                                       long durationMs,
                                       RetryParameters parameters,
                                       String error) {
        GateEvaluation evaluation = evaluateResults(results);
        boolean success = evaluation.gatePassed();
        trail.addAction(new CorrectiveAction(strategyName, success, durationMs, evaluation.resultCount(),
                evaluation.bestScore(), evaluation.avgTop3Score(), parameters, error));
        metrics.correctiveAction(strategyName, success);
        return evaluation;
    }
}
