package com.example.crag.service.rag.gate;

import com.example.crag.config.GateConfig;
import com.example.crag.domain.model.EvidenceLevel;
import com.example.crag.domain.model.GateEvaluation;
import com.example.crag.domain.model.RetrievalResult;
import com.example.crag.service.rag.strategy.StrategyNames;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Scores a result list against the gate thresholds. Pure and never throws.
 */
public class EvidenceClassifier {

    static final String NO_RESULTS = "No results returned from search";
    static final String BEST_BELOW = "Best score below minimum threshold";
    static final String AVG_BELOW = "Average score below minimum threshold";
    static final String GATE_PASSED = "Gate passed: evidence quality acceptable";

    private final GateConfig config;

    public EvidenceClassifier(GateConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public GateConfig config() {
        return config;
    }

    public GateEvaluation evaluate(List<RetrievalResult> results) {
        if (results == null || results.isEmpty()) {
            return new GateEvaluation(false, EvidenceLevel.INSUFFICIENT, 0.0, 0.0, 0,
                    List.of(NO_RESULTS),
                    List.of(StrategyNames.MULTI_QUERY, StrategyNames.HYDE, StrategyNames.EXPAND_SOURCES));
        }

        List<Double> scores = ScoreExtractor.extractAll(results);
        double best = scores.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double avgTop3 = averageTop(scores, 3);

        EvidenceLevel level = classify(best, avgTop3);
        boolean passed = best >= config.minBestScore() && avgTop3 >= config.minAvgTop3Score();

        return new GateEvaluation(passed, level, best, avgTop3, results.size(),
                reasons(best, avgTop3, passed), recommendedActions(level, best));
    }

    /** Strict order: STRONG, MODERATE, LOW (any positive score), INSUFFICIENT. */
    public EvidenceLevel classify(double bestScore, double avgTop3Score) {
        if (bestScore >= config.strongBestThreshold() && avgTop3Score >= config.strongAvgThreshold()) {
            return EvidenceLevel.STRONG;
        }
        if (bestScore >= config.minBestScore() && avgTop3Score >= config.minAvgTop3Score()) {
            return EvidenceLevel.MODERATE;
        }
        if (bestScore > 0 || avgTop3Score > 0) {
            return EvidenceLevel.LOW;
        }
        return EvidenceLevel.INSUFFICIENT;
    }

    static double averageTop(List<Double> scores, int n) {
        if (scores.isEmpty()) {
            return 0.0;
        }
        return scores.stream()
                .sorted(Comparator.reverseOrder())
                .limit(n)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
    }

    private List<String> reasons(double best, double avgTop3, boolean passed) {
        List<String> reasons = new ArrayList<>(5);
        reasons.add(String.format(Locale.ROOT, "best_score=%.3f (threshold=%.2f)", best, config.minBestScore()));
        reasons.add(String.format(Locale.ROOT, "avg_top3=%.3f (threshold=%.2f)", avgTop3, config.minAvgTop3Score()));
        if (best < config.minBestScore()) {
            reasons.add(BEST_BELOW);
        }
        if (avgTop3 < config.minAvgTop3Score()) {
            reasons.add(AVG_BELOW);
        }
        if (passed) {
            reasons.add(GATE_PASSED);
        }
        return reasons;
    }

    private List<String> recommendedActions(EvidenceLevel level, double best) {
        if (level == EvidenceLevel.STRONG) {
            return List.of();
        }
        if (level == EvidenceLevel.MODERATE) {
            return List.of(StrategyNames.EXPAND_TOP_K);
        }
        List<String> actions = new ArrayList<>(4);
        if (config.multiQueryEnabled()) {
            actions.add(StrategyNames.MULTI_QUERY);
        }
        if (config.hydeEnabled() && best < config.minBestScore() * 0.5) {
            actions.add(StrategyNames.HYDE);
        }
        actions.add(StrategyNames.AGGRESSIVE_HYBRID);
        if (level == EvidenceLevel.INSUFFICIENT) {
            actions.add(StrategyNames.EXPAND_SOURCES);
            if (config.hydeEnabled() && !actions.contains(StrategyNames.HYDE)) {
                actions.add(StrategyNames.HYDE);
            }
        }
        return actions;
    }
}
