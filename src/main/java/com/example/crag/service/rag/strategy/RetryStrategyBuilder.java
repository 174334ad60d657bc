package com.example.crag.service.rag.strategy;

import com.example.crag.config.GateConfig;
import com.example.crag.domain.model.EvidenceLevel;
import com.example.crag.domain.model.RetryParameters;
import com.example.crag.domain.model.StrategyAdjustment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Orders corrective strategies by cost: aggressive hybrid, multi-query, HyDE, then the
 * combined aggressive multi-query as a last resort for INSUFFICIENT evidence.
 */
public class RetryStrategyBuilder {

    /** Upper bound on any widened {@code topK}. */
    public static final int MAX_TOP_K = 50;

    private final GateConfig config;
    private final int baseTopK;

    public RetryStrategyBuilder(GateConfig config, int baseTopK) {
        this.config = Objects.requireNonNull(config, "config");
        this.baseTopK = Math.max(1, baseTopK);
    }

    public List<RetryParameters> buildStrategies(EvidenceLevel level,
                                                 boolean alreadyTriedMultiQuery,
                                                 boolean alreadyTriedHyde) {
        if (level == null || level == EvidenceLevel.STRONG) {
            return List.of();
        }
        if (level == EvidenceLevel.MODERATE) {
            return truncate(List.of(new RetryParameters(widen(1.5), 0.5, 0.5,
                    false, 0, false, StrategyNames.EXPAND_TOP_K)));
        }

        int aggressiveTopK = widen(config.aggressiveTopKMultiplier());
        boolean multiAvailable = config.multiQueryEnabled() && !alreadyTriedMultiQuery;

        List<RetryParameters> strategies = new ArrayList<>(4);
        strategies.add(new RetryParameters(aggressiveTopK,
                config.aggressiveLexicalWeight(), config.aggressiveSemanticWeight(),
                false, 0, false, StrategyNames.AGGRESSIVE_HYBRID));
        if (multiAvailable) {
            strategies.add(new RetryParameters(baseTopK, 0.5, 0.5,
                    true, config.multiQueryFanout(), false, StrategyNames.MULTI_QUERY));
        }
        if (config.hydeEnabled() && !alreadyTriedHyde) {
            strategies.add(new RetryParameters(baseTopK, 0.4, 0.6,
                    false, 0, true, StrategyNames.HYDE));
        }
        if (level == EvidenceLevel.INSUFFICIENT && multiAvailable) {
            strategies.add(new RetryParameters(aggressiveTopK,
                    config.aggressiveLexicalWeight(), config.aggressiveSemanticWeight(),
                    true, config.multiQueryFanout(), false, StrategyNames.AGGRESSIVE_MULTI_QUERY));
        }
        return truncate(strategies);
    }

    /**
     * Per-round hint: round 0 aggressive, round 1 multi-query, later rounds HyDE.
     */
    public StrategyAdjustment suggestAdjustments(EvidenceLevel level, int round) {
        if (level == null || level == EvidenceLevel.STRONG) {
            return StrategyAdjustment.none();
        }
        if (level == EvidenceLevel.MODERATE) {
            return new StrategyAdjustment(1.5, 0.5, 0.5, false, false);
        }
        if (round <= 0) {
            return new StrategyAdjustment(config.aggressiveTopKMultiplier(),
                    config.aggressiveLexicalWeight(), config.aggressiveSemanticWeight(), false, false);
        }
        if (round == 1) {
            return new StrategyAdjustment(1.5, 0.5, 0.5, config.multiQueryEnabled(), false);
        }
        return new StrategyAdjustment(1.0, 0.4, 0.6, false, config.hydeEnabled());
    }

    private int widen(double multiplier) {
        return Math.min((int) (baseTopK * multiplier), MAX_TOP_K);
    }

    private List<RetryParameters> truncate(List<RetryParameters> strategies) {
        int limit = Math.min(strategies.size(), config.maxRetryRounds());
        return List.copyOf(strategies.subList(0, limit));
    }
}
