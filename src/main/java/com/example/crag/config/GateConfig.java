package com.example.crag.config;

import lombok.Builder;

import static com.example.crag.config.CragConfigException.require;
import static com.example.crag.config.CragConfigException.requireNonNegative;
import static com.example.crag.config.CragConfigException.requireUnit;

/**
 * Immutable evidence gate and strategy settings. Validated on construction.
 *
 * <p>Build from {@link #defaults()} with {@code toBuilder()} to change single values.</p>
 */
@Builder(toBuilder = true)
public record GateConfig(double minBestScore,
                         double minAvgTop3Score,
                         double strongBestThreshold,
                         double strongAvgThreshold,
                         int maxRetryRounds,
                         boolean multiQueryEnabled,
                         boolean hydeEnabled,
                         int multiQueryFanout,
                         double aggressiveTopKMultiplier,
                         double aggressiveLexicalWeight,
                         double aggressiveSemanticWeight) {

    private static final GateConfig DEFAULTS = new GateConfig(
            0.5, 0.35, 0.70, 0.55, 2, true, true, 3, 2.0, 0.45, 0.55);

    public GateConfig {
        requireNonNegative("minBestScore", minBestScore);
        requireNonNegative("minAvgTop3Score", minAvgTop3Score);
        requireNonNegative("strongBestThreshold", strongBestThreshold);
        requireNonNegative("strongAvgThreshold", strongAvgThreshold);
        require(strongBestThreshold >= minBestScore,
                "strongBestThreshold (" + strongBestThreshold + ") must be >= minBestScore (" + minBestScore + ")");
        require(strongAvgThreshold >= minAvgTop3Score,
                "strongAvgThreshold (" + strongAvgThreshold + ") must be >= minAvgTop3Score (" + minAvgTop3Score + ")");
        require(maxRetryRounds >= 0, "maxRetryRounds must be >= 0 but was " + maxRetryRounds);
        require(multiQueryFanout >= 1, "multiQueryFanout must be >= 1 but was " + multiQueryFanout);
        require(Double.isFinite(aggressiveTopKMultiplier) && aggressiveTopKMultiplier >= 1.0,
                "aggressiveTopKMultiplier must be >= 1 but was " + aggressiveTopKMultiplier);
        requireUnit("aggressiveLexicalWeight", aggressiveLexicalWeight);
        requireUnit("aggressiveSemanticWeight", aggressiveSemanticWeight);
    }

    public static GateConfig defaults() {
        return DEFAULTS;
    }

    /** Copy with the non-null override values applied, validated again. */
    public GateConfig withOverrides(GateOverrides overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        double minBest = overrides.minBestScore() != null ? overrides.minBestScore() : minBestScore;
        double minAvg = overrides.minAvgTop3Score() != null ? overrides.minAvgTop3Score() : minAvgTop3Score;
        return toBuilder()
                .minBestScore(minBest)
                .minAvgTop3Score(minAvg)
                // lowered minimums stay valid; raised ones lift the strong thresholds with them
                .strongBestThreshold(Math.max(strongBestThreshold, minBest))
                .strongAvgThreshold(Math.max(strongAvgThreshold, minAvg))
                .maxRetryRounds(overrides.maxRetryRounds() != null ? overrides.maxRetryRounds() : maxRetryRounds)
                .multiQueryEnabled(overrides.multiQueryEnabled() != null
                        ? overrides.multiQueryEnabled() : multiQueryEnabled)
                .hydeEnabled(overrides.hydeEnabled() != null ? overrides.hydeEnabled() : hydeEnabled)
                .build();
    }

    /**
     * Effective config for a request: a strategy stays enabled only if its collaborator is present.
     */
    public GateConfig withCapabilities(boolean multiQueryAvailable, boolean hydeAvailable) {
        boolean multi = multiQueryEnabled && multiQueryAvailable;
        boolean hyde = hydeEnabled && hydeAvailable;
        if (multi == multiQueryEnabled && hyde == hydeEnabled) {
            return this;
        }
        return toBuilder().multiQueryEnabled(multi).hydeEnabled(hyde).build();
    }
}
