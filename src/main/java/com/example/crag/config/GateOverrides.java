package com.example.crag.config;

/**
 * Per-call overrides for a {@link GateConfig}. Null fields keep the base value.
 */
public record GateOverrides(Double minBestScore,
                            Double minAvgTop3Score,
                            Integer maxRetryRounds,
                            Boolean multiQueryEnabled,
                            Boolean hydeEnabled) {

    private static final GateOverrides NONE = new GateOverrides(null, null, null, null, null);

    public static GateOverrides none() {
        return NONE;
    }

    public static GateOverrides thresholds(Double minBestScore, Double minAvgTop3Score) {
        return new GateOverrides(minBestScore, minAvgTop3Score, null, null, null);
    }

    public boolean isEmpty() {
        return minBestScore == null && minAvgTop3Score == null && maxRetryRounds == null
                && multiQueryEnabled == null && hydeEnabled == null;
    }
}
