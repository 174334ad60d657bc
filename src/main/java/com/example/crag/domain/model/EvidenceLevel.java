package com.example.crag.domain.model;

import java.util.Locale;

/**
 * Evidence quality bucket, ordered by decreasing confidence.
 */
public enum EvidenceLevel {
    STRONG(1.0),
    MODERATE(0.7),
    LOW(0.4),
    INSUFFICIENT(0.1);

    private final double confidence;

    EvidenceLevel(double confidence) {
        this.confidence = confidence;
    }

    public double confidence() {
        return confidence;
    }

    public boolean requiresCorrection() {
        return this == LOW || this == INSUFFICIENT;
    }

    public boolean isAcceptable() {
        return this == STRONG || this == MODERATE;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
