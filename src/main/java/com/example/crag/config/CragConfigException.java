package com.example.crag.config;

/**
 * Raised when a gate, retry or breaker setting is malformed.
 * Thrown at construction time so a bad value never reaches an evaluation.
 */
public class CragConfigException extends IllegalArgumentException {

    public CragConfigException(String message) {
        super(message);
    }

    public static void require(boolean condition, String message) {
        if (!condition) {
            throw new CragConfigException(message);
        }
    }

    public static void requireUnit(String name, double value) {
        require(Double.isFinite(value) && value >= 0.0 && value <= 1.0,
                name + " must be a finite value in [0,1] but was " + value);
    }

    public static void requireNonNegative(String name, double value) {
        require(Double.isFinite(value) && value >= 0.0,
                name + " must be finite and >= 0 but was " + value);
    }
}
