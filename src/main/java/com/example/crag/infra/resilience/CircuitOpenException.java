package com.example.crag.infra.resilience;

import java.time.Duration;

/**
 * Raised by the throwing convenience APIs when a named breaker rejects a call
 * without attempting it.
 */
public class CircuitOpenException extends RuntimeException {

    private final String breakerName;
    private final Duration remaining;

    public CircuitOpenException(String breakerName, Duration remaining) {
        super("Circuit breaker is OPEN: name=" + breakerName + ", remaining=" + remaining);
        this.breakerName = breakerName;
        this.remaining = remaining;
    }

    public String breakerName() {
        return breakerName;
    }

    public Duration remaining() {
        return remaining;
    }
}
