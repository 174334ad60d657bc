package com.example.crag.infra.resilience;

import java.util.Locale;

/** Circuit breaker mode: CLOSED → OPEN → HALF_OPEN → CLOSED. */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
