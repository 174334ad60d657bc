package com.example.crag.probe;

import com.example.crag.infra.resilience.CircuitBreakerRegistry;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;

/** DOWN while any named breaker is OPEN; per-breaker stats as details. */
public class CircuitBreakerHealthIndicator extends AbstractHealthIndicator {

    private final CircuitBreakerRegistry registry;

    public CircuitBreakerHealthIndicator(CircuitBreakerRegistry registry) {
        super("Circuit breaker health check failed");
        this.registry = registry;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) {
        if (registry.anyOpen()) {
            builder.down();
        } else {
            builder.up();
        }
        registry.snapshotAsMap().forEach(builder::withDetail);
    }
}
