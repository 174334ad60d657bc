package com.example.crag.infra.resilience;

import com.example.crag.config.CragConfigException;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Immutable breaker tuning.
 *
 * @param failureThreshold consecutive failures that trip CLOSED → OPEN
 * @param recoveryTimeout  time since the last failure before a probe is let through
 * @param halfOpenMaxCalls probe budget while HALF_OPEN, and the successes needed to close
 * @param excluded         errors that never count as failures
 */
public record CircuitBreakerConfig(int failureThreshold,
                                   Duration recoveryTimeout,
                                   int halfOpenMaxCalls,
                                   Predicate<Throwable> excluded) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_HALF_OPEN_MAX_CALLS = 3;

    public CircuitBreakerConfig {
        Objects.requireNonNull(recoveryTimeout, "recoveryTimeout");
        CragConfigException.require(failureThreshold >= 1,
                "failureThreshold must be >= 1 but was " + failureThreshold);
        CragConfigException.require(!recoveryTimeout.isNegative(),
                "recoveryTimeout must not be negative but was " + recoveryTimeout);
        CragConfigException.require(halfOpenMaxCalls >= 1,
                "halfOpenMaxCalls must be >= 1 but was " + halfOpenMaxCalls);
        excluded = excluded == null ? t -> false : excluded;
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT,
                DEFAULT_HALF_OPEN_MAX_CALLS, null);
    }

    public CircuitBreakerConfig withExcluded(Predicate<Throwable> excluded) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, halfOpenMaxCalls, excluded);
    }

    public boolean isExcluded(Throwable error) {
        return error != null && excluded.test(error);
    }
}
