package com.example.crag.infra.resilience;

import com.example.crag.config.CragConfigException;
import io.github.resilience4j.retry.RetryConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;

/**
 * Immutable retry settings shared by the blocking and reactive executors.
 *
 * <p>{@code delay(attempt) = min(baseDelay * exponentialBase^attempt, maxDelay)}, with {@code attempt}
 * counted from 0. With jitter on, up to 25% is added on top.</p>
 */
public record RetryPolicy(int maxAttempts,
                          Duration baseDelay,
                          Duration maxDelay,
                          double exponentialBase,
                          boolean jitter,
                          Predicate<Throwable> retryable) {

    public static final double MAX_JITTER_FRACTION = 0.25;

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        CragConfigException.require(maxAttempts >= 1, "maxAttempts must be >= 1 but was " + maxAttempts);
        CragConfigException.require(!baseDelay.isNegative(), "baseDelay must not be negative");
        CragConfigException.require(!maxDelay.isNegative(), "maxDelay must not be negative");
        CragConfigException.require(Double.isFinite(exponentialBase) && exponentialBase >= 1.0,
                "exponentialBase must be >= 1 but was " + exponentialBase);
        retryable = retryable == null ? RetryPolicy::defaultRetryable : retryable;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, true, null);
    }

    /** Single attempt, no waiting. */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0, false, null);
    }

    public RetryPolicy withRetryable(Predicate<Throwable> retryable) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, exponentialBase, jitter, retryable);
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, exponentialBase, jitter, retryable);
    }

    public boolean isRetryable(Throwable error) {
        return error != null && retryable.test(error);
    }

    /** Delay before retry number {@code attempt + 1}, without jitter. Never exceeds {@code maxDelay}. */
    public Duration baseDelayFor(int attempt) {
        double raw = baseDelay.toMillis() * Math.pow(exponentialBase, Math.max(0, attempt));
        double capped = Math.min(raw, (double) maxDelay.toMillis());
        if (!Double.isFinite(capped)) {
            capped = maxDelay.toMillis();
        }
        return Duration.ofMillis(Math.round(capped));
    }

    public Duration delayFor(int attempt) {
        return delayFor(attempt, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of values in [0,1); scaled to the jitter fraction
     */
    public Duration delayFor(int attempt, DoubleSupplier random) {
        Duration base = baseDelayFor(attempt);
        if (!jitter || base.isZero()) {
            return base;
        }
        double extra = base.toMillis() * MAX_JITTER_FRACTION * random.getAsDouble();
        return base.plusMillis(Math.round(extra));
    }

    /**
     * resilience4j view of these settings. The interval function receives the 1-based
     * attempt number that just failed.
     */
    public RetryConfig toRetryConfig(DoubleSupplier random) {
        Objects.requireNonNull(random, "random");
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .retryOnException(this::isRetryable)
                // at least 1ms between attempts
                .intervalFunction(attempt -> Math.max(1L, delayFor(attempt - 1, random).toMillis()))
                .build();
    }

    /** Everything but interrupts, caller-side argument errors and open circuits is retried. */
    static boolean defaultRetryable(Throwable error) {
        if (error instanceof InterruptedException || error instanceof CircuitOpenException) {
            return false;
        }
        return !(error instanceof IllegalArgumentException);
    }
}
