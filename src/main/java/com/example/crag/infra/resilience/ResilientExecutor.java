package com.example.crag.infra.resilience;

import com.example.crag.telemetry.CragMetrics;
import io.github.resilience4j.reactor.timelimiter.TimeLimiterOperator;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Breaker check, then the retry loop, then the breaker bookkeeping.
 *
 * <p>The outcome-returning methods never throw for upstream failures; the
 * {@code execute*} methods either fall back or rethrow.</p>
 */
public class ResilientExecutor {

    private static final Logger log = LoggerFactory.getLogger(ResilientExecutor.class);

    private final CircuitBreakerRegistry breakers;
    private final RetryExecutor retry;
    private final ReactiveRetryExecutor reactiveRetry;
    private final TimeLimiter timeLimiter; // null: no per-attempt timeout
    private final CragMetrics metrics;

    public ResilientExecutor(CircuitBreakerRegistry breakers, RetryPolicy policy) {
        this(breakers, new RetryExecutor(policy), new ReactiveRetryExecutor(policy), null, CragMetrics.noop());
    }

    public ResilientExecutor(CircuitBreakerRegistry breakers,
                             RetryPolicy policy,
                             Duration callTimeout,
                             CragMetrics metrics) {
        this(breakers, new RetryExecutor(policy), new ReactiveRetryExecutor(policy), callTimeout, metrics);
    }

    public ResilientExecutor(CircuitBreakerRegistry breakers,
                             RetryExecutor retry,
                             ReactiveRetryExecutor reactiveRetry,
                             Duration callTimeout,
                             CragMetrics metrics) {
        this.breakers = Objects.requireNonNull(breakers, "breakers");
        this.retry = Objects.requireNonNull(retry, "retry");
        this.reactiveRetry = Objects.requireNonNull(reactiveRetry, "reactiveRetry");
        this.metrics = metrics == null ? CragMetrics.noop() : metrics;
        this.timeLimiter = (callTimeout == null || callTimeout.isZero() || callTimeout.isNegative())
                ? null
                : TimeLimiter.of(TimeLimiterConfig.custom().timeoutDuration(callTimeout).build());
    }

    public CircuitBreakerRegistry breakers() {
        return breakers;
    }

    // ---------------------------------------------------------------- blocking

    public <T> CallOutcome<T> call(String breakerName, Callable<T> operation) {
        CircuitBreaker breaker = breakers.breaker(breakerName);
        if (!breaker.allowRequest()) {
            metrics.breakerRejected(breakerName);
            return CallOutcome.rejected(breakerName, breaker.remainingOpen());
        }
        try {
            T value = retry.call(breakerName, operation);
            breaker.recordSuccess();
            return CallOutcome.success(value);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return failure(breaker, ie);
        } catch (Exception e) {
            return failure(breaker, e);
        }
    }

    /** Rethrows the upstream error, or {@link CircuitOpenException} when rejected. */
    public <T> T execute(String breakerName, Callable<T> operation) throws Exception {
        return unwrap(call(breakerName, operation));
    }

    /** Returns {@code fallback} instead of raising when rejected or failed. */
    public <T> T execute(String breakerName, Callable<T> operation, T fallback) {
        return call(breakerName, operation).valueOr(fallback);
    }

    public <T> Callable<T> decorate(String breakerName, Callable<T> operation) {
        return () -> execute(breakerName, operation);
    }

    // ---------------------------------------------------------------- reactive

    /**
     * Non-blocking variant. The breaker is consulted at subscription time; each retry
     * attempt is bounded by the call timeout when one is configured.
     */
    public <T> Mono<CallOutcome<T>> callAsync(String breakerName, Supplier<Mono<T>> operation) {
        Objects.requireNonNull(operation, "operation");
        return Mono.defer(() -> {
            CircuitBreaker breaker = breakers.breaker(breakerName);
            if (!breaker.allowRequest()) {
                metrics.breakerRejected(breakerName);
                return Mono.just(CallOutcome.<T>rejected(breakerName, breaker.remainingOpen()));
            }
            return reactiveRetry.retry(breakerName, limited(operation))
                    .map(value -> {
                        breaker.recordSuccess();
                        return CallOutcome.success(value);
                    })
                    .switchIfEmpty(Mono.fromSupplier(() -> {
                        breaker.recordSuccess();
                        return CallOutcome.<T>success(null);
                    }))
                    .onErrorResume(error -> Mono.just(failure(breaker, error)));
        });
    }

    public <T> Mono<T> executeAsync(String breakerName, Supplier<Mono<T>> operation) {
        return callAsync(breakerName, operation).flatMap(outcome -> {
            if (outcome instanceof CallOutcome.Rejected<T> rejected) {
                return Mono.error(rejected.toException());
            }
            if (outcome instanceof CallOutcome.Failed<T> failed) {
                return Mono.error(failed.error());
            }
            return Mono.justOrEmpty(((CallOutcome.Success<T>) outcome).value());
        });
    }

    public <T> Mono<T> executeAsync(String breakerName, Supplier<Mono<T>> operation, T fallback) {
        return callAsync(breakerName, operation).map(outcome -> outcome.valueOr(fallback));
    }

    private <T> Supplier<Mono<T>> limited(Supplier<Mono<T>> operation) {
        if (timeLimiter == null) {
            return operation;
        }
        return () -> operation.get().transformDeferred(TimeLimiterOperator.of(timeLimiter));
    }

    private <T> CallOutcome<T> failure(CircuitBreaker breaker, Throwable error) {
        breaker.recordFailure(error);
        FailureKind kind = FailureKind.classify(error);
        metrics.upstreamFailure(breaker.name(), kind);
        log.warn("[Retry] call failed name={} kind={} error={}", breaker.name(), kind, error.toString());
        return CallOutcome.failed(error);
    }

    private static <T> T unwrap(CallOutcome<T> outcome) throws Exception {
        if (outcome instanceof CallOutcome.Success<T> success) {
            return success.value();
        }
        if (outcome instanceof CallOutcome.Rejected<T> rejected) {
            throw rejected.toException();
        }
        Throwable error = ((CallOutcome.Failed<T>) outcome).error();
        if (error instanceof Exception e) {
            throw e;
        }
        if (error instanceof Error err) {
            throw err;
        }
        throw new IllegalStateException(error);
    }
}
