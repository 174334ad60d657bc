package com.example.crag.infra.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * One named breaker guarding one upstream dependency.
 *
 * <ul>
 *   <li>CLOSED: every call is allowed; {@code failureThreshold} consecutive failures trip it OPEN.</li>
 *   <li>OPEN: calls are rejected until {@code recoveryTimeout} has passed since the last failure.
 *       The first {@link #allowRequest()} after that moves to HALF_OPEN and is itself a probe.</li>
 *   <li>HALF_OPEN: at most {@code halfOpenMaxCalls} probes; that many consecutive successes close
 *       the breaker, any failure reopens it.</li>
 * </ul>
 *
 * <p>All state reads and transitions happen under a single lock per breaker.</p>
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final Object lock = new Object();

    // guarded by lock
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private int halfOpenCalls;
    private Instant lastFailureTime;
    private Instant lastSuccessTime;
    private Instant lastStateChange;
    private long totalCalls;
    private long totalFailures;
    private long totalSuccesses;
    private long totalRejected;

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = config == null ? CircuitBreakerConfig.defaults() : config;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.lastStateChange = this.clock.instant();
    }

    public String name() {
        return name;
    }

    public CircuitBreakerConfig config() {
        return config;
    }

    public CircuitState state() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Decides whether a call may proceed. A rejection increments the rejected
     * counter and leaves the failure/success counters untouched.
     */
    public boolean allowRequest() {
        synchronized (lock) {
            switch (state) {
                case CLOSED:
                    return true;
                case OPEN:
                    if (recoveryElapsed()) {
                        transitionTo(CircuitState.HALF_OPEN);
                        halfOpenCalls = 1;
                        return true;
                    }
                    totalRejected++;
                    log.debug("[CircuitBreaker] rejected name={} remaining={}", name, remainingOpenLocked());
                    return false;
                case HALF_OPEN:
                    if (halfOpenCalls < config.halfOpenMaxCalls()) {
                        halfOpenCalls++;
                        return true;
                    }
                    totalRejected++;
                    log.debug("[CircuitBreaker] half-open probe budget exhausted name={}", name);
                    return false;
                default:
                    throw new IllegalStateException("Unknown state " + state);
            }
        }
    }

    public void recordSuccess() {
        synchronized (lock) {
            totalCalls++;
            totalSuccesses++;
            successCount++;
            lastSuccessTime = clock.instant();
            if (state == CircuitState.HALF_OPEN) {
                if (successCount >= config.halfOpenMaxCalls()) {
                    transitionTo(CircuitState.CLOSED);
                }
            } else if (state == CircuitState.CLOSED) {
                failureCount = 0;
            }
        }
    }

    public void recordFailure(Throwable error) {
        synchronized (lock) {
            if (config.isExcluded(error)) {
                // an excluded outcome does not use up a half-open probe slot
                if (state == CircuitState.HALF_OPEN && halfOpenCalls > 0) {
                    halfOpenCalls--;
                }
                log.debug("[CircuitBreaker] excluded error ignored name={} error={}",
                        name, error.getClass().getSimpleName());
                return;
            }
            totalCalls++;
            totalFailures++;
            failureCount++;
            successCount = 0;
            lastFailureTime = clock.instant();
            if (state == CircuitState.HALF_OPEN) {
                transitionTo(CircuitState.OPEN);
            } else if (state == CircuitState.CLOSED && failureCount >= config.failureThreshold()) {
                transitionTo(CircuitState.OPEN);
            }
        }
    }

    /** Time left before the next probe is admitted; zero unless OPEN. */
    public Duration remainingOpen() {
        synchronized (lock) {
            return remainingOpenLocked();
        }
    }

    public void reset() {
        synchronized (lock) {
            state = CircuitState.CLOSED;
            failureCount = 0;
            successCount = 0;
            halfOpenCalls = 0;
            lastFailureTime = null;
            lastSuccessTime = null;
            lastStateChange = clock.instant();
            totalCalls = 0;
            totalFailures = 0;
            totalSuccesses = 0;
            totalRejected = 0;
        }
        log.info("[CircuitBreaker] reset name={}", name);
    }

    public CircuitBreakerStats stats() {
        synchronized (lock) {
            return new CircuitBreakerStats(name, state, failureCount, successCount,
                    lastFailureTime, lastSuccessTime, lastStateChange,
                    totalCalls, totalFailures, totalSuccesses, totalRejected);
        }
    }

    /**
     * Wraps a call so it is admitted by this breaker and its outcome recorded.
     * A rejected call throws {@link CircuitOpenException} without running.
     */
    public <T> Callable<T> decorate(Callable<T> call) {
        Objects.requireNonNull(call, "call");
        return () -> {
            if (!allowRequest()) {
                throw new CircuitOpenException(name, remainingOpen());
            }
            try {
                T value = call.call();
                recordSuccess();
                return value;
            } catch (Exception e) {
                recordFailure(e);
                throw e;
            }
        };
    }

    private boolean recoveryElapsed() {
        if (lastFailureTime == null) {
            return true;
        }
        Duration since = Duration.between(lastFailureTime, clock.instant());
        return since.compareTo(config.recoveryTimeout()) >= 0;
    }

    private Duration remainingOpenLocked() {
        if (state != CircuitState.OPEN || lastFailureTime == null) {
            return Duration.ZERO;
        }
        Duration left = config.recoveryTimeout().minus(Duration.between(lastFailureTime, clock.instant()));
        return left.isNegative() ? Duration.ZERO : left;
    }

    private void transitionTo(CircuitState next) {
        CircuitState prev = state;
        state = next;
        lastStateChange = clock.instant();
        switch (next) {
            case CLOSED:
                failureCount = 0;
                successCount = 0;
                halfOpenCalls = 0;
                log.info("[CircuitBreaker] {} -> CLOSED name={}", prev, name);
                break;
            case OPEN:
                halfOpenCalls = 0;
                successCount = 0;
                log.warn("[CircuitBreaker] {} -> OPEN name={} failures={} recoveryTimeout={}",
                        prev, name, failureCount, config.recoveryTimeout());
                break;
            case HALF_OPEN:
                successCount = 0;
                halfOpenCalls = 0;
                log.info("[CircuitBreaker] {} -> HALF_OPEN name={}", prev, name);
                break;
            default:
                break;
        }
    }
}
