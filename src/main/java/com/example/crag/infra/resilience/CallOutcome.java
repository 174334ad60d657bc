package com.example.crag.infra.resilience;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of a guarded call: {@link Success}, {@link Rejected} (breaker open, the call never ran)
 * or {@link Failed} (ran and failed after retries).
 */
public interface CallOutcome<T> {

    static <T> CallOutcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> CallOutcome<T> rejected(String breakerName, Duration remaining) {
        return new Rejected<>(breakerName, remaining);
    }

    static <T> CallOutcome<T> failed(Throwable error) {
        return new Failed<>(error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isRejected() {
        return this instanceof Rejected;
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }

    /** The value on success, otherwise {@code fallback}. */
    T valueOr(T fallback);

    record Success<T>(T value) implements CallOutcome<T> {
        @Override
        public T valueOr(T fallback) {
            return value;
        }
    }

    record Rejected<T>(String breakerName, Duration remaining) implements CallOutcome<T> {
        public Rejected {
            Objects.requireNonNull(breakerName, "breakerName");
            remaining = remaining == null ? Duration.ZERO : remaining;
        }

        @Override
        public T valueOr(T fallback) {
            return fallback;
        }

        public CircuitOpenException toException() {
            return new CircuitOpenException(breakerName, remaining);
        }
    }

    record Failed<T>(Throwable error) implements CallOutcome<T> {
        public Failed {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public T valueOr(T fallback) {
            return fallback;
        }
    }
}
