package com.example.crag.infra.resilience;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Blocking retry on a resilience4j {@link Retry}, one instance per call name. Waits between
 * attempts, never after the last one, and rethrows the last error once the attempts are used up.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final RetryRegistry registry;

    public RetryExecutor(RetryPolicy policy) {
        this(policy, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryExecutor(RetryPolicy policy, DoubleSupplier random) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.registry = RetryRegistry.of(policy.toRetryConfig(random));
        this.registry.getEventPublisher().onEntryAdded(added -> logEvents(added.getAddedEntry(), policy));
    }

    public RetryPolicy policy() {
        return policy;
    }

    public RetryRegistry registry() {
        return registry;
    }

    public <T> T call(String name, Callable<T> operation) throws Exception {
        Objects.requireNonNull(operation, "operation");
        return Retry.decorateCallable(registry.retry(name), operation).call();
    }

    public <T> Callable<T> decorate(String name, Callable<T> operation) {
        Objects.requireNonNull(operation, "operation");
        return Retry.decorateCallable(registry.retry(name), operation);
    }

    static void logEvents(Retry retry, RetryPolicy policy) {
        retry.getEventPublisher()
                .onRetry(e -> log.warn("[Retry] attempt {}/{} failed name={} error={} retryIn={}ms",
                        e.getNumberOfRetryAttempts(), policy.maxAttempts(), e.getName(),
                        simpleName(e.getLastThrowable()), e.getWaitInterval().toMillis()))
                .onError(e -> log.warn("[Retry] exhausted name={} attempts={}",
                        e.getName(), e.getNumberOfRetryAttempts()))
                .onIgnoredError(e -> log.debug("[Retry] non-retryable error name={} error={}",
                        e.getName(), simpleName(e.getLastThrowable())));
    }

    private static String simpleName(Throwable t) {
        return t == null ? "none" : t.getClass().getSimpleName();
    }
}
