package com.example.crag.infra.resilience;

import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.RetryRegistry;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Non-blocking counterpart of {@link RetryExecutor}. {@link RetryOperator} waits with a
 * {@code Mono.delay}, so no worker thread is parked. Each subscription runs its own attempt chain.
 */
public class ReactiveRetryExecutor {

    private final RetryPolicy policy;
    private final RetryRegistry registry;

    public ReactiveRetryExecutor(RetryPolicy policy) {
        this(policy, () -> ThreadLocalRandom.current().nextDouble());
    }

    public ReactiveRetryExecutor(RetryPolicy policy, DoubleSupplier random) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.registry = RetryRegistry.of(policy.toRetryConfig(random));
        this.registry.getEventPublisher().onEntryAdded(added -> RetryExecutor.logEvents(added.getAddedEntry(), policy));
    }

    public RetryPolicy policy() {
        return policy;
    }

    public RetryRegistry registry() {
        return registry;
    }

    /**
     * @param operation invoked once per attempt; each call must return a fresh publisher
     */
    public <T> Mono<T> retry(String name, Supplier<Mono<T>> operation) {
        Objects.requireNonNull(operation, "operation");
        return Mono.defer(operation).transformDeferred(RetryOperator.of(registry.retry(name)));
    }
}
