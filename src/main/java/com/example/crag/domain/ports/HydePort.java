package com.example.crag.domain.ports;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Objects;
import java.util.function.Function;

/**
 * Rewrites a query from a generated hypothetical answer document (HyDE).
 */
@FunctionalInterface
public interface HydePort {

    Mono<String> rewrite(String query);

    static HydePort blocking(Function<String, String> fn) {
        Objects.requireNonNull(fn, "fn");
        return query -> Mono.fromCallable(() -> fn.apply(query))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
