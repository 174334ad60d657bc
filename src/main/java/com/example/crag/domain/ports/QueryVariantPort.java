package com.example.crag.domain.ports;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/** Produces reformulations of a query for multi-query fan-out. */
@FunctionalInterface
public interface QueryVariantPort {

    Mono<List<String>> variants(String query);

    static QueryVariantPort blocking(Function<String, List<String>> fn) {
        Objects.requireNonNull(fn, "fn");
        return query -> Mono.fromCallable(() -> fn.apply(query))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
