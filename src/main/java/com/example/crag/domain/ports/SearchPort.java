package com.example.crag.domain.ports;

import com.example.crag.domain.model.RetrievalResult;
import com.example.crag.domain.model.SearchRequest;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Search backend. Implementations may be natively asynchronous; blocking ones are
 * adapted with {@link #blocking(Function)}.
 */
@FunctionalInterface
public interface SearchPort {

    /** Results in ranked order; an empty list when nothing matched. */
    Mono<List<RetrievalResult>> search(SearchRequest request);

    /** Runs a blocking search function on the bounded elastic scheduler. */
    static SearchPort blocking(Function<SearchRequest, List<RetrievalResult>> fn) {
        Objects.requireNonNull(fn, "fn");
        return request -> Mono.fromCallable(() -> fn.apply(request))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
