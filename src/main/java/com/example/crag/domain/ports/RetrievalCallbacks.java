package com.example.crag.domain.ports;

import java.util.Optional;

/**
 * The collaborators available to one correction request. Any slot may be empty;
 * strategies whose collaborator is missing are not selected.
 */
public final class RetrievalCallbacks {

    private static final RetrievalCallbacks NONE = new RetrievalCallbacks(null, null, null);

    private final SearchPort search;
    private final QueryVariantPort queryVariants;
    private final HydePort hyde;

    private RetrievalCallbacks(SearchPort search, QueryVariantPort queryVariants, HydePort hyde) {
        this.search = search;
        this.queryVariants = queryVariants;
        this.hyde = hyde;
    }

    public static RetrievalCallbacks none() {
        return NONE;
    }

    public static RetrievalCallbacks of(SearchPort search) {
        return new RetrievalCallbacks(search, null, null);
    }

    public static RetrievalCallbacks of(SearchPort search, QueryVariantPort queryVariants, HydePort hyde) {
        return new RetrievalCallbacks(search, queryVariants, hyde);
    }

    public RetrievalCallbacks withQueryVariants(QueryVariantPort port) {
        return new RetrievalCallbacks(search, port, hyde);
    }

    public RetrievalCallbacks withHyde(HydePort port) {
        return new RetrievalCallbacks(search, queryVariants, port);
    }

    public Optional<SearchPort> search() {
        return Optional.ofNullable(search);
    }

    public Optional<QueryVariantPort> queryVariants() {
        return Optional.ofNullable(queryVariants);
    }

    public Optional<HydePort> hyde() {
        return Optional.ofNullable(hyde);
    }

    public boolean hasSearch() {
        return search != null;
    }

    public boolean hasQueryVariants() {
        return queryVariants != null;
    }

    public boolean hasHyde() {
        return hyde != null;
    }
}
