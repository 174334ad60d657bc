package com.example.crag.service.rag.orchestrator;

import com.example.crag.config.GateConfig;
import com.example.crag.domain.model.AuditTrail;
import com.example.crag.domain.model.CorrectionOutcome;
import com.example.crag.domain.model.GateEvaluation;
import com.example.crag.domain.model.RetrievalResult;
import com.example.crag.domain.model.RetryParameters;
import com.example.crag.domain.model.SearchRequest;
import com.example.crag.domain.ports.HydePort;
import com.example.crag.domain.ports.QueryVariantPort;
import com.example.crag.domain.ports.RetrievalCallbacks;
import com.example.crag.domain.ports.SearchPort;
import com.example.crag.infra.resilience.CallOutcome;
import com.example.crag.infra.resilience.ResilientExecutor;
import com.example.crag.service.rag.fusion.ReciprocalRankFuser;
import com.example.crag.telemetry.AuditTrailLogger;
import com.example.crag.telemetry.CragMetrics;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The corrective retrieval loop.
 *
 * <p>Rounds run one after another; each round's strategy depends on the previous evaluation.
 * The only parallel step is the multi-query fan-out. Every upstream call goes through the
 * {@link ResilientExecutor} under its own breaker name. A failed strategy is recorded on the
 * audit trail and the loop moves on; the caller only sees an error when a retry is needed and
 * no {@link SearchPort} was supplied.</p>
 */
@Slf4j
public class CorrectiveRetrievalService {

    public static final String SEARCH_BREAKER = "search";
    public static final String MULTI_QUERY_BREAKER = "multi-query-generator";
    public static final String HYDE_BREAKER = "hyde-generator";

    private static final int LOG_QUERY_CHARS = 80;

    private final CorrectiveRetrievalOrchestrator orchestrator;
    private final ResilientExecutor resilience;
    private final ReciprocalRankFuser fuser;
    private final AuditTrailLogger auditLogger;
    private final CragMetrics metrics;
    private final Duration timeBudget;
    private final boolean searchFallbackEmpty;

    public CorrectiveRetrievalService(CorrectiveRetrievalOrchestrator orchestrator,
                                      ResilientExecutor resilience,
                                      ReciprocalRankFuser fuser) {
        this(orchestrator, resilience, fuser, AuditTrailLogger.defaults(), CragMetrics.noop(),
                Duration.ZERO, false);
    }

    public CorrectiveRetrievalService(CorrectiveRetrievalOrchestrator orchestrator,
                                      ResilientExecutor resilience,
                                      ReciprocalRankFuser fuser,
                                      AuditTrailLogger auditLogger,
                                      CragMetrics metrics,
                                      Duration timeBudget,
                                      boolean searchFallbackEmpty) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.resilience = Objects.requireNonNull(resilience, "resilience");
        this.fuser = Objects.requireNonNull(fuser, "fuser");
        this.auditLogger = auditLogger == null ? AuditTrailLogger.defaults() : auditLogger;
        this.metrics = metrics == null ? CragMetrics.noop() : metrics;
        this.timeBudget = timeBudget == null ? Duration.ZERO : timeBudget;
        this.searchFallbackEmpty = searchFallbackEmpty;
    }

    /** Blocking entry point. */
    public CorrectionOutcome searchWithCorrection(String query,
                                                  List<RetrievalResult> initialResults,
                                                  int baseTopK,
                                                  RetrievalCallbacks callbacks) {
        return searchWithCorrection(query, initialResults, baseTopK, callbacks, Map.of());
    }

    public CorrectionOutcome searchWithCorrection(String query,
                                                  List<RetrievalResult> initialResults,
                                                  int baseTopK,
                                                  RetrievalCallbacks callbacks,
                                                  Map<String, Object> searchExtras) {
        return correct(query, initialResults, baseTopK, callbacks, searchExtras).block();
    }

    public Mono<CorrectionOutcome> correct(String query,
                                           List<RetrievalResult> initialResults,
                                           int baseTopK,
                                           RetrievalCallbacks callbacks) {
        return correct(query, initialResults, baseTopK, callbacks, Map.of());
    }

    /**
     * Non-blocking entry point. Emits exactly one outcome, or {@link MissingCapabilityException}
     * when a retry is needed and {@code callbacks} has no search port.
     */
    public Mono<CorrectionOutcome> correct(String query,
                                           List<RetrievalResult> initialResults,
                                           int baseTopK,
                                           RetrievalCallbacks callbacks,
                                           Map<String, Object> searchExtras) {
        return Mono.defer(() -> {
            RetrievalCallbacks cb = callbacks == null ? RetrievalCallbacks.none() : callbacks;
            GateConfig effective = orchestrator.config()
                    .withCapabilities(cb.hasQueryVariants(), cb.hasHyde());
            Session s = new Session(query == null ? "" : query, nonNull(initialResults), baseTopK,
                    cb, searchExtras, orchestrator.withConfig(effective));

            if (!cb.hasSearch() && s.orchestrator.shouldRetry(s.currentEvaluation, 0)) {
                return Mono.error(new MissingCapabilityException(
                        "Correction required but no search backend is configured (level="
                                + s.currentEvaluation.evidenceLevel().wireValue() + ")"));
            }
            return runRounds(s).then(Mono.fromCallable(() -> finish(s)));
        });
    }

    private Mono<Void> runRounds(Session s) {
        return Mono.defer(() -> {
            if (!s.orchestrator.shouldRetry(s.currentEvaluation, s.round)) {
                return Mono.empty();
            }
            if (s.budgetExceeded()) {
                log.warn("[CRAG] time budget {} exhausted before round {} query={}",
                        timeBudget, s.round, clip(s.query));
                return Mono.empty();
            }
            RetryParameters params = s.orchestrator.getRetryParameters(s.currentEvaluation, s.baseTopK,
                    s.usedMultiQuery, s.usedHyde, s.round);
            if (params == null) {
                return Mono.empty();
            }
            long started = System.nanoTime();
            return executeStrategy(s, params)
                    .map(StrategyResult::ok)
                    .defaultIfEmpty(StrategyResult.ok(List.of()))
                    .onErrorResume(error -> {
                        log.warn("[CRAG] strategy failed strategy={} round={} error={}",
                                params.strategyName(), s.round, describe(error));
                        return Mono.just(StrategyResult.failed(describe(error)));
                    })
                    .doOnNext(result -> s.apply(params, result, elapsedMs(started)))
                    .then(runRounds(s));
        });
    }

    private Mono<List<RetrievalResult>> executeStrategy(Session s, RetryParameters params) {
        return Mono.defer(() -> {
            SearchPort search = s.callbacks.search()
                    .orElseThrow(() -> new MissingCapabilityException("No search backend configured"));
            SearchRequest request = SearchRequest.of(s.query, params, s.extras);

            if (params.useMultiQuery() && s.callbacks.hasQueryVariants()) {
                s.usedMultiQuery = true;
                return multiQuery(s, search, s.callbacks.queryVariants().get(), request, params);
            }
            if (params.useHyde() && s.callbacks.hasHyde()) {
                s.usedHyde = true;
                return hyde(s, search, s.callbacks.hyde().get(), request, params);
            }
            return searchOnce(search, request, params.strategyName());
        });
    }

    private Mono<List<RetrievalResult>> searchOnce(SearchPort search, SearchRequest request, String strategy) {
        return resilience.callAsync(SEARCH_BREAKER, () -> search.search(request))
                .flatMap(outcome -> {
                    if (outcome instanceof CallOutcome.Success<List<RetrievalResult>> ok) {
                        return Mono.just(nonNull(ok.value()));
                    }
                    if (outcome instanceof CallOutcome.Rejected<List<RetrievalResult>> rejected) {
                        if (searchFallbackEmpty) {
                            log.debug("[CRAG] search breaker open, using empty fallback strategy={}", strategy);
                            return Mono.just(List.<RetrievalResult>of());
                        }
                        return Mono.error(new StrategyExecutionException(strategy,
                                "circuit '" + rejected.breakerName() + "' is open", rejected.toException()));
                    }
                    return Mono.error(((CallOutcome.Failed<List<RetrievalResult>>) outcome).error());
                });
    }

    private Mono<List<RetrievalResult>> multiQuery(Session s, SearchPort search, QueryVariantPort variantsPort,
                                                   SearchRequest request, RetryParameters params) {
        String strategy = params.strategyName();
        return resilience.executeAsync(MULTI_QUERY_BREAKER, () -> variantsPort.variants(s.query))
                .defaultIfEmpty(List.of())
                .flatMap(raw -> {
                    List<String> variants = normalizeVariants(raw, params.multiQueryCount());
                    if (variants.isEmpty()) {
                        return Mono.error(new StrategyExecutionException(strategy, "no query variants generated"));
                    }
                    log.debug("[CRAG] multi-query fan-out strategy={} variants={}", strategy, variants.size());
                    return Flux.fromIterable(variants)
                            .flatMapSequential(variant -> searchOnce(search, request.withQuery(variant), strategy)
                                    .map(VariantResult::ok)
                                    .onErrorResume(error -> {
                                        log.warn("[CRAG] variant search failed strategy={} variant={} error={}",
                                                strategy, clip(variant), describe(error));
                                        return Mono.just(VariantResult.failed(error));
                                    }))
                            .collectList()
                            .flatMap(outcomes -> fuseVariants(strategy, outcomes, params.topK()));
                });
    }

    private Mono<List<RetrievalResult>> fuseVariants(String strategy, List<VariantResult> outcomes, int topK) {
        List<List<RetrievalResult>> lists = new ArrayList<>(outcomes.size());
        Throwable lastError = null;
        int failures = 0;
        for (VariantResult outcome : outcomes) {
            if (outcome.error != null) {
                failures++;
                lastError = outcome.error;
                lists.add(List.of());
            } else {
                lists.add(outcome.results);
            }
        }
        if (failures == outcomes.size()) {
            return Mono.error(new StrategyExecutionException(strategy,
                    "all " + failures + " variant searches failed", lastError));
        }
        // RRF decides the order; the gate still compares native scores
        return Mono.just(ReciprocalRankFuser.withNativeScores(fuser.mergeResultsRRF(lists, topK)));
    }

    private Mono<List<RetrievalResult>> hyde(Session s, SearchPort search, HydePort hydePort,
                                             SearchRequest request, RetryParameters params) {
        String strategy = params.strategyName();
        return resilience.executeAsync(HYDE_BREAKER, () -> hydePort.rewrite(s.query))
                .defaultIfEmpty("")
                .flatMap(rewritten -> {
                    if (rewritten.isBlank()) {
                        return Mono.error(new StrategyExecutionException(strategy, "empty hypothetical document"));
                    }
                    return searchOnce(search, request.withQuery(rewritten), strategy);
                });
    }

    private CorrectionOutcome finish(Session s) {
        long totalMs = elapsedMs(s.startedNanos);
        GateEvaluation finalEvaluation = s.orchestrator.evaluateResults(s.currentResults);
        s.trail.finalizeTrail(finalEvaluation, totalMs, s.currentResults.size());
        auditLogger.log(s.trail);
        metrics.correctionCompleted(totalMs, s.trail.correctionSuccessful());
        return new CorrectionOutcome(s.currentResults, s.trail);
    }

    static List<String> normalizeVariants(List<String> raw, int limit) {
        if (raw == null || raw.isEmpty() || limit <= 0) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        List<String> out = new ArrayList<>();
        for (String v : raw) {
            if (v == null || v.isBlank()) {
                continue;
            }
            String trimmed = v.trim();
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                out.add(trimmed);
                if (out.size() >= limit) {
                    break;
                }
            }
        }
        return out;
    }

    private static List<RetrievalResult> nonNull(List<RetrievalResult> results) {
        if (results == null || results.isEmpty()) {
            return List.of();
        }
        List<RetrievalResult> out = new ArrayList<>(results.size());
        for (RetrievalResult r : results) {
            if (r != null) {
                out.add(r);
            }
        }
        return out;
    }

    private static long elapsedMs(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }

    private static String describe(Throwable error) {
        String msg = error.getMessage();
        String name = error.getClass().getSimpleName();
        return (msg == null || msg.isBlank()) ? name : name + ": " + msg;
    }

    private static String clip(String s) {
        return AuditTrail.clip(s, LOG_QUERY_CHARS);
    }

    /** Mutable state of one correction request. Never shared between requests. */
    private final class Session {
        final String query;
        final int baseTopK;
        final RetrievalCallbacks callbacks;
        final Map<String, Object> extras;
        final CorrectiveRetrievalOrchestrator orchestrator;
        final AuditTrail trail;
        final long startedNanos = System.nanoTime();

        List<RetrievalResult> currentResults;
        GateEvaluation currentEvaluation;
        boolean usedMultiQuery;
        boolean usedHyde;
        int round;

        Session(String query, List<RetrievalResult> initialResults, int baseTopK, RetrievalCallbacks callbacks,
                Map<String, Object> extras, CorrectiveRetrievalOrchestrator orchestrator) {
            this.query = query;
            this.baseTopK = baseTopK;
            this.callbacks = callbacks;
            this.extras = extras == null ? Map.of() : extras;
            this.orchestrator = orchestrator;
            this.trail = orchestrator.createAuditTrail(query, initialResults);
            this.currentResults = initialResults;
            this.currentEvaluation = trail.initialEvaluation();
        }

        boolean budgetExceeded() {
            return !timeBudget.isZero() && !timeBudget.isNegative()
                    && System.nanoTime() - startedNanos >= timeBudget.toNanos();
        }

        void apply(RetryParameters params, StrategyResult result, long durationMs) {
            GateEvaluation evaluation = orchestrator.recordAction(trail, params.strategyName(),
                    result.results, durationMs, params, result.error);
            if (result.error == null) {
                // a failed attempt leaves the evidence picture unchanged
                currentEvaluation = evaluation;
                if (!result.results.isEmpty()
                        && evaluation.bestScore() > trail.initialEvaluation().bestScore()) {
                    currentResults = result.results;
                }
            }
            round++;
        }
    }

    private static final class StrategyResult {
        final List<RetrievalResult> results;
        final String error;

        private StrategyResult(List<RetrievalResult> results, String error) {
            this.results = results;
            this.error = error;
        }

        static StrategyResult ok(List<RetrievalResult> results) {
            return new StrategyResult(nonNull(results), null);
        }

        static StrategyResult failed(String error) {
            return new StrategyResult(List.of(), error);
        }
    }

    private static final class VariantResult {
        final List<RetrievalResult> results;
        final Throwable error;

        private VariantResult(List<RetrievalResult> results, Throwable error) {
            this.results = results;
            this.error = error;
        }

        static VariantResult ok(List<RetrievalResult> results) {
            return new VariantResult(results, null);
        }

        static VariantResult failed(Throwable error) {
            return new VariantResult(List.of(), error);
        }
    }
}
