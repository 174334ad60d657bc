package com.example.crag.service.rag.orchestrator;

import com.example.crag.config.GateConfig;
import com.example.crag.domain.model.AuditTrail;
import com.example.crag.domain.model.CorrectionOutcome;
import com.example.crag.domain.model.CorrectiveAction;
import com.example.crag.domain.model.RetrievalResult;
import com.example.crag.domain.model.SearchRequest;
import com.example.crag.domain.ports.HydePort;
import com.example.crag.domain.ports.QueryVariantPort;
import com.example.crag.domain.ports.RetrievalCallbacks;
import com.example.crag.domain.ports.SearchPort;
import com.example.crag.infra.resilience.CircuitBreaker;
import com.example.crag.infra.resilience.CircuitBreakerRegistry;
import com.example.crag.infra.resilience.ResilientExecutor;
import com.example.crag.infra.resilience.RetryPolicy;
import com.example.crag.service.rag.fusion.ReciprocalRankFuser;
import com.example.crag.service.rag.strategy.StrategyNames;
import com.example.crag.telemetry.AuditTrailLogger;
import com.example.crag.telemetry.CragMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorrectiveRetrievalServiceTest {

    private static final RetryPolicy FAST = new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 1.0, false, null);

    private final CircuitBreakerRegistry registry = new CircuitBreakerRegistry();
    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final List<SearchRequest> requests = new CopyOnWriteArrayList<>();

    private CorrectiveRetrievalService service(GateConfig config, boolean fallbackEmpty, Duration budget) {
        CragMetrics metrics = new CragMetrics(meters);
        return new CorrectiveRetrievalService(
                new CorrectiveRetrievalOrchestrator(config, metrics),
                new ResilientExecutor(registry, FAST),
                new ReciprocalRankFuser(),
                AuditTrailLogger.defaults(),
                metrics,
                budget,
                fallbackEmpty);
    }

    private CorrectiveRetrievalService service() {
        return service(GateConfig.defaults(), false, Duration.ZERO);
    }

    private SearchPort recording(Function<SearchRequest, List<RetrievalResult>> backend) {
        return SearchPort.blocking(request -> {
            requests.add(request);
            return backend.apply(request);
        });
    }

    private static List<RetrievalResult> scored(String prefix, double... scores) {
        List<RetrievalResult> out = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            out.add(RetrievalResult.of(prefix + "-" + i, "passage " + prefix + " " + i, scores[i]));
        }
        return out;
    }

    @Test
    void strongInitialResultsAreReturnedUntouched() {
        List<RetrievalResult> initial = scored("init", 0.9, 0.8, 0.7);

        CorrectionOutcome outcome = service().searchWithCorrection("q", initial, 10, RetrievalCallbacks.none());

        assertThat(outcome.results()).isEqualTo(initial);
        AuditTrail trail = outcome.auditTrail();
        assertThat(trail.isFinalized()).isTrue();
        assertThat(trail.correctionAttempted()).isFalse();
        assertThat(trail.finalEvaluation().gatePassed()).isTrue();
        assertThat(trail.finalResultCount()).isEqualTo(3);
    }

    @Test
    void emptyInitialResultsRecoverWithAggressiveHybrid() {
        SearchPort search = recording(r -> scored("retry", 0.8, 0.6, 0.4));

        CorrectionOutcome outcome = service().searchWithCorrection("q", List.of(), 10,
                RetrievalCallbacks.of(search));

        AuditTrail trail = outcome.auditTrail();
        assertThat(trail.actions()).singleElement().satisfies(action -> {
            assertThat(action.strategy()).isEqualTo(StrategyNames.AGGRESSIVE_HYBRID);
            assertThat(action.success()).isTrue();
            assertThat(action.resultCount()).isEqualTo(3);
            assertThat(action.error()).isNull();
        });
        assertThat(trail.correctionSuccessful()).isTrue();
        assertThat(outcome.results()).extracting(RetrievalResult::id).containsExactly("retry-0", "retry-1", "retry-2");

        assertThat(requests).singleElement().satisfies(request -> {
            assertThat(request.query()).isEqualTo("q");
            assertThat(request.topK()).isEqualTo(20);
            assertThat(request.lexicalWeight()).isEqualTo(0.45);
            assertThat(request.semanticWeight()).isEqualTo(0.55);
        });
    }

    @Test
    void multiQueryFansOutAndFusesVariants() {
        SearchPort search = recording(r -> r.query().equals("q") ? scored("orig", 0.0005) : scored(r.query(), 0.9, 0.8));
        QueryVariantPort variants = QueryVariantPort.blocking(q -> List.of("q1", "q2", "Q1 ", "q3", "q4"));

        CorrectionOutcome outcome = service().searchWithCorrection("q", scored("seed", 0.001), 10,
                RetrievalCallbacks.of(search).withQueryVariants(variants));

        List<CorrectiveAction> actions = outcome.auditTrail().actions();
        assertThat(actions).extracting(CorrectiveAction::strategy)
                .containsExactly(StrategyNames.AGGRESSIVE_HYBRID, StrategyNames.MULTI_QUERY);
        assertThat(actions.get(1).resultCount()).isEqualTo(6);
        assertThat(outcome.results()).extracting(RetrievalResult::id)
                .containsExactly("q1-0", "q2-0", "q3-0", "q1-1", "q2-1", "q3-1");
        assertThat(outcome.results()).extracting(r -> (Double) r.metadata().get(ReciprocalRankFuser.RRF_SCORE_KEY))
                .isSortedAccordingTo((a, b) -> Double.compare(b, a));
        assertThat(outcome.results()).extracting(RetrievalResult::finalScore)
                .containsExactly(0.9, 0.9, 0.9, 0.8, 0.8, 0.8);
        assertThat(requests).extracting(SearchRequest::query).containsExactlyInAnyOrder("q", "q1", "q2", "q3");
    }

    @Test
    void fusedVariantsAreJudgedOnNativeScores() {
        SearchPort search = recording(r -> r.query().equals("q") ? scored("orig", 0.2) : scored(r.query(), 0.95, 0.9));
        QueryVariantPort variants = QueryVariantPort.blocking(q -> List.of("q1", "q2", "q3"));

        CorrectionOutcome outcome = service().searchWithCorrection("q", scored("init", 0.3), 10,
                RetrievalCallbacks.of(search).withQueryVariants(variants));

        AuditTrail trail = outcome.auditTrail();
        assertThat(trail.actions()).extracting(CorrectiveAction::strategy)
                .containsExactly(StrategyNames.AGGRESSIVE_HYBRID, StrategyNames.MULTI_QUERY);
        CorrectiveAction multi = trail.actions().get(1);
        assertThat(multi.success()).isTrue();
        assertThat(multi.resultCount()).isEqualTo(6);
        assertThat(trail.finalEvaluation().bestScore()).isEqualTo(0.95);
        assertThat(trail.finalEvaluation().gatePassed()).isTrue();
        assertThat(trail.correctionSuccessful()).isTrue();
        assertThat(outcome.results()).extracting(RetrievalResult::id)
                .containsExactly("q1-0", "q2-0", "q3-0", "q1-1", "q2-1", "q3-1");
    }

    @Test
    void failedVariantContributesNothing() {
        SearchPort search = recording(r -> {
            if (r.query().equals("q2")) {
                throw new IllegalStateException("variant backend down");
            }
            return r.query().equals("q") ? scored("orig", 0.0005) : scored(r.query(), 0.9, 0.8);
        });
        QueryVariantPort variants = QueryVariantPort.blocking(q -> List.of("q1", "q2", "q3"));

        CorrectionOutcome outcome = service().searchWithCorrection("q", scored("seed", 0.001), 10,
                RetrievalCallbacks.of(search).withQueryVariants(variants));

        CorrectiveAction multi = outcome.auditTrail().actions().get(1);
        assertThat(multi.error()).isNull();
        assertThat(multi.resultCount()).isEqualTo(4);
        assertThat(outcome.results()).extracting(RetrievalResult::id)
                .containsExactly("q1-0", "q3-0", "q1-1", "q3-1");
    }

    @Test
    void allVariantsFailingIsAFailedStrategy() {
        List<RetrievalResult> initial = scored("seed", 0.001);
        SearchPort search = recording(r -> {
            if (!r.query().equals("q")) {
                throw new IllegalStateException("down");
            }
            return scored("orig", 0.0005);
        });
        QueryVariantPort variants = QueryVariantPort.blocking(q -> List.of("q1", "q2", "q3"));

        CorrectionOutcome outcome = service().searchWithCorrection("q", initial, 10,
                RetrievalCallbacks.of(search).withQueryVariants(variants));

        CorrectiveAction multi = outcome.auditTrail().actions().get(1);
        assertThat(multi.success()).isFalse();
        assertThat(multi.error()).contains("all 3 variant searches failed");
        assertThat(outcome.results()).isEqualTo(initial);
    }

    @Test
    void emptyVariantListIsAFailedStrategy() {
        SearchPort search = recording(r -> scored("orig", 0.0005));
        QueryVariantPort variants = q -> Mono.just(List.of(" ", ""));

        CorrectionOutcome outcome = service().searchWithCorrection("q", scored("seed", 0.001), 10,
                RetrievalCallbacks.of(search).withQueryVariants(variants));

        assertThat(outcome.auditTrail().actions().get(1).error()).contains("no query variants generated");
    }

    @Test
    void searchFailureIsRecordedAndInitialResultsKept() {
        AtomicInteger calls = new AtomicInteger();
        List<RetrievalResult> initial = scored("seed", 0.2);
        SearchPort search = request -> Mono.defer(() -> {
            calls.incrementAndGet();
            return Mono.<List<RetrievalResult>>error(new IOException("backend down"));
        });

        CorrectionOutcome outcome = service().searchWithCorrection("q", initial, 10, RetrievalCallbacks.of(search));

        AuditTrail trail = outcome.auditTrail();
        assertThat(trail.actions()).singleElement().satisfies(action -> {
            assertThat(action.success()).isFalse();
            assertThat(action.error()).contains("backend down");
            assertThat(action.resultCount()).isZero();
        });
        assertThat(outcome.results()).isEqualTo(initial);
        assertThat(trail.finalEvaluation()).isEqualTo(trail.initialEvaluation());
        assertThat(calls).hasValue(3);
        assertThat(registry.breaker(CorrectiveRetrievalService.SEARCH_BREAKER).stats().totalFailures()).isEqualTo(1);
    }

    @Test
    void hydeRewritesTheQuery() {
        SearchPort search = recording(r -> r.query().equals("q")
                ? scored("orig", 0.1)
                : scored("hyde", 0.9, 0.8, 0.7));
        HydePort hyde = HydePort.blocking(q -> "a hypothetical answer about " + q);

        CorrectionOutcome outcome = service().searchWithCorrection("q", scored("seed", 0.2), 10,
                RetrievalCallbacks.of(search).withHyde(hyde));

        AuditTrail trail = outcome.auditTrail();
        assertThat(trail.actions()).extracting(CorrectiveAction::strategy)
                .containsExactly(StrategyNames.AGGRESSIVE_HYBRID, StrategyNames.HYDE);
        assertThat(trail.correctionSuccessful()).isTrue();
        assertThat(outcome.results()).extracting(RetrievalResult::id).startsWith("hyde-0");
        SearchRequest hydeRequest = requests.get(1);
        assertThat(hydeRequest.query()).isEqualTo("a hypothetical answer about q");
        assertThat(hydeRequest.lexicalWeight()).isEqualTo(0.4);
        assertThat(hydeRequest.semanticWeight()).isEqualTo(0.6);
    }

    @Test
    void blankHypotheticalDocumentFailsTheStrategy() {
        SearchPort search = recording(r -> scored("orig", 0.1));
        HydePort hyde = q -> Mono.just("   ");

        CorrectionOutcome outcome = service().searchWithCorrection("q", scored("seed", 0.2), 10,
                RetrievalCallbacks.of(search).withHyde(hyde));

        CorrectiveAction hydeAction = outcome.auditTrail().actions().get(1);
        assertThat(hydeAction.strategy()).isEqualTo(StrategyNames.HYDE);
        assertThat(hydeAction.error()).contains("empty hypothetical document");
        assertThat(requests).hasSize(1);
    }

    @Test
    void openSearchBreakerFailsTheStrategyWithoutCalling() {
        tripSearchBreaker();
        SearchPort search = recording(r -> scored("never", 0.9));

        CorrectionOutcome outcome = service().searchWithCorrection("q", scored("seed", 0.2), 10,
                RetrievalCallbacks.of(search));

        assertThat(outcome.auditTrail().actions()).singleElement()
                .satisfies(action -> assertThat(action.error()).contains("circuit 'search' is open"));
        assertThat(requests).isEmpty();
        assertThat(meters.counter(CragMetrics.CORRECTIVE_ACTIONS,
                "strategy", StrategyNames.AGGRESSIVE_HYBRID, "outcome", "failure").count()).isEqualTo(1.0);
    }

    @Test
    void openSearchBreakerCanFallBackToEmptyResults() {
        tripSearchBreaker();
        List<RetrievalResult> initial = scored("seed", 0.2);

        CorrectionOutcome outcome = service(GateConfig.defaults(), true, Duration.ZERO)
                .searchWithCorrection("q", initial, 10, RetrievalCallbacks.of(recording(r -> List.of())));

        assertThat(outcome.auditTrail().actions()).singleElement().satisfies(action -> {
            assertThat(action.error()).isNull();
            assertThat(action.success()).isFalse();
            assertThat(action.resultCount()).isZero();
        });
        assertThat(outcome.results()).isEqualTo(initial);
    }

    @Test
    void missingSearchPortIsAnErrorWhenCorrectionIsNeeded() {
        StepVerifier.create(service().correct("q", List.of(), 10, RetrievalCallbacks.none()))
                .expectError(MissingCapabilityException.class)
                .verify(Duration.ofSeconds(1));

        assertThatThrownBy(() -> service().searchWithCorrection("q", scored("seed", 0.1), 10, null))
                .isInstanceOf(MissingCapabilityException.class)
                .hasMessageContaining("level=low");
    }

    @Test
    void zeroRetryRoundsNeverCallsSearch() {
        GateConfig noRetry = GateConfig.defaults().toBuilder().maxRetryRounds(0).build();

        CorrectionOutcome outcome = service(noRetry, false, Duration.ZERO)
                .searchWithCorrection("q", scored("seed", 0.1), 10, RetrievalCallbacks.none());

        assertThat(outcome.auditTrail().actions()).isEmpty();
        assertThat(outcome.auditTrail().finalEvaluation().gatePassed()).isFalse();
    }

    @Test
    void exhaustedTimeBudgetStopsBeforeTheFirstRound() {
        CorrectionOutcome outcome = service(GateConfig.defaults(), false, Duration.ofNanos(1))
                .searchWithCorrection("q", scored("seed", 0.1), 10,
                        RetrievalCallbacks.of(recording(r -> scored("late", 0.9))));

        assertThat(outcome.auditTrail().actions()).isEmpty();
        assertThat(requests).isEmpty();
    }

    @Test
    void searchExtrasArePassedThrough() {
        SearchPort search = recording(r -> scored("retry", 0.9, 0.8, 0.7));

        service().searchWithCorrection("q", List.of(), 10, RetrievalCallbacks.of(search),
                Map.of("tenant", "acme"));

        assertThat(requests.get(0).extra()).containsEntry("tenant", "acme");
    }

    @Test
    void reactiveEntryPointEmitsOneOutcome() {
        SearchPort search = request -> Mono.just(scored("async", 0.95, 0.9, 0.85));

        StepVerifier.create(service().correct("q", List.of(), 5, RetrievalCallbacks.of(search)))
                .assertNext(outcome -> {
                    assertThat(outcome.results()).hasSize(3);
                    assertThat(outcome.auditTrail().correctionSuccessful()).isTrue();
                })
                .verifyComplete();
        assertThat(meters.timer(CragMetrics.CORRECTION_DURATION, "corrected", "true").count()).isEqualTo(1);
    }

    @Test
    void normalizeVariantsDedupsCaseInsensitivelyAndCaps() {
        assertThat(CorrectiveRetrievalService.normalizeVariants(
                Arrays.asList("Alpha", null, " alpha ", "", "beta", "gamma", "delta"), 3))
                .containsExactly("Alpha", "beta", "gamma");
        assertThat(CorrectiveRetrievalService.normalizeVariants(List.of("a"), 0)).isEmpty();
    }

    private void tripSearchBreaker() {
        CircuitBreaker breaker = registry.breaker(CorrectiveRetrievalService.SEARCH_BREAKER);
        for (int i = 0; i < 5; i++) {
            breaker.recordFailure(new IOException("down " + i));
        }
    }
}
