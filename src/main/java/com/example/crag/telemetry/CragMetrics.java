package com.example.crag.telemetry;

import com.example.crag.domain.model.EvidenceLevel;
import com.example.crag.infra.resilience.FailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer counters for the corrective loop.
 *
 * <p>Tags stay low-cardinality: evidence level, strategy name, breaker name, failure kind.
 * A null registry turns every method into a no-op.</p>
 */
public final class CragMetrics {

    public static final String GATE_EVALUATIONS = "crag.gate.evaluations";
    public static final String CORRECTIVE_ACTIONS = "crag.corrective.actions";
    public static final String CORRECTION_DURATION = "crag.correction.duration";
    public static final String BREAKER_REJECTED = "crag.breaker.rejected";
    public static final String UPSTREAM_FAILURES = "crag.upstream.failures";

    private final MeterRegistry registry; // may be null (fail-soft)
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public CragMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public static CragMetrics noop() {
        return new CragMetrics(null);
    }

    public void gateEvaluated(EvidenceLevel level) {
        increment(GATE_EVALUATIONS, "level", level == null ? null : level.wireValue());
    }

    public void correctiveAction(String strategy, boolean success) {
        increment(CORRECTIVE_ACTIONS, "strategy", strategy, "outcome", success ? "success" : "failure");
    }

    public void correctionCompleted(long durationMs, boolean corrected) {
        if (registry == null) {
            return;
        }
        Timer.builder(CORRECTION_DURATION)
                .tag("corrected", Boolean.toString(corrected))
                .register(registry)
                .record(Duration.ofMillis(Math.max(0L, durationMs)));
    }

    public void breakerRejected(String breaker) {
        increment(BREAKER_REJECTED, "breaker", breaker);
    }

    public void upstreamFailure(String breaker, FailureKind kind) {
        increment(UPSTREAM_FAILURES, "breaker", breaker, "kind", kind == null ? null : kind.tag());
    }

    private void increment(String name, String... tagPairs) {
        if (registry == null) {
            return;
        }
        StringBuilder cacheKey = new StringBuilder(name);
        String[] tags = new String[tagPairs.length];
        for (int i = 0; i < tagPairs.length; i += 2) {
            tags[i] = tagPairs[i];
            tags[i + 1] = safeTag(tagPairs[i + 1]);
            cacheKey.append('|').append(tags[i + 1]);
        }
        counters.computeIfAbsent(cacheKey.toString(),
                k -> Counter.builder(name).tags(tags).register(registry)).increment();
    }

    private static String safeTag(String raw) {
        if (raw == null) {
            return "none";
        }
        String s = raw.trim();
        if (s.isEmpty()) {
            return "none";
        }
        if (s.length() > 64) {
            s = s.substring(0, 64);
        }
        return s.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
