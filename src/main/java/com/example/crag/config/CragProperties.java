package com.example.crag.config;

import com.example.crag.infra.resilience.CircuitBreakerConfig;
import com.example.crag.infra.resilience.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds {@code crag.*}.
 */
@ConfigurationProperties(prefix = "crag")
public class CragProperties {

    /** Master switch for the auto-configuration. */
    private boolean enabled = true;

    private final Gate gate = new Gate();
    private final Fusion fusion = new Fusion();
    private final Loop loop = new Loop();
    private final Retry retry = new Retry();
    private final Breaker breaker = new Breaker();
    private final Audit audit = new Audit();
    private final Probe probe = new Probe();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Gate getGate() {
        return gate;
    }

    public Fusion getFusion() {
        return fusion;
    }

    public Loop getLoop() {
        return loop;
    }

    public Retry getRetry() {
        return retry;
    }

    public Breaker getBreaker() {
        return breaker;
    }

    public Audit getAudit() {
        return audit;
    }

    public Probe getProbe() {
        return probe;
    }

    public static class Gate {
        private double minBestScore = 0.5;
        private double minAvgTop3Score = 0.35;
        private double strongBestThreshold = 0.70;
        private double strongAvgThreshold = 0.55;
        private int maxRetryRounds = 2;
        private boolean multiQueryEnabled = true;
        private boolean hydeEnabled = true;
        private int multiQueryFanout = 3;
        private double aggressiveTopKMultiplier = 2.0;
        private double aggressiveLexicalWeight = 0.45;
        private double aggressiveSemanticWeight = 0.55;

        public GateConfig toGateConfig() {
            return new GateConfig(minBestScore, minAvgTop3Score, strongBestThreshold, strongAvgThreshold,
                    maxRetryRounds, multiQueryEnabled, hydeEnabled, multiQueryFanout,
                    aggressiveTopKMultiplier, aggressiveLexicalWeight, aggressiveSemanticWeight);
        }

        public double getMinBestScore() {
            return minBestScore;
        }

        public void setMinBestScore(double minBestScore) {
            this.minBestScore = minBestScore;
        }

        public double getMinAvgTop3Score() {
            return minAvgTop3Score;
        }

        public void setMinAvgTop3Score(double minAvgTop3Score) {
            this.minAvgTop3Score = minAvgTop3Score;
        }

        public double getStrongBestThreshold() {
            return strongBestThreshold;
        }

        public void setStrongBestThreshold(double strongBestThreshold) {
            this.strongBestThreshold = strongBestThreshold;
        }

        public double getStrongAvgThreshold() {
            return strongAvgThreshold;
        }

        public void setStrongAvgThreshold(double strongAvgThreshold) {
            this.strongAvgThreshold = strongAvgThreshold;
        }

        public int getMaxRetryRounds() {
            return maxRetryRounds;
        }

        public void setMaxRetryRounds(int maxRetryRounds) {
            this.maxRetryRounds = maxRetryRounds;
        }

        public boolean isMultiQueryEnabled() {
            return multiQueryEnabled;
        }

        public void setMultiQueryEnabled(boolean multiQueryEnabled) {
            this.multiQueryEnabled = multiQueryEnabled;
        }

        public boolean isHydeEnabled() {
            return hydeEnabled;
        }

        public void setHydeEnabled(boolean hydeEnabled) {
            this.hydeEnabled = hydeEnabled;
        }

        public int getMultiQueryFanout() {
            return multiQueryFanout;
        }

        public void setMultiQueryFanout(int multiQueryFanout) {
            this.multiQueryFanout = multiQueryFanout;
        }

        public double getAggressiveTopKMultiplier() {
            return aggressiveTopKMultiplier;
        }

        public void setAggressiveTopKMultiplier(double aggressiveTopKMultiplier) {
            this.aggressiveTopKMultiplier = aggressiveTopKMultiplier;
        }

        public double getAggressiveLexicalWeight() {
            return aggressiveLexicalWeight;
        }

        public void setAggressiveLexicalWeight(double aggressiveLexicalWeight) {
            this.aggressiveLexicalWeight = aggressiveLexicalWeight;
        }

        public double getAggressiveSemanticWeight() {
            return aggressiveSemanticWeight;
        }

        public void setAggressiveSemanticWeight(double aggressiveSemanticWeight) {
            this.aggressiveSemanticWeight = aggressiveSemanticWeight;
        }
    }

    public static class Fusion {
        /** RRF smoothing constant. */
        private int rrfK = 60;

        public int getRrfK() {
            return rrfK;
        }

        public void setRrfK(int rrfK) {
            this.rrfK = rrfK;
        }
    }

    public static class Loop {
        /** Wall-clock budget for one correction request; zero disables it. */
        private Duration timeBudget = Duration.ZERO;

        /** Use an empty result list when the search breaker rejects a call. */
        private boolean searchFallbackEmpty = false;

        public Duration getTimeBudget() {
            return timeBudget;
        }

        public void setTimeBudget(Duration timeBudget) {
            this.timeBudget = timeBudget;
        }

        public boolean isSearchFallbackEmpty() {
            return searchFallbackEmpty;
        }

        public void setSearchFallbackEmpty(boolean searchFallbackEmpty) {
            this.searchFallbackEmpty = searchFallbackEmpty;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double exponentialBase = 2.0;
        private boolean jitter = true;

        /** Per-attempt upstream timeout; zero disables it. */
        private Duration callTimeout = Duration.ZERO;

        public RetryPolicy toRetryPolicy() {
            return new RetryPolicy(maxAttempts, baseDelay, maxDelay, exponentialBase, jitter, null);
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getExponentialBase() {
            return exponentialBase;
        }

        public void setExponentialBase(double exponentialBase) {
            this.exponentialBase = exponentialBase;
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }

        public Duration getCallTimeout() {
            return callTimeout;
        }

        public void setCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
        }
    }

    public static class Breaker {
        private int failureThreshold = CircuitBreakerConfig.DEFAULT_FAILURE_THRESHOLD;
        private Duration recoveryTimeout = CircuitBreakerConfig.DEFAULT_RECOVERY_TIMEOUT;
        private int halfOpenMaxCalls = CircuitBreakerConfig.DEFAULT_HALF_OPEN_MAX_CALLS;

        public CircuitBreakerConfig toCircuitBreakerConfig() {
            return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, halfOpenMaxCalls, null);
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getRecoveryTimeout() {
            return recoveryTimeout;
        }

        public void setRecoveryTimeout(Duration recoveryTimeout) {
            this.recoveryTimeout = recoveryTimeout;
        }

        public int getHalfOpenMaxCalls() {
            return halfOpenMaxCalls;
        }

        public void setHalfOpenMaxCalls(int halfOpenMaxCalls) {
            this.halfOpenMaxCalls = halfOpenMaxCalls;
        }
    }

    public static class Audit {
        /** Also log the whole trail as one JSON line at DEBUG. */
        private boolean logJson = true;
        private int maxQueryChars = 200;

        public boolean isLogJson() {
            return logJson;
        }

        public void setLogJson(boolean logJson) {
            this.logJson = logJson;
        }

        public int getMaxQueryChars() {
            return maxQueryChars;
        }

        public void setMaxQueryChars(int maxQueryChars) {
            this.maxQueryChars = maxQueryChars;
        }
    }

    public static class Probe {
        /** Exposes /internal/crag/breakers. Off by default. */
        private boolean enabled = false;

        /** When set, callers must send it in the X-Internal-Key header. */
        private String key = "";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }
    }
}
