package com.example.crag.infra.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named breakers, one per upstream dependency ("search", "hyde-generator", ...).
 * Injected where needed; a host that wants process-wide sharing registers one instance as a bean.
 */
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerConfig defaultConfig;
    private final Clock clock;

    public CircuitBreakerRegistry() {
        this(CircuitBreakerConfig.defaults(), Clock.systemUTC());
    }

    public CircuitBreakerRegistry(CircuitBreakerConfig defaultConfig) {
        this(defaultConfig, Clock.systemUTC());
    }

    public CircuitBreakerRegistry(CircuitBreakerConfig defaultConfig, Clock clock) {
        this.defaultConfig = defaultConfig == null ? CircuitBreakerConfig.defaults() : defaultConfig;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public CircuitBreakerConfig defaultConfig() {
        return defaultConfig;
    }

    /** Returns the breaker for {@code name}, creating it with the default config on first use. */
    public CircuitBreaker breaker(String name) {
        return breaker(name, defaultConfig);
    }

    /** The config only applies when the breaker does not exist yet. */
    public CircuitBreaker breaker(String name, CircuitBreakerConfig config) {
        return breakers.computeIfAbsent(name, n -> new CircuitBreaker(n, config, clock));
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public Set<String> names() {
        return new TreeSet<>(breakers.keySet());
    }

    /** Stats keyed by breaker name, sorted. */
    public Map<String, CircuitBreakerStats> snapshot() {
        Map<String, CircuitBreakerStats> out = new TreeMap<>();
        breakers.forEach((name, breaker) -> out.put(name, breaker.stats()));
        return out;
    }

    public Map<String, Map<String, Object>> snapshotAsMap() {
        Map<String, Map<String, Object>> out = new TreeMap<>();
        snapshot().forEach((name, stats) -> out.put(name, stats.toMap()));
        return out;
    }

    public boolean anyOpen() {
        return breakers.values().stream().anyMatch(b -> b.state() == CircuitState.OPEN);
    }

    public boolean reset(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
        log.info("[CircuitBreaker] reset all breakers count={}", breakers.size());
    }
}
