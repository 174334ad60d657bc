package com.example.crag.probe;

import com.example.crag.infra.resilience.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Internal breaker probe.
 *
 * - GET  /internal/crag/breakers
 * - POST /internal/crag/breakers/{name}/reset
 * - POST /internal/crag/breakers/reset
 * - Enabled by: crag.probe.enabled=true
 * - Optional auth: crag.probe.key + header X-Internal-Key
 */
@Slf4j
@RestController
@RequestMapping("/internal/crag/breakers")
public class CircuitBreakerProbeController {

    private final CircuitBreakerRegistry registry;
    private final String requiredKey;

    public CircuitBreakerProbeController(CircuitBreakerRegistry registry, String requiredKey) {
        this.registry = registry;
        this.requiredKey = requiredKey == null ? "" : requiredKey;
    }

    @GetMapping
    public ResponseEntity<?> list(@RequestHeader(value = "X-Internal-Key", required = false) String key) {
        if (!authorized(key)) {
            return unauthorized();
        }
        return ResponseEntity.ok(Map.of(
                "anyOpen", registry.anyOpen(),
                "breakers", registry.snapshotAsMap()));
    }

    @PostMapping("/{name}/reset")
    public ResponseEntity<?> reset(@PathVariable("name") String name,
                                   @RequestHeader(value = "X-Internal-Key", required = false) String key) {
        if (!authorized(key)) {
            return unauthorized();
        }
        if (!registry.reset(name)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                    "error", "not_found",
                    "message", "No circuit breaker named " + name));
        }
        log.info("[CircuitBreaker] reset via probe name={}", name);
        return ResponseEntity.ok(Map.of("reset", name));
    }

    @PostMapping("/reset")
    public ResponseEntity<?> resetAll(@RequestHeader(value = "X-Internal-Key", required = false) String key) {
        if (!authorized(key)) {
            return unauthorized();
        }
        registry.resetAll();
        return ResponseEntity.ok(Map.of("reset", registry.names()));
    }

    private boolean authorized(String key) {
        return requiredKey.isBlank() || requiredKey.equals(key);
    }

    private static ResponseEntity<?> unauthorized() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of(
                "error", "unauthorized",
                "message", "Missing/invalid X-Internal-Key"));
    }
}
