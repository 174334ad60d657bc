package com.example.crag.infra.resilience;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time snapshot of one breaker, taken under its lock.
 */
public record CircuitBreakerStats(String name,
                                  CircuitState state,
                                  int failureCount,
                                  int successCount,
                                  Instant lastFailureTime,
                                  Instant lastSuccessTime,
                                  Instant lastStateChange,
                                  long totalCalls,
                                  long totalFailures,
                                  long totalSuccesses,
                                  long totalRejected) {

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", name);
        m.put("state", state.wireValue());
        m.put("failureCount", failureCount);
        m.put("successCount", successCount);
        m.put("lastFailureTime", lastFailureTime == null ? null : lastFailureTime.toString());
        m.put("lastSuccessTime", lastSuccessTime == null ? null : lastSuccessTime.toString());
        m.put("lastStateChange", lastStateChange == null ? null : lastStateChange.toString());
        m.put("totalCalls", totalCalls);
        m.put("totalFailures", totalFailures);
        m.put("totalSuccesses", totalSuccesses);
        m.put("totalRejected", totalRejected);
        return m;
    }
}
