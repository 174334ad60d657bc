package com.example.crag.telemetry;

import com.example.crag.domain.model.AuditTrail;
import com.example.crag.domain.model.CorrectiveAction;
import com.example.crag.domain.model.GateEvaluation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Logs a one-line summary per finished audit trail and, optionally, the whole trail as JSON.
 * Serialization problems are logged and swallowed into a null result (fail-soft).
 */
@Slf4j
public class AuditTrailLogger {

    private static final int LOG_QUERY_CHARS = 80;

    private final ObjectMapper objectMapper;
    private final boolean logJson;
    private final int maxQueryChars;

    public AuditTrailLogger(ObjectMapper objectMapper, boolean logJson, int maxQueryChars) {
        this.objectMapper = objectMapper == null ? new ObjectMapper() : objectMapper;
        this.logJson = logJson;
        this.maxQueryChars = maxQueryChars;
    }

    public static AuditTrailLogger defaults() {
        return new AuditTrailLogger(new ObjectMapper(), false, AuditTrail.DEFAULT_MAX_QUERY_CHARS);
    }

    public void log(AuditTrail trail) {
        if (trail == null) {
            return;
        }
        logSummary(trail);
        if (logJson && log.isDebugEnabled()) {
            String json = toJson(trail);
            if (json != null) {
                log.debug("[CRAG] audit {}", json);
            }
        }
    }

    public void logSummary(AuditTrail trail) {
        String query = AuditTrail.clip(trail.query(), LOG_QUERY_CHARS);
        GateEvaluation initial = trail.initialEvaluation();
        GateEvaluation fin = trail.finalEvaluation();
        if (trail.correctionAttempted()) {
            List<String> strategies = trail.actions().stream()
                    .map(CorrectiveAction::strategy)
                    .collect(Collectors.toList());
            if (trail.correctionSuccessful()) {
                log.info("[CRAG] correction successful query={} initialLevel={} finalLevel={} actions={} durationMs={}",
                        query, initial.evidenceLevel().wireValue(),
                        fin == null ? "none" : fin.evidenceLevel().wireValue(),
                        strategies, trail.totalDurationMs());
            } else {
                log.warn("[CRAG] correction unsuccessful query={} level={} actions={} durationMs={}",
                        query, fin == null ? "unknown" : fin.evidenceLevel().wireValue(),
                        strategies, trail.totalDurationMs());
            }
        } else if (log.isDebugEnabled()) {
            log.debug("[CRAG] gate passed without correction query={} level={} best={} avg={}",
                    query, initial.evidenceLevel().wireValue(),
                    String.format(Locale.ROOT, "%.3f", initial.bestScore()),
                    String.format(Locale.ROOT, "%.3f", initial.avgTop3Score()));
        }
    }

    /** The trail as one JSON line, or null when it cannot be written. */
    public String toJson(AuditTrail trail) {
        try {
            return objectMapper.writeValueAsString(trail.toMap(maxQueryChars));
        } catch (JsonProcessingException e) {
            log.warn("[CRAG] audit trail serialization failed: {}", e.getOriginalMessage());
            return null;
        }
    }
}
