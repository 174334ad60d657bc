package com.example.crag.domain.model;

import java.util.List;
import java.util.Objects;

/** Final results of a correction request together with its finalized audit trail. */
public record CorrectionOutcome(List<RetrievalResult> results, AuditTrail auditTrail) {

    public CorrectionOutcome {
        results = results == null ? List.of() : List.copyOf(results);
        Objects.requireNonNull(auditTrail, "auditTrail");
    }
}
