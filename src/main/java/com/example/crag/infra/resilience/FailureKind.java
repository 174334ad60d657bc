package com.example.crag.infra.resilience;

import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Coarse classification of upstream failures, used for log lines and metric tags.
 */
public enum FailureKind {
    TIMEOUT,
    INTERRUPTED,
    RATE_LIMIT,
    REJECTED,

    /** Caller-side problem (bad argument, unsupported operation). */
    CLIENT,

    UNKNOWN;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FailureKind classify(Throwable t) {
        Throwable root = unwrap(t);
        if (root == null) {
            return UNKNOWN;
        }
        if (root instanceof InterruptedException || root instanceof CancellationException) {
            return INTERRUPTED;
        }
        if (root instanceof TimeoutException || root instanceof HttpTimeoutException) {
            return TIMEOUT;
        }
        if (root instanceof CircuitOpenException) {
            return REJECTED;
        }
        if (root instanceof IllegalArgumentException || root instanceof UnsupportedOperationException) {
            return CLIENT;
        }

        String msg = root.getMessage() == null ? "" : root.getMessage().toLowerCase(Locale.ROOT);
        if (msg.contains("429") || (msg.contains("rate") && msg.contains("limit"))) {
            return RATE_LIMIT;
        }
        if (msg.contains("timeout") || msg.contains("timed out")) {
            return TIMEOUT;
        }
        if (msg.contains("interrupted") || msg.contains("cancel")) {
            return INTERRUPTED;
        }
        if (msg.contains("overloaded") || msg.contains("busy") || msg.contains("reject")) {
            return REJECTED;
        }
        return UNKNOWN;
    }

    static Throwable unwrap(Throwable t) {
        if (t == null) {
            return null;
        }
        Throwable cur = t;
        int guard = 0;
        while (cur.getCause() != null && cur.getCause() != cur && guard++ < 12) {
            cur = cur.getCause();
        }
        return cur;
    }
}
