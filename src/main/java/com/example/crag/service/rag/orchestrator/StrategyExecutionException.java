package com.example.crag.service.rag.orchestrator;

/**
 * A corrective strategy could not produce results. Captured into the audit trail;
 * never escapes the correction loop.
 */
public class StrategyExecutionException extends RuntimeException {

    private final String strategy;

    public StrategyExecutionException(String strategy, String message) {
        super(message);
        this.strategy = strategy;
    }

    public StrategyExecutionException(String strategy, String message, Throwable cause) {
        super(message, cause);
        this.strategy = strategy;
    }

    public String strategy() {
        return strategy;
    }
}
