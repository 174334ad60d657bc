package com.example.crag.service.rag.orchestrator;

/** A correction was required but no search backend was supplied. */
public class MissingCapabilityException extends IllegalStateException {

    public MissingCapabilityException(String message) {
        super(message);
    }
}
