package com.fxplatform.ingestion.orchestrator;

/**
 * {@code STOPPED -> STARTING -> RUNNING -> STOPPING -> STOPPED}. {@code FAILED} is entered when
 * the circuit breaker trips and is left only by an operator {@code reset()} or {@code start()}.
 */
public enum IngestionState {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING,
    FAILED
}
