package com.fxplatform.common.event;

import java.time.Instant;

/**
 * Emitted exactly once when the circuit breaker trips. Ingestion stays down until an operator
 * resets or restarts it.
 */
public record CriticalFailureEvent(int consecutiveFailures, String lastError, Instant timestamp) {}
