package com.fxplatform.ingestion.provider;

import java.time.Instant;

/**
 * Point-in-time copy of a provider's health counters.
 */
public record ProviderStats(
    String provider,
    double reliability,
    long requests,
    long successes,
    long failures,
    Instant lastSuccess,
    Instant lastFailure,
    double avgResponseTimeMs,
    boolean healthy
) {}
