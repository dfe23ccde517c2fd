package com.fxplatform.ingestion.orchestrator;

import com.fxplatform.common.validation.ValidationStats;
import com.fxplatform.ingestion.cache.CacheHealth;
import com.fxplatform.ingestion.provider.ProviderStats;

import java.time.Instant;
import java.util.List;

/**
 * Operational snapshot. {@code status} is one of {@code running}, {@code degraded} (under half of
 * the providers healthy), {@code critical} (breaker tripped) or {@code stopped}.
 */
public record IngestionHealth(
    String status,
    IngestionState state,
    int healthyProviders,
    int totalProviders,
    double healthPercentage,
    List<ProviderStats> providers,
    CacheHealth cache,
    int consecutiveFailures,
    int maxFailures,
    int streamingConnections,
    Instant lastUpdate,
    String lastError,
    ValidationStats validation
) {}
