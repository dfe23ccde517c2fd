package com.fxplatform.ingestion.cache;

import com.fxplatform.common.model.ConsolidatedRate;

import java.time.Instant;
import java.util.Map;

/**
 * Base-relative snapshot of cached rates, keyed by quote currency. Currencies with nothing
 * cached are absent from {@code rates}.
 */
public record LatestRates(
    String baseCurrency,
    Map<String, ConsolidatedRate> rates,
    Instant lastUpdate,
    int cacheSize
) {}
