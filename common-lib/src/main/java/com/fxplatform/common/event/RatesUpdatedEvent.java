package com.fxplatform.common.event;

import com.fxplatform.common.model.ConsolidatedRate;
import com.fxplatform.common.validation.ArbitrageOpportunity;

import java.time.Instant;
import java.util.List;

/**
 * Result of one successful ingestion cycle.
 */
public record RatesUpdatedEvent(
    String cycleId,
    List<ConsolidatedRate> rates,
    List<String> providers,
    int totalProviders,
    int successfulProviders,
    int overallQualityScore,
    int rejectedRates,
    List<ArbitrageOpportunity> arbitrageOpportunities,
    Instant timestamp
) {}
