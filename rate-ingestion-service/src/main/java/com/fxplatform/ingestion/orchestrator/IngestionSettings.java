package com.fxplatform.ingestion.orchestrator;

import java.time.Duration;
import java.util.List;

/**
 * @param targetCurrencies quote currencies fetched every cycle; empty means every active
 *                         non-base currency of the registry
 * @param updateInterval   delay between cycle starts
 * @param maxFailures      consecutive failed cycles that trip the circuit breaker
 * @param reconnectDelay   wait before re-opening a dropped stream
 */
public record IngestionSettings(
    List<String> targetCurrencies,
    Duration updateInterval,
    int maxFailures,
    Duration reconnectDelay,
    boolean streamingEnabled
) {

    public IngestionSettings {
        targetCurrencies = targetCurrencies == null ? List.of() : List.copyOf(targetCurrencies);
        if (maxFailures < 1) {
            throw new IllegalArgumentException("maxFailures must be at least 1");
        }
    }

    public static IngestionSettings defaults() {
        return new IngestionSettings(List.of("EUR", "GBP", "JPY", "CAD", "AUD", "CHF", "CNY"),
                                     Duration.ofSeconds(60), 5, Duration.ofSeconds(5), true);
    }
}
