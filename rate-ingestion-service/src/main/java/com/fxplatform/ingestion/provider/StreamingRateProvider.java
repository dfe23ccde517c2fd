package com.fxplatform.ingestion.provider;

import com.fxplatform.common.model.RawQuote;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * A {@link RateProvider} that can also push quotes over a persistent connection.
 */
public interface StreamingRateProvider extends RateProvider {

    /**
     * Opens the connection on subscription and subscribes to {@code BASE/QUOTE} for every target.
     * Emits one quote per {@code rate_update} message until the connection closes (completes) or
     * drops (errors). Cancelling the subscription closes the connection.
     */
    Flux<RawQuote> connectStream(String baseCurrency, List<String> targets);
}
