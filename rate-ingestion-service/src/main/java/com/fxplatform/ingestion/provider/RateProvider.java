package com.fxplatform.ingestion.provider;

import com.fxplatform.common.model.RawQuote;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * One external rate source.
 *
 * <p>{@link #fetch} is bounded by the provider's own timeout and either emits a non-empty list
 * of normalized quotes or fails with a {@link com.fxplatform.common.exception.ProviderException}.
 * A failure only ever touches this provider's {@link ProviderStats}.
 */
public interface RateProvider {

    String name();

    double reliability();

    Duration timeout();

    boolean supportsStreaming();

    Mono<List<RawQuote>> fetch(String baseCurrency, List<String> targets);

    ProviderStats stats();
}
