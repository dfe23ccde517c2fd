package com.fxplatform.ingestion.cache;

import com.fxplatform.common.model.ConsolidatedRate;
import com.fxplatform.common.model.PairKey;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Second cache tier shared across instances and restarts. Every method may fail with
 * {@link com.fxplatform.common.exception.CacheUnavailableException}; callers degrade to L1.
 */
public interface DurableRateStore {

    /** {@code ttl == null} stores without expiry. */
    Mono<Void> save(ConsolidatedRate rate, Duration ttl);

    /** Empty when absent. */
    Mono<ConsolidatedRate> find(PairKey pair);

    Mono<Boolean> delete(PairKey pair);

    Mono<Void> saveAlert(RateAlert alert, Duration ttl);

    Mono<Boolean> deleteAlert(PairKey pair);

    /** Write-then-read probe. Emits {@code true} only when the round trip returned what was written. */
    Mono<Boolean> ping();
}
