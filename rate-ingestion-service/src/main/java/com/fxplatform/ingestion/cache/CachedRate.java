package com.fxplatform.ingestion.cache;

import com.fxplatform.common.model.ConsolidatedRate;

import java.time.Instant;

/**
 * L1 entry. {@code expiresAt} is {@code null} for cycle rates, which are simply overwritten
 * by the next cycle.
 */
public record CachedRate(ConsolidatedRate rate, Instant cachedAt, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
