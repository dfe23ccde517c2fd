package com.fxplatform.ingestion.cache;

import com.fxplatform.common.event.AlertDirection;
import com.fxplatform.common.model.PairKey;

import java.time.Instant;

public record RateAlert(
    PairKey pair,
    double threshold,
    AlertDirection direction,
    Instant createdAt,
    Instant lastTriggered,
    long triggerCount
) {

    public static RateAlert create(PairKey pair, double threshold, AlertDirection direction, Instant now) {
        return new RateAlert(pair, threshold, direction, now, null, 0);
    }

    public RateAlert triggered(Instant at) {
        return new RateAlert(pair, threshold, direction, createdAt, at, triggerCount + 1);
    }

    /** BOTH fires on a move of more than 1% of the threshold either way. */
    public boolean isBreachedBy(double rate) {
        return switch (direction) {
            case ABOVE -> rate > threshold;
            case BELOW -> rate < threshold;
            case BOTH  -> Math.abs(rate - threshold) > threshold * 0.01;
        };
    }
}
