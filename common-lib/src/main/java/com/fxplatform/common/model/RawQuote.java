package com.fxplatform.common.model;

import java.time.Instant;

/**
 * One provider's normalized quote for one pair. Produced once per fetch or stream
 * message and consumed immediately by consolidation or validation.
 *
 * <p>{@code bid}, {@code ask} and {@code spread} are {@code null} when the source does not
 * report them.
 */
public record RawQuote(
    String provider,
    PairKey pair,
    double rate,
    Double bid,
    Double ask,
    Double spread,
    Instant timestamp,
    double reliability,
    boolean streaming
) {

    public boolean hasBidAsk() {
        return bid != null && ask != null;
    }
}
