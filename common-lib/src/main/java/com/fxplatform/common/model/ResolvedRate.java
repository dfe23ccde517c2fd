package com.fxplatform.common.model;

import java.time.Instant;
import java.util.List;

/**
 * A rate as served to the currency/transaction layer: the stored {@link ConsolidatedRate}
 * shape plus provenance flags.
 */
public record ResolvedRate(
    PairKey pair,
    double rate,
    Double bid,
    Double ask,
    int qualityScore,
    int providerCount,
    List<String> providers,
    Instant timestamp,
    boolean streaming,
    RateProvenance provenance
) {

    public ResolvedRate {
        providers = providers == null ? List.of() : List.copyOf(providers);
    }

    public static ResolvedRate direct(ConsolidatedRate r) {
        return new ResolvedRate(r.pair(), r.rate(), r.bid(), r.ask(), r.qualityScore(),
            r.providerCount(), r.providers(), r.timestamp(), r.streaming(), RateProvenance.DIRECT);
    }

    /** {@code rate = 1/stored}; bid and ask swap and invert. */
    public static ResolvedRate inverse(ConsolidatedRate r) {
        Double bid = r.ask() != null && r.ask() > 0 ? 1.0 / r.ask() : null;
        Double ask = r.bid() != null && r.bid() > 0 ? 1.0 / r.bid() : null;
        return new ResolvedRate(r.pair().inverse(), 1.0 / r.rate(), bid, ask, r.qualityScore(),
            r.providerCount(), r.providers(), r.timestamp(), r.streaming(), RateProvenance.INVERSE);
    }

    public boolean isInverse() {
        return provenance == RateProvenance.INVERSE;
    }

    public boolean isCrossRate() {
        return provenance == RateProvenance.CROSS;
    }

    public Double spread() {
        return bid != null && ask != null ? ask - bid : null;
    }
}
