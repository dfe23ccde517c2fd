package com.fxplatform.common.model;

import java.time.Instant;
import java.util.List;

/**
 * The single rate for a pair produced by one ingestion cycle (or one accepted streaming tick).
 * Superseded, never merged, by the next result for the same pair.
 *
 * <p>{@code bidAskSpread} is expressed in basis points of {@code rate}; {@code rateSpreadPercent}
 * is the inter-provider dispersion.
 */
public record ConsolidatedRate(
    PairKey pair,
    double rate,
    Double bid,
    Double ask,
    Double bidAskSpread,
    double rateSpreadPercent,
    int qualityScore,
    int providerCount,
    List<String> providers,
    double minRate,
    double maxRate,
    double avgReliability,
    Instant timestamp,
    List<RawQuote> rawRates,
    boolean streaming,
    ValidationResult validation
) {

    public ConsolidatedRate {
        providers = providers == null ? List.of() : List.copyOf(providers);
        rawRates  = rawRates == null ? List.of() : List.copyOf(rawRates);
    }

    /** Wraps an accepted streaming tick. Not cross-checked, so dispersion is zero. */
    public static ConsolidatedRate fromStreamingQuote(RawQuote quote, int qualityScore) {
        Double spreadBps = quote.hasBidAsk() && quote.rate() > 0
            ? (quote.ask() - quote.bid()) / quote.rate() * 10_000
            : null;
        return new ConsolidatedRate(quote.pair(), quote.rate(), quote.bid(), quote.ask(), spreadBps,
            0.0, qualityScore, 1, List.of(quote.provider()), quote.rate(), quote.rate(),
            quote.reliability(), quote.timestamp(), List.of(quote), true, null);
    }

    public ConsolidatedRate withValidation(ValidationResult result) {
        return new ConsolidatedRate(pair, rate, bid, ask, bidAskSpread, rateSpreadPercent, qualityScore,
            providerCount, providers, minRate, maxRate, avgReliability, timestamp, rawRates, streaming, result);
    }

    public ConsolidatedRate withQualityScore(int score) {
        return new ConsolidatedRate(pair, rate, bid, ask, bidAskSpread, rateSpreadPercent, score,
            providerCount, providers, minRate, maxRate, avgReliability, timestamp, rawRates, streaming, validation);
    }

    public boolean hasBidAsk() {
        return bid != null && ask != null;
    }
}
