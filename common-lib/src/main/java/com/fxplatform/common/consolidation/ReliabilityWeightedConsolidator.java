package com.fxplatform.common.consolidation;

import com.fxplatform.common.model.ConsolidatedRate;
import com.fxplatform.common.model.PairKey;
import com.fxplatform.common.model.RawQuote;

import java.time.Clock;
import java.util.List;

/**
 * Default {@link RateConsolidator}: reliability-weighted mean with a dispersion-based quality score.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>A single quote is accepted as-is with quality {@value #SINGLE_SOURCE_QUALITY}.</li>
 *   <li>{@code rate = Σ(rate × reliability) / Σ(reliability)}; bid and ask are weighted the same
 *       way over only the quotes that carry them.</li>
 *   <li>{@code rateSpreadPercent = (max − min) / rate × 100}.</li>
 *   <li>{@code quality = max(0, 100 − spread × 10)}, +10 when a weighted bid/ask exists (capped at 100),
 *       then {@code min(100, quality + (avgReliability − 0.8) × 50)}, clamped to [0, 100] and rounded.</li>
 * </ol>
 *
 * <p>The bonus terms are order dependent. Downstream consumers rely on the exact numbers, so the
 * formula stays as is.
 *
 * <p>Stateless and thread-safe.
 */
public class ReliabilityWeightedConsolidator implements RateConsolidator {

    static final int SINGLE_SOURCE_QUALITY = 85;

    private static final double SPREAD_PENALTY      = 10.0;
    private static final double BID_ASK_BONUS       = 10.0;
    private static final double RELIABILITY_PIVOT   = 0.8;
    private static final double RELIABILITY_FACTOR  = 50.0;

    private final Clock clock;

    public ReliabilityWeightedConsolidator(Clock clock) {
        this.clock = clock;
    }

    public ReliabilityWeightedConsolidator() {
        this(Clock.systemUTC());
    }

    @Override
    public ConsolidatedRate consolidate(PairKey pair, List<RawQuote> quotes) {
        if (quotes == null || quotes.isEmpty()) {
            throw new IllegalArgumentException("No quotes to consolidate for " + pair);
        }
        if (quotes.size() == 1) {
            return single(pair, quotes.get(0));
        }

        // Zero total reliability falls back to equal weights
        double totalReliability = quotes.stream().mapToDouble(RawQuote::reliability).sum();
        boolean equalWeights    = totalReliability <= 0.0;

        double weightedRate = 0.0, totalWeight = 0.0;
        double bidSum = 0.0, bidWeight = 0.0;
        double askSum = 0.0, askWeight = 0.0;
        double min = Double.MAX_VALUE, max = -Double.MAX_VALUE;

        for (RawQuote q : quotes) {
            double w = equalWeights ? 1.0 : q.reliability();
            weightedRate += q.rate() * w;
            totalWeight  += w;
            if (q.bid() != null) { bidSum += q.bid() * w; bidWeight += w; }
            if (q.ask() != null) { askSum += q.ask() * w; askWeight += w; }
            min = Math.min(min, q.rate());
            max = Math.max(max, q.rate());
        }

        double rate = weightedRate / totalWeight;
        Double bid  = bidWeight > 0.0 ? bidSum / bidWeight : null;
        Double ask  = askWeight > 0.0 ? askSum / askWeight : null;

        double spreadPercent  = (max - min) / rate * 100.0;
        double avgReliability = totalReliability / quotes.size();

        double quality = Math.max(0.0, 100.0 - spreadPercent * SPREAD_PENALTY);
        if (bid != null && ask != null) {
            quality = Math.min(100.0, quality + BID_ASK_BONUS);
        }
        quality = Math.min(100.0, quality + (avgReliability - RELIABILITY_PIVOT) * RELIABILITY_FACTOR);
        int qualityScore = (int) Math.round(Math.max(0.0, Math.min(100.0, quality)));

        List<String> providers = quotes.stream().map(RawQuote::provider).distinct().toList();

        return new ConsolidatedRate(pair, rate, bid, ask, bidAskSpreadBps(rate, bid, ask),
            spreadPercent, qualityScore, quotes.size(), providers, min, max, avgReliability,
            clock.instant(), quotes, false, null);
    }

    private ConsolidatedRate single(PairKey pair, RawQuote q) {
        return new ConsolidatedRate(pair, q.rate(), q.bid(), q.ask(), bidAskSpreadBps(q.rate(), q.bid(), q.ask()),
            0.0, SINGLE_SOURCE_QUALITY, 1, List.of(q.provider()), q.rate(), q.rate(), q.reliability(),
            clock.instant(), List.of(q), false, null);
    }

    private static Double bidAskSpreadBps(double rate, Double bid, Double ask) {
        if (bid == null || ask == null || rate <= 0.0) return null;
        return (ask - bid) / rate * 10_000;
    }
}
