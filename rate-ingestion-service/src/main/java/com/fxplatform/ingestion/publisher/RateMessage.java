package com.fxplatform.ingestion.publisher;

import com.fxplatform.common.model.ConsolidatedRate;

import java.time.Instant;
import java.util.List;

/**
 * Message bus payload for one rate. Keyed by {@link #symbol()} on the topic.
 */
public record RateMessage(
    String symbol,
    String baseCurrency,
    String quoteCurrency,
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
    boolean streaming,
    Instant timestamp,
    Instant publishedAt
) {

    public static RateMessage from(ConsolidatedRate rate, Instant publishedAt) {
        return new RateMessage(rate.pair().symbol(), rate.pair().base(), rate.pair().quote(),
            rate.rate(), rate.bid(), rate.ask(), rate.bidAskSpread(), rate.rateSpreadPercent(),
            rate.qualityScore(), rate.providerCount(), rate.providers(), rate.minRate(), rate.maxRate(),
            rate.avgReliability(), rate.streaming(), rate.timestamp(), publishedAt);
    }
}
