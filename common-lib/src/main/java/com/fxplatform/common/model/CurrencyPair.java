package com.fxplatform.common.model;

import java.math.BigDecimal;

/**
 * Tradable pair derived from two active {@link CurrencyDefinition}s.
 * Regenerated by the registry whenever the active-currency set changes.
 */
public record CurrencyPair(
    String base,
    String quote,
    String symbol,
    BigDecimal minTradeAmount,
    BigDecimal maxTradeAmount,
    BigDecimal tickSize,
    TradingHours tradingHours,
    int settlementDays,
    boolean active
) {

    public PairKey key() {
        return PairKey.of(base, quote);
    }
}
