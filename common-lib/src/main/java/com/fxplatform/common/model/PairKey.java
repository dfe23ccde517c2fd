package com.fxplatform.common.model;

import java.util.Locale;

/**
 * Identity of a currency pair, canonically rendered as {@code "BASE/QUOTE"}.
 * Used as map key by the consolidator, validation history and cache.
 */
public record PairKey(String base, String quote) {

    public PairKey {
        if (base == null || quote == null || base.isBlank() || quote.isBlank()) {
            throw new IllegalArgumentException("Pair requires both base and quote currency");
        }
        base  = base.trim().toUpperCase(Locale.ROOT);
        quote = quote.trim().toUpperCase(Locale.ROOT);
    }

    public static PairKey of(String base, String quote) {
        return new PairKey(base, quote);
    }

    /** Parses {@code "USD/EUR"}; also accepts the {@code "USD_EUR"} form used by some providers. */
    public static PairKey parse(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Pair symbol is null");
        }
        String[] parts = symbol.trim().split("[/_]");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid pair symbol: " + symbol);
        }
        return new PairKey(parts[0], parts[1]);
    }

    public PairKey inverse() {
        return new PairKey(quote, base);
    }

    public boolean involves(String currency) {
        return base.equalsIgnoreCase(currency) || quote.equalsIgnoreCase(currency);
    }

    public String symbol() {
        return base + "/" + quote;
    }

    @Override
    public String toString() {
        return symbol();
    }
}
