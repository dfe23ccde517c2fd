package com.fxplatform.common.model;

import java.util.List;

/**
 * ISO 4217 currency as held by the {@code CurrencyRegistry}.
 *
 * <p>{@code decimalPlaces} and {@code numericCode} are boxed so an incomplete definition
 * submitted through the admin API can be rejected with a field-specific reason.
 */
public record CurrencyDefinition(
    String code,
    String name,
    String symbol,
    Integer decimalPlaces,
    Integer numericCode,
    String minorUnit,
    List<String> countries,
    TradingHours tradingHours,
    CurrencyCategory category,
    boolean active
) {

    public CurrencyDefinition {
        code         = code == null ? null : code.trim().toUpperCase();
        countries    = countries == null ? List.of() : List.copyOf(countries);
        tradingHours = tradingHours == null ? TradingHours.allDay() : tradingHours;
        category     = category == null ? CurrencyCategory.MINOR : category;
    }

    public CurrencyDefinition withActive(boolean newActive) {
        return new CurrencyDefinition(code, name, symbol, decimalPlaces, numericCode, minorUnit,
                                      countries, tradingHours, category, newActive);
    }
}
