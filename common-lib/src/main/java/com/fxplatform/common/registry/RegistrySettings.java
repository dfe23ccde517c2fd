package com.fxplatform.common.registry;

import java.math.BigDecimal;
import java.util.List;

/**
 * Registry configuration.
 *
 * @param baseCurrency                 never removable, never deactivatable
 * @param supportedCurrencies          codes active at bootstrap; other defaults start inactive
 * @param minAmount                    lower bound for {@link CurrencyRegistry#validateCurrencyAmount}
 * @param maxAmount                    upper bound for {@link CurrencyRegistry#validateCurrencyAmount}
 * @param regionalRestrictionsEnabled  when false every restriction check is allowed
 */
public record RegistrySettings(
    String baseCurrency,
    List<String> supportedCurrencies,
    BigDecimal minAmount,
    BigDecimal maxAmount,
    boolean regionalRestrictionsEnabled
) {

    public RegistrySettings {
        baseCurrency        = baseCurrency.toUpperCase();
        supportedCurrencies = supportedCurrencies == null || supportedCurrencies.isEmpty()
            ? DefaultCurrencies.CODES
            : supportedCurrencies.stream().map(String::trim).map(String::toUpperCase).toList();
    }

    public static RegistrySettings defaults() {
        return new RegistrySettings("USD", DefaultCurrencies.CODES,
            new BigDecimal("0.01"), new BigDecimal("1000000"), false);
    }
}
