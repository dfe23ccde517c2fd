package com.fxplatform.common.model;

/**
 * Liquidity tier of a currency. Drives derived pair attributes such as
 * minimum/maximum trade size and tick size.
 */
public enum CurrencyCategory {
    MAJOR,
    EMERGING,
    MINOR
}
