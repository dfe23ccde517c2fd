package com.fxplatform.common.exception;

/**
 * Registry rejection carrying the offending field and a human-readable reason,
 * e.g. {@code field=decimalPlaces reason="Decimal places must be between 0 and 8"}.
 */
public class CurrencyValidationException extends RateEngineException {
    private final String field;
    private final String reason;

    public CurrencyValidationException(String field, String reason) {
        super("registry", reason);
        this.field  = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
