package com.fxplatform.common.exception;

public class CurrencyNotFoundException extends RateEngineException {
    private final String code;

    public CurrencyNotFoundException(String code) {
        super("registry", "Currency " + code + " not found");
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
