package com.fxplatform.common.exception;

public class RateEngineException extends RuntimeException {
    private final String component;

    public RateEngineException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public RateEngineException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
