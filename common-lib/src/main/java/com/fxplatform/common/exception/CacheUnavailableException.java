package com.fxplatform.common.exception;

public class CacheUnavailableException extends RateEngineException {

    public CacheUnavailableException(String message, Throwable cause) {
        super("cache", message, cause);
    }
}
