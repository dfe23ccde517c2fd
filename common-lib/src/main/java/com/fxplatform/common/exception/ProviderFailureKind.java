package com.fxplatform.common.exception;

public enum ProviderFailureKind {
    TIMEOUT,
    AUTHENTICATION,
    RATE_LIMITED,
    SERVER_ERROR,
    MALFORMED_RESPONSE,
    MISSING_CREDENTIAL,
    API_ERROR,
    CONNECTION,
    UNKNOWN
}
