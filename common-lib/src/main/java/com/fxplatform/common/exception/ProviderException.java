package com.fxplatform.common.exception;

/**
 * Recoverable failure of a single rate provider. Drops that provider's quotes for the
 * current cycle; never affects other providers.
 */
public class ProviderException extends RateEngineException {
    private final ProviderFailureKind kind;

    public ProviderException(String provider, ProviderFailureKind kind, String message) {
        super(provider, message);
        this.kind = kind;
    }

    public ProviderException(String provider, ProviderFailureKind kind, String message, Throwable cause) {
        super(provider, message, cause);
        this.kind = kind;
    }

    public String getProvider() {
        return getComponent();
    }

    public ProviderFailureKind getKind() {
        return kind;
    }
}
