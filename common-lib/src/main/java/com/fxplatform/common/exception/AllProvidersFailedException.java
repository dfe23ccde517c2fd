package com.fxplatform.common.exception;

public class AllProvidersFailedException extends RateEngineException {
    private final int attempted;

    public AllProvidersFailedException(int attempted) {
        super("ingestion", "All " + attempted + " providers failed in this cycle");
        this.attempted = attempted;
    }

    public int getAttempted() {
        return attempted;
    }
}
