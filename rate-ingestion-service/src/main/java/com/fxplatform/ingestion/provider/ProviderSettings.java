package com.fxplatform.ingestion.provider;

import java.time.Duration;

/**
 * Static configuration of one rate source. {@code apiKey} is injected from configuration and may
 * be blank, in which case providers that need it fail every fetch with a credential error.
 */
public record ProviderSettings(
    String name,
    String baseUrl,
    String streamUrl,
    String apiKey,
    double reliability,
    Duration timeout
) {

    public boolean hasCredential() {
        return apiKey != null && !apiKey.isBlank();
    }

    public boolean hasStreamUrl() {
        return streamUrl != null && !streamUrl.isBlank();
    }

    @Override
    public String toString() {
        return "ProviderSettings[name=" + name + ", baseUrl=" + baseUrl + ", streamUrl=" + streamUrl
            + ", apiKey=" + (hasCredential() ? "***" : "<none>") + ", reliability=" + reliability
            + ", timeout=" + timeout + "]";
    }
}
