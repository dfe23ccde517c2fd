package com.fxplatform.common.registry;

import java.time.Instant;

/**
 * Emitted by every {@link CurrencyRegistry} mutator. {@code region} and {@code reason}
 * are only populated for restriction changes.
 */
public record RegistryChangeEvent(
    RegistryChangeType type,
    String currency,
    String region,
    String reason,
    Instant timestamp
) {

    public static RegistryChangeEvent of(RegistryChangeType type, String currency) {
        return new RegistryChangeEvent(type, currency, null, null, Instant.now());
    }
}
