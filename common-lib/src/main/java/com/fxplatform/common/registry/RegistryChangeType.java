package com.fxplatform.common.registry;

public enum RegistryChangeType {
    CURRENCY_ADDED,
    CURRENCY_REMOVED,
    CURRENCY_ACTIVATED,
    CURRENCY_DEACTIVATED,
    RESTRICTION_ADDED,
    RESTRICTION_REMOVED
}
