package com.fxplatform.common.registry;

import java.util.List;

public record RegistryStatistics(
    int totalCurrencies,
    int activeCurrencies,
    int activePairs,
    String baseCurrency,
    List<String> supportedCurrencies,
    boolean restrictionsEnabled,
    int regionsConfigured
) {}
