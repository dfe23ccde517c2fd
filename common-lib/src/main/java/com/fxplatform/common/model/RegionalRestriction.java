package com.fxplatform.common.model;

import java.util.Set;

public record RegionalRestriction(String region, Set<String> restrictedCurrencies, boolean requiresCompliance) {

    public RegionalRestriction {
        region               = region.toUpperCase();
        restrictedCurrencies = Set.copyOf(restrictedCurrencies);
    }

    public boolean restricts(String currency) {
        return restrictedCurrencies.contains(currency);
    }
}
