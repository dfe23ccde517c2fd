package com.fxplatform.common.validation;

import com.fxplatform.common.model.PairKey;
import com.fxplatform.common.model.ValidationResult;

import java.util.List;
import java.util.Map;

/**
 * Full validation pass over one cycle's consolidated rates.
 * {@code valid} is false when any rate carries an error; inconsistencies and arbitrage only flag.
 */
public record CycleValidationReport(
    Map<PairKey, ValidationResult> results,
    List<ArbitrageOpportunity> arbitrageOpportunities,
    List<RateInconsistency> inconsistencies,
    int overallQualityScore,
    boolean valid,
    List<String> warnings,
    List<String> errors
) {

    public boolean isAccepted(PairKey pair) {
        ValidationResult r = results.get(pair);
        return r != null && r.valid();
    }
}
