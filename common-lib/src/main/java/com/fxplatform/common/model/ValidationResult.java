package com.fxplatform.common.model;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of validating one consolidated rate or streaming tick.
 * {@code valid} depends on {@code errors} only; warnings flag but never reject.
 */
public record ValidationResult(
    PairKey pair,
    boolean valid,
    int qualityScore,
    double anomalyScore,
    List<String> warnings,
    List<String> errors,
    Instant validatedAt
) {

    public ValidationResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors   = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean flagged() {
        return !warnings.isEmpty();
    }
}
