package com.fxplatform.common.validation;

import java.time.Instant;
import java.util.List;

/**
 * Triangular inconsistency across three currencies. Informational only.
 */
public record ArbitrageOpportunity(
    List<String> currencies,
    double rate12,
    double rate23,
    double rate31,
    double impliedRate,
    double deviation,
    double profitPotentialBps,
    Instant timestamp
) {}
