package com.fxplatform.common.validation;

import com.fxplatform.common.model.PairKey;

import java.time.Instant;

public record AnomalyEvent(
    PairKey pair,
    double rate,
    double zScore,
    double anomalyScore,
    double mean,
    double stdDev,
    Instant timestamp
) {}
