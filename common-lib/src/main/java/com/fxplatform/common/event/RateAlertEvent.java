package com.fxplatform.common.event;

import com.fxplatform.common.model.PairKey;

import java.time.Instant;

public record RateAlertEvent(
    PairKey pair,
    double currentRate,
    double threshold,
    AlertDirection direction,
    long triggerCount,
    Instant timestamp
) {}
