package com.fxplatform.common.validation;

import com.fxplatform.common.model.PairKey;

/**
 * A pair reported in both directions within one cycle whose rates disagree:
 * {@code directRate} vs {@code 1 / inverseRate}.
 */
public record RateInconsistency(PairKey pair, double directRate, double impliedRate, double deviation) {}
