package com.fxplatform.common.validation;

/**
 * Result of scoring one observation against a pair's rolling history.
 * {@code scored} is false while the history is shorter than the minimum.
 */
public record AnomalyAssessment(
    double zScore,
    double anomalyScore,
    double mean,
    double stdDev,
    int historySize,
    boolean scored
) {

    static AnomalyAssessment insufficientHistory(int historySize) {
        return new AnomalyAssessment(0.0, 0.0, 0.0, 0.0, historySize, false);
    }
}
