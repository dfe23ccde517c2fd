package com.fxplatform.common.validation;

import java.time.Duration;

/**
 * Thresholds for {@link RateValidationEngine}, {@link AnomalyDetector} and {@link ArbitrageDetector}.
 *
 * @param maxRateDeviation       fraction of the last accepted rate above which a warning is raised
 * @param minQualityScore        consolidated quality below this is flagged
 * @param staleDataThreshold     age beyond which a rate is flagged stale
 * @param maxSpreadPercent       bid/ask spread, in percent of rate, above which a warning is raised
 * @param minProviderCount       consolidated rates backed by fewer providers are flagged
 * @param anomalyWindowSize      rolling history length per pair
 * @param anomalyMinHistory      observations required before an anomaly score is computed
 * @param anomalyCutoff          anomaly score (0..1) at which {@code anomalyDetected} fires
 * @param maxTriangularDeviation {@code |A/B × B/C × C/A − 1|} tolerated before an opportunity is reported
 * @param consistencyTolerance   tolerated disagreement between a pair and its stored inverse
 */
public record ValidationSettings(
    double maxRateDeviation,
    int minQualityScore,
    Duration staleDataThreshold,
    double maxSpreadPercent,
    int minProviderCount,
    int anomalyWindowSize,
    int anomalyMinHistory,
    double anomalyCutoff,
    double maxTriangularDeviation,
    double consistencyTolerance
) {

    public static ValidationSettings defaults() {
        return new ValidationSettings(0.10, 70, Duration.ofMinutes(5), 5.0, 2,
                                      100, 10, 1.0, 0.001, 0.001);
    }
}
