package com.fxplatform.common.validation;

import com.fxplatform.common.model.ConsolidatedRate;
import com.fxplatform.common.model.PairKey;
import com.fxplatform.common.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Gatekeeper between consolidation and the cache. Validates consolidated rates and individual
 * streaming ticks, keeps the per-pair "last accepted" rate and the rolling anomaly history.
 *
 * <h3>Errors (rate rejected)</h3>
 * missing, non-finite, zero or negative rate; bid &ge; ask; non-positive bid or ask.
 *
 * <h3>Warnings (rate kept, flagged)</h3>
 * rate outside [1e-6, 1e6]; deviation from the last accepted rate above threshold; stale or missing
 * timestamp; consolidated quality below minimum; bid/ask spread above maximum; fewer providers than
 * minimum (consolidated rates only); anomaly score at or above the cutoff.
 *
 * <h3>Validation quality</h3>
 * <pre>
 *   100 − 30 × errors − 10 × warnings + (avgReliability − 0.5) × 20
 *   + 5 when younger than a minute, − min(20, age / 30s) when stale; clamped to [0, 100]
 * </pre>
 */
public class RateValidationEngine {

    private static final Logger log = LoggerFactory.getLogger(RateValidationEngine.class);

    private static final double MIN_TYPICAL_RATE = 0.000001;
    private static final double MAX_TYPICAL_RATE = 1_000_000;
    private static final Duration FRESH_WINDOW   = Duration.ofMinutes(1);

    private final ValidationSettings settings;
    private final AnomalyDetector anomalyDetector;
    private final ArbitrageDetector arbitrageDetector;
    private final Clock clock;

    private final Map<PairKey, Double> lastAccepted      = new ConcurrentHashMap<>();
    private final List<AnomalyListener> anomalyListeners = new CopyOnWriteArrayList<>();

    // ── statistics ────────────────────────────────────────────────────────────
    private final AtomicLong totalValidations  = new AtomicLong();
    private final AtomicLong passedValidations = new AtomicLong();
    private final AtomicLong failedValidations = new AtomicLong();
    private final AtomicLong anomaliesDetected = new AtomicLong();
    private final AtomicLong arbitrageCount    = new AtomicLong();
    private final AtomicLong cyclesValidated   = new AtomicLong();
    private final DoubleAdder cycleQualitySum  = new DoubleAdder();

    public RateValidationEngine(ValidationSettings settings, AnomalyDetector anomalyDetector,
                                ArbitrageDetector arbitrageDetector, Clock clock) {
        this.settings          = settings;
        this.anomalyDetector   = anomalyDetector;
        this.arbitrageDetector = arbitrageDetector;
        this.clock             = clock;
    }

    public RateValidationEngine(ValidationSettings settings) {
        this(settings,
             new AnomalyDetector(settings.anomalyWindowSize(), settings.anomalyMinHistory()),
             new ArbitrageDetector(settings.maxTriangularDeviation()),
             Clock.systemUTC());
    }

    public void addAnomalyListener(AnomalyListener listener) {
        anomalyListeners.add(listener);
    }

    // ── single rate ───────────────────────────────────────────────────────────

    public ValidationResult validateSingleRate(ConsolidatedRate rate) {
        PairKey pair = rate.pair();
        List<String> warnings = new ArrayList<>();
        List<String> errors   = new ArrayList<>();
        Instant now = clock.instant();
        double anomalyScore = 0.0;

        totalValidations.incrementAndGet();

        if (!checkBasics(rate, warnings, errors)) {
            failedValidations.incrementAndGet();
            return new ValidationResult(pair, false, score(rate, errors, warnings, now), 0.0, warnings, errors, now);
        }

        Double previous = lastAccepted.get(pair);
        if (previous != null && previous > 0.0) {
            double deviation = Math.abs(rate.rate() - previous) / previous;
            if (deviation > settings.maxRateDeviation()) {
                warnings.add(String.format("Rate deviation %.2f%% from last accepted rate exceeds threshold",
                                           deviation * 100));
            }
        }

        if (rate.timestamp() == null) {
            warnings.add("Missing timestamp");
        } else {
            Duration age = Duration.between(rate.timestamp(), now);
            if (age.compareTo(settings.staleDataThreshold()) > 0) {
                warnings.add("Stale data: " + age.toSeconds() + "s old");
            }
        }

        if (!rate.streaming() && rate.qualityScore() < settings.minQualityScore()) {
            warnings.add("Quality score " + rate.qualityScore() + " below minimum " + settings.minQualityScore());
        }

        if (rate.hasBidAsk()) {
            double spreadPercent = (rate.ask() - rate.bid()) / rate.rate() * 100;
            if (spreadPercent > settings.maxSpreadPercent()) {
                warnings.add(String.format("High spread: %.3f%%", spreadPercent));
            }
        }

        if (!rate.streaming() && rate.providerCount() < settings.minProviderCount()) {
            warnings.add("Insufficient providers: " + rate.providerCount());
        }

        AnomalyAssessment assessment = anomalyDetector.observe(pair, rate.rate());
        if (assessment.scored()) {
            anomalyScore = assessment.anomalyScore();
            if (anomalyScore >= settings.anomalyCutoff()) {
                warnings.add(String.format("Anomaly detected: z-score %.2f", assessment.zScore()));
                anomaliesDetected.incrementAndGet();
                notifyAnomaly(new AnomalyEvent(pair, rate.rate(), assessment.zScore(), anomalyScore,
                                               assessment.mean(), assessment.stdDev(), now));
            }
        }

        lastAccepted.put(pair, rate.rate());
        passedValidations.incrementAndGet();
        return new ValidationResult(pair, true, score(rate, errors, warnings, now), anomalyScore, warnings, errors, now);
    }

    private boolean checkBasics(ConsolidatedRate rate, List<String> warnings, List<String> errors) {
        double r = rate.rate();
        if (Double.isNaN(r) || Double.isInfinite(r)) {
            errors.add("Invalid or missing rate value");
            return false;
        }
        if (r <= 0.0) {
            errors.add("Rate must be positive");
            return false;
        }
        if (r < MIN_TYPICAL_RATE || r > MAX_TYPICAL_RATE) {
            warnings.add("Rate value is outside typical range");
        }
        if (rate.hasBidAsk()) {
            if (rate.bid() <= 0.0 || rate.ask() <= 0.0) {
                errors.add("Bid and ask rates must be positive");
                return false;
            }
            if (rate.bid() >= rate.ask()) {
                errors.add("Bid rate must be less than ask rate");
                return false;
            }
        }
        return true;
    }

    private int score(ConsolidatedRate rate, List<String> errors, List<String> warnings, Instant now) {
        double score = 100.0 - errors.size() * 30.0 - warnings.size() * 10.0;
        if (rate.avgReliability() > 0.0) {
            score += (rate.avgReliability() - 0.5) * 20;
        }
        if (rate.timestamp() != null) {
            Duration age = Duration.between(rate.timestamp(), now);
            if (age.compareTo(FRESH_WINDOW) < 0) {
                score += 5;
            } else if (age.compareTo(settings.staleDataThreshold()) > 0) {
                score -= Math.min(20.0, age.toMillis() / 30_000.0);
            }
        }
        return (int) Math.round(Math.max(0.0, Math.min(100.0, score)));
    }

    // ── full cycle ────────────────────────────────────────────────────────────

    /**
     * Validates every rate of one cycle, then checks pair/inverse consistency and triangular
     * arbitrage across the accepted ones.
     */
    public CycleValidationReport validateCycle(Collection<ConsolidatedRate> rates) {
        Map<PairKey, ValidationResult> results = new LinkedHashMap<>();
        List<ConsolidatedRate> accepted = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> errors   = new ArrayList<>();

        for (ConsolidatedRate rate : rates) {
            ValidationResult result = validateSingleRate(rate);
            results.put(rate.pair(), result);
            result.warnings().forEach(w -> warnings.add(rate.pair() + ": " + w));
            result.errors().forEach(e -> errors.add(rate.pair() + ": " + e));
            if (result.valid()) {
                accepted.add(rate);
            }
        }

        List<RateInconsistency> inconsistencies = checkConsistency(accepted);
        inconsistencies.forEach(i -> warnings.add(String.format("%s: inverse disagreement %.4f%%",
                                                                i.pair(), i.deviation() * 100)));

        List<ArbitrageOpportunity> opportunities = arbitrageDetector.detect(accepted);
        arbitrageCount.addAndGet(opportunities.size());

        int overall = overallQuality(results, inconsistencies);
        cyclesValidated.incrementAndGet();
        cycleQualitySum.add(overall);

        if (!opportunities.isEmpty()) {
            log.info("ARBITRAGE_DETECTED count={} maxDeviationBps={}", opportunities.size(),
                     opportunities.stream().mapToDouble(ArbitrageOpportunity::profitPotentialBps).max().orElse(0));
        }
        return new CycleValidationReport(results, opportunities, inconsistencies, overall,
                                         errors.isEmpty(), warnings, errors);
    }

    private List<RateInconsistency> checkConsistency(List<ConsolidatedRate> rates) {
        Map<PairKey, Double> byPair = new LinkedHashMap<>();
        rates.forEach(r -> byPair.put(r.pair(), r.rate()));

        List<RateInconsistency> found = new ArrayList<>();
        Set<PairKey> seen = new HashSet<>();
        for (Map.Entry<PairKey, Double> e : byPair.entrySet()) {
            PairKey inverse = e.getKey().inverse();
            Double inverseRate = byPair.get(inverse);
            if (inverseRate == null || seen.contains(inverse)) continue;
            seen.add(e.getKey());
            double implied   = 1.0 / inverseRate;
            double deviation = Math.abs(e.getValue() - implied) / e.getValue();
            if (deviation > settings.consistencyTolerance()) {
                found.add(new RateInconsistency(e.getKey(), e.getValue(), implied, deviation));
            }
        }
        return found;
    }

    private int overallQuality(Map<PairKey, ValidationResult> results, List<RateInconsistency> inconsistencies) {
        if (results.isEmpty()) return 0;
        double avg = results.values().stream().mapToInt(ValidationResult::qualityScore).average().orElse(0);
        double overall = avg - inconsistencies.size() * 10.0;
        return (int) Math.round(Math.max(0.0, Math.min(100.0, overall)));
    }

    // ── admin / monitoring ────────────────────────────────────────────────────

    public ValidationStats getValidationStats() {
        long cycles = cyclesValidated.get();
        return new ValidationStats(
            totalValidations.get(), passedValidations.get(), failedValidations.get(),
            anomaliesDetected.get(), arbitrageCount.get(), cycles,
            cycles == 0 ? 0.0 : cycleQualitySum.sum() / cycles,
            anomalyDetector.trackedPairs());
    }

    public Double lastAcceptedRate(PairKey pair) {
        return lastAccepted.get(pair);
    }

    public void clearHistory(PairKey pair) {
        if (pair == null) {
            anomalyDetector.clearAll();
            lastAccepted.clear();
        } else {
            anomalyDetector.clear(pair);
            lastAccepted.remove(pair);
        }
        log.info("VALIDATION_HISTORY_CLEARED pair={}", pair == null ? "ALL" : pair);
    }

    public ValidationSettings settings() {
        return settings;
    }

    private void notifyAnomaly(AnomalyEvent event) {
        log.warn("ANOMALY_DETECTED pair={} rate={} zScore={} mean={}",
                 event.pair(), event.rate(), String.format("%.2f", event.zScore()), event.mean());
        for (AnomalyListener listener : anomalyListeners) {
            try {
                listener.anomalyDetected(event);
            } catch (RuntimeException e) {
                log.warn("Anomaly listener failed. pair={}", event.pair(), e);
            }
        }
    }
}
