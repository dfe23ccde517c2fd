package com.fxplatform.common.validation;

import com.fxplatform.common.model.ConsolidatedRate;
import com.fxplatform.common.model.PairKey;
import com.fxplatform.common.model.RawQuote;
import com.fxplatform.common.model.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Error and warning rules of {@link RateValidationEngine}, plus the cycle-level consistency
 * and arbitrage checks.
 *
 * <p>A fixed clock keeps the staleness checks deterministic.
 */
class RateValidationEngineTest {

    private static final Instant NOW     = Instant.parse("2024-03-01T12:00:00Z");
    private static final PairKey USD_EUR = PairKey.of("USD", "EUR");

    private RateValidationEngine engine;
    private List<AnomalyEvent> anomalies;

    @BeforeEach
    void setUp() {
        ValidationSettings settings = ValidationSettings.defaults();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        engine = new RateValidationEngine(settings,
            new AnomalyDetector(settings.anomalyWindowSize(), settings.anomalyMinHistory()),
            new ArbitrageDetector(settings.maxTriangularDeviation(), clock),
            clock);
        anomalies = new ArrayList<>();
        engine.addAnomalyListener(anomalies::add);
    }

    private static ConsolidatedRate rate(PairKey pair, double value, Double bid, Double ask,
                                         int quality, int providers, Instant at) {
        return new ConsolidatedRate(pair, value, bid, ask, null, 0.1, quality, providers,
            List.of("fxapi", "bloomberg", "oanda"), value, value, 0.95, at, List.of(), false, null);
    }

    private static ConsolidatedRate good(PairKey pair, double value) {
        return rate(pair, value, null, null, 95, 3, NOW);
    }

    // ── errors ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("errors reject the rate")
    class Errors {

        @Test
        void negativeRate() {
            ValidationResult r = engine.validateSingleRate(good(USD_EUR, -0.9));

            assertFalse(r.valid());
            assertEquals(List.of("Rate must be positive"), r.errors());
        }

        @Test
        void zeroRate() {
            assertEquals(List.of("Rate must be positive"),
                         engine.validateSingleRate(good(USD_EUR, 0.0)).errors());
        }

        @Test
        void nanRate() {
            assertEquals(List.of("Invalid or missing rate value"),
                         engine.validateSingleRate(good(USD_EUR, Double.NaN)).errors());
        }

        @Test
        @DisplayName("bid ≥ ask")
        void crossedBook() {
            ValidationResult r = engine.validateSingleRate(rate(USD_EUR, 0.92, 0.93, 0.91, 95, 3, NOW));

            assertFalse(r.valid());
            assertEquals(List.of("Bid rate must be less than ask rate"), r.errors());
        }

        @Test
        void nonPositiveBid() {
            assertEquals(List.of("Bid and ask rates must be positive"),
                         engine.validateSingleRate(rate(USD_EUR, 0.92, 0.0, 0.93, 95, 3, NOW)).errors());
        }

        @Test
        @DisplayName("rejected rate does not become the last accepted rate")
        void rejectedNotRemembered() {
            engine.validateSingleRate(good(USD_EUR, -1.0));

            assertNull(engine.lastAcceptedRate(USD_EUR));
            assertEquals(1, engine.getValidationStats().failedValidations());
        }
    }

    // ── warnings ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("warnings flag but keep the rate")
    class Warnings {

        @Test
        @DisplayName("clean rate → valid, no warnings, high score")
        void clean() {
            ValidationResult r = engine.validateSingleRate(rate(USD_EUR, 0.92, 0.9199, 0.9201, 95, 3, NOW));

            assertTrue(r.valid());
            assertTrue(r.warnings().isEmpty());
            assertEquals(100, r.qualityScore());
            assertEquals(0.92, engine.lastAcceptedRate(USD_EUR));
        }

        @Test
        @DisplayName("deviation from the last accepted rate")
        void deviation() {
            engine.validateSingleRate(good(USD_EUR, 1.0));
            ValidationResult r = engine.validateSingleRate(good(USD_EUR, 1.2));

            assertTrue(r.valid());
            assertTrue(r.warnings().stream().anyMatch(w -> w.startsWith("Rate deviation 20.00%")));
        }

        @Test
        @DisplayName("stale timestamp")
        void stale() {
            ValidationResult r = engine.validateSingleRate(
                rate(USD_EUR, 0.92, null, null, 95, 3, NOW.minus(Duration.ofMinutes(10))));

            assertTrue(r.valid());
            assertEquals(List.of("Stale data: 600s old"), r.warnings());
        }

        @Test
        @DisplayName("low quality and too few providers")
        void lowQualityFewProviders() {
            ValidationResult r = engine.validateSingleRate(rate(USD_EUR, 0.92, null, null, 60, 1, NOW));

            assertTrue(r.valid());
            assertEquals(List.of("Quality score 60 below minimum 70", "Insufficient providers: 1"), r.warnings());
        }

        @Test
        @DisplayName("streaming ticks skip the quality and provider-count checks")
        void streamingSkipsConsolidatedChecks() {
            RawQuote tick = new RawQuote("oanda", USD_EUR, 0.92, null, null, null, NOW, 0.96, true);
            ValidationResult r = engine.validateSingleRate(ConsolidatedRate.fromStreamingQuote(tick, 0));

            assertTrue(r.valid());
            assertTrue(r.warnings().isEmpty());
        }

        @Test
        @DisplayName("wide bid/ask spread")
        void highSpread() {
            ValidationResult r = engine.validateSingleRate(rate(USD_EUR, 1.0, 0.95, 1.05, 95, 3, NOW));

            assertEquals(List.of("High spread: 10.000%"), r.warnings());
        }

        @Test
        @DisplayName("anomalous rate after a flat history notifies listeners")
        void anomaly() {
            for (int i = 0; i < 10; i++) {
                assertTrue(engine.validateSingleRate(good(USD_EUR, 1.0)).warnings().isEmpty());
            }

            ValidationResult r = engine.validateSingleRate(good(USD_EUR, 1.5));

            assertTrue(r.valid());
            assertEquals(1.0, r.anomalyScore());
            assertTrue(r.warnings().stream().anyMatch(w -> w.startsWith("Anomaly detected")));
            assertEquals(1, anomalies.size());
            assertEquals(USD_EUR, anomalies.get(0).pair());
            assertEquals(1.0, anomalies.get(0).mean(), 1e-12);
        }

        @Test
        @DisplayName("a failing anomaly listener does not break validation")
        void failingListener() {
            engine.addAnomalyListener(e -> { throw new IllegalStateException("boom"); });
            for (int i = 0; i < 10; i++) engine.validateSingleRate(good(USD_EUR, 1.0));

            assertTrue(engine.validateSingleRate(good(USD_EUR, 2.0)).valid());
            assertEquals(1, anomalies.size());
        }
    }

    // ── cycle ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("validateCycle")
    class Cycle {

        @Test
        @DisplayName("only valid rates are accepted, errors make the report invalid")
        void acceptance() {
            PairKey usdGbp = PairKey.of("USD", "GBP");
            CycleValidationReport report = engine.validateCycle(List.of(
                good(USD_EUR, 0.92), good(usdGbp, -1.0)));

            assertTrue(report.isAccepted(USD_EUR));
            assertFalse(report.isAccepted(usdGbp));
            assertFalse(report.valid());
            assertEquals(List.of("USD/GBP: Rate must be positive"), report.errors());
        }

        @Test
        @DisplayName("pair and inverse disagreeing → one inconsistency")
        void inverseDisagreement() {
            CycleValidationReport report = engine.validateCycle(List.of(
                good(USD_EUR, 0.9), good(USD_EUR.inverse(), 1.2)));

            assertEquals(1, report.inconsistencies().size());
            RateInconsistency i = report.inconsistencies().get(0);
            assertEquals(USD_EUR, i.pair());
            assertEquals(1.0 / 1.2, i.impliedRate(), 1e-12);
            assertTrue(report.valid());
        }

        @Test
        @DisplayName("triangular inconsistency is reported, rates stay accepted")
        void arbitrage() {
            PairKey eurGbp = PairKey.of("EUR", "GBP");
            PairKey usdGbp = PairKey.of("USD", "GBP");
            CycleValidationReport report = engine.validateCycle(List.of(
                good(USD_EUR, 0.9), good(eurGbp, 0.9), good(usdGbp, 0.5)));

            assertEquals(1, report.arbitrageOpportunities().size());
            assertTrue(report.isAccepted(usdGbp));
            assertEquals(1, engine.getValidationStats().arbitrageOpportunities());
            assertEquals(1, engine.getValidationStats().cyclesValidated());
        }
    }

    @Test
    @DisplayName("clearHistory forgets last accepted rates")
    void clearHistory() {
        engine.validateSingleRate(good(USD_EUR, 1.0));
        engine.clearHistory(null);

        assertNull(engine.lastAcceptedRate(USD_EUR));
        assertTrue(engine.validateSingleRate(good(USD_EUR, 2.0)).warnings().isEmpty());
    }
}
