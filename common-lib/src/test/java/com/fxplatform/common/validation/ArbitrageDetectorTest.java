package com.fxplatform.common.validation;

import com.fxplatform.common.model.ConsolidatedRate;
import com.fxplatform.common.model.PairKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArbitrageDetectorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final ArbitrageDetector detector = new ArbitrageDetector(0.001);

    private static ConsolidatedRate rate(String base, String quote, double value) {
        return new ConsolidatedRate(PairKey.of(base, quote), value, null, null, null, 0.0, 90, 3,
            List.of("fxapi"), value, value, 0.9, NOW, List.of(), false, null);
    }

    @Test
    @DisplayName("consistent triangle → nothing reported")
    void consistent() {
        List<ArbitrageOpportunity> found = detector.detect(List.of(
            rate("USD", "EUR", 0.9),
            rate("EUR", "GBP", 0.85),
            rate("GBP", "USD", 1.0 / (0.9 * 0.85))));

        assertTrue(found.isEmpty());
    }

    @Test
    @DisplayName("inconsistent triangle → one opportunity with its deviation in bps")
    void inconsistent() {
        List<ArbitrageOpportunity> found = detector.detect(List.of(
            rate("USD", "EUR", 0.9),
            rate("EUR", "GBP", 0.9),
            rate("GBP", "USD", 1.25)));

        assertEquals(1, found.size());
        ArbitrageOpportunity o = found.get(0);
        assertEquals(List.of("USD", "EUR", "GBP"), o.currencies());
        assertEquals(1.0125, o.impliedRate(), 1e-12);
        assertEquals(0.0125, o.deviation(), 1e-12);
        assertEquals(125.0, o.profitPotentialBps(), 1e-9);
    }

    @Test
    @DisplayName("missing leg is taken from the stored inverse")
    void inverseLeg() {
        List<ArbitrageOpportunity> found = detector.detect(List.of(
            rate("USD", "EUR", 0.9),
            rate("EUR", "GBP", 0.9),
            rate("USD", "GBP", 0.5)));

        assertEquals(1, found.size());
        assertEquals(2.0, found.get(0).rate31(), 1e-12);
        assertEquals(1.62, found.get(0).impliedRate(), 1e-12);
    }

    @Test
    @DisplayName("triple with a missing leg is skipped")
    void missingLeg() {
        assertTrue(detector.detect(List.of(
            rate("USD", "EUR", 0.9),
            rate("EUR", "GBP", 0.5))).isEmpty());
    }

    @Test
    void findPrefersDirect() {
        Map<PairKey, Double> byPair = Map.of(PairKey.of("USD", "EUR"), 0.9, PairKey.of("EUR", "USD"), 1.2);

        assertEquals(0.9, ArbitrageDetector.find(byPair, "USD", "EUR"));
        assertEquals(1.2, ArbitrageDetector.find(byPair, "EUR", "USD"));
        assertNull(ArbitrageDetector.find(byPair, "USD", "JPY"));
    }
}
