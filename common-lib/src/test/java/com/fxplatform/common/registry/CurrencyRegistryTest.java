package com.fxplatform.common.registry;

import com.fxplatform.common.exception.CurrencyNotFoundException;
import com.fxplatform.common.exception.CurrencyValidationException;
import com.fxplatform.common.model.CurrencyCategory;
import com.fxplatform.common.model.CurrencyDefinition;
import com.fxplatform.common.model.CurrencyPair;
import com.fxplatform.common.model.RestrictionCheck;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CurrencyRegistryTest {

    private CurrencyRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CurrencyRegistry();
    }

    private static CurrencyDefinition sgd(int numericCode) {
        return new CurrencyDefinition("SGD", "Singapore Dollar", "S$", 2, numericCode, "cent",
                                      List.of("SG"), null, CurrencyCategory.MINOR, false);
    }

    // ── pairs ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("pair generation")
    class Pairs {

        @Test
        @DisplayName("every active ordered pair exists, 10 currencies → 90 pairs")
        void allOrderedPairs() {
            assertEquals(10, registry.getActiveCurrencies().size());
            assertEquals(90, registry.getAllCurrencyPairs().size());
        }

        @Test
        @DisplayName("every pair has its inverse")
        void pairSymmetry() {
            for (CurrencyPair pair : registry.getAllCurrencyPairs()) {
                assertTrue(registry.getCurrencyPair(pair.quote(), pair.base()).isPresent(),
                           "missing inverse of " + pair.symbol());
            }
        }

        @Test
        @DisplayName("USD/CAD settles T+1, others T+2")
        void settlementDays() {
            assertEquals(1, registry.getCurrencyPair("USD", "CAD").orElseThrow().settlementDays());
            assertEquals(1, registry.getCurrencyPair("CAD", "USD").orElseThrow().settlementDays());
            assertEquals(2, registry.getCurrencyPair("EUR", "GBP").orElseThrow().settlementDays());
        }

        @Test
        @DisplayName("JPY pairs use a 0.01 tick")
        void jpyTickSize() {
            assertEquals(0, new BigDecimal("0.01").compareTo(
                registry.getCurrencyPair("USD", "JPY").orElseThrow().tickSize()));
        }

        @Test
        @DisplayName("lookup is case-insensitive")
        void caseInsensitiveLookup() {
            assertTrue(registry.getCurrencyPair("usd", "eur").isPresent());
        }
    }

    // ── lifecycle ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("currency lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("deactivation removes the currency's pairs, reactivation recreates them")
        void deactivateThenReactivate() {
            assertTrue(registry.deactivateCurrency("SEK"));
            assertFalse(registry.isCurrencySupported("SEK"));
            assertTrue(registry.getCurrencyPair("USD", "SEK").isEmpty());
            assertTrue(registry.getCurrencyPair("SEK", "EUR").isEmpty());
            assertEquals(72, registry.getAllCurrencyPairs().size());

            assertTrue(registry.activateCurrency("SEK"));
            assertTrue(registry.getCurrencyPair("USD", "SEK").isPresent());
            assertTrue(registry.getCurrencyPair("SEK", "USD").isPresent());
            assertEquals(90, registry.getAllCurrencyPairs().size());
        }

        @Test
        @DisplayName("activating an already active currency returns false")
        void activateTwice() {
            assertFalse(registry.activateCurrency("EUR"));
        }

        @Test
        @DisplayName("removing the base currency always fails")
        void removeBase() {
            CurrencyValidationException e = assertThrows(CurrencyValidationException.class,
                () -> registry.removeCurrency("USD"));
            assertEquals("code", e.getField());
            assertEquals("Cannot remove base currency", e.getReason());
            assertTrue(registry.isCurrencySupported("USD"));
        }

        @Test
        @DisplayName("deactivating the base currency always fails")
        void deactivateBase() {
            assertThrows(CurrencyValidationException.class, () -> registry.deactivateCurrency("usd"));
            assertTrue(registry.isCurrencySupported("USD"));
        }

        @Test
        @DisplayName("removing an unknown currency → not found")
        void removeUnknown() {
            assertThrows(CurrencyNotFoundException.class, () -> registry.removeCurrency("XYZ"));
        }

        @Test
        @DisplayName("added currency is active and paired with every active currency")
        void addCurrency() {
            registry.addCurrency(sgd(702));

            assertTrue(registry.isCurrencySupported("SGD"));
            assertEquals(110, registry.getAllCurrencyPairs().size());
            assertTrue(registry.getCurrencyPair("SGD", "JPY").isPresent());
        }

        @Test
        @DisplayName("duplicate code is rejected")
        void addDuplicate() {
            CurrencyDefinition eur = registry.getCurrencyDefinition("EUR").orElseThrow();
            CurrencyValidationException e = assertThrows(CurrencyValidationException.class,
                () -> registry.addCurrency(eur));
            assertEquals("code", e.getField());
        }

        @Test
        @DisplayName("duplicate numeric code is rejected")
        void addDuplicateNumeric() {
            CurrencyValidationException e = assertThrows(CurrencyValidationException.class,
                () -> registry.addCurrency(sgd(840)));
            assertEquals("numericCode", e.getField());
        }

        @Test
        @DisplayName("missing name is rejected with the field name")
        void addMissingName() {
            CurrencyDefinition noName = new CurrencyDefinition("SGD", " ", "S$", 2, 702, "cent",
                                                               List.of(), null, null, false);
            CurrencyValidationException e = assertThrows(CurrencyValidationException.class,
                () -> registry.addCurrency(noName));
            assertEquals("name", e.getField());
            assertEquals("Missing required field: name", e.getReason());
        }

        @Test
        @DisplayName("listeners see every mutation, a failing listener does not break it")
        void listeners() {
            List<RegistryChangeEvent> seen = new ArrayList<>();
            registry.addListener(e -> { throw new IllegalStateException("boom"); });
            registry.addListener(seen::add);

            registry.deactivateCurrency("NZD");
            registry.activateCurrency("NZD");

            assertEquals(2, seen.size());
            assertEquals(RegistryChangeType.CURRENCY_DEACTIVATED, seen.get(0).type());
            assertEquals(RegistryChangeType.CURRENCY_ACTIVATED, seen.get(1).type());
            assertEquals("NZD", seen.get(1).currency());
        }
    }

    // ── amounts ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("amount validation")
    class Amounts {

        @Test
        @DisplayName("JPY accepts whole amounts only")
        void jpyPrecision() {
            assertDoesNotThrow(() -> registry.validateCurrencyAmount("100", "JPY"));
            CurrencyValidationException e = assertThrows(CurrencyValidationException.class,
                () -> registry.validateCurrencyAmount("100.5", "JPY"));
            assertEquals("Too many decimal places for JPY. Maximum: 0", e.getReason());
        }

        @Test
        @DisplayName("trailing zeros do not count as decimal places")
        void trailingZeros() {
            assertDoesNotThrow(() -> registry.validateCurrencyAmount("100.00", "JPY"));
        }

        @Test
        @DisplayName("non-numeric, negative, below min, above max")
        void bounds() {
            assertEquals("Amount must be a valid number", assertThrows(CurrencyValidationException.class,
                () -> registry.validateCurrencyAmount("abc", "USD")).getReason());
            assertEquals("Amount cannot be negative", assertThrows(CurrencyValidationException.class,
                () -> registry.validateCurrencyAmount("-5", "USD")).getReason());
            assertEquals("Amount below minimum: 0.01", assertThrows(CurrencyValidationException.class,
                () -> registry.validateCurrencyAmount("0.001", "USD")).getReason());
            assertEquals("Amount above maximum: 1000000", assertThrows(CurrencyValidationException.class,
                () -> registry.validateCurrencyAmount("1000000.01", "USD")).getReason());
        }

        @Test
        @DisplayName("inactive currency is rejected on the currency field")
        void inactiveCurrency() {
            registry.deactivateCurrency("CHF");
            CurrencyValidationException e = assertThrows(CurrencyValidationException.class,
                () -> registry.validateCurrencyAmount("10", "CHF"));
            assertEquals("currency", e.getField());
        }

        @Test
        @DisplayName("formatting rounds half-up to the currency's decimals")
        void format() {
            FormattedAmount jpy = registry.formatAmount(new BigDecimal("1234.5"), "JPY");
            assertEquals(0, new BigDecimal("1235").compareTo(jpy.amount()));
            assertTrue(jpy.formatted().endsWith("1235"));

            FormattedAmount usd = registry.formatAmount(new BigDecimal("10.005"), "USD");
            assertEquals("$10.01", usd.formatted());
        }
    }

    // ── restrictions ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("regional restrictions")
    class Restrictions {

        @Test
        @DisplayName("disabled by default → always allowed")
        void disabled() {
            assertTrue(registry.checkRegionalRestrictions("USD", "CN").allowed());
        }

        @Test
        @DisplayName("enabled → USD blocked in CN, EUR blocked in RU, unknown region allowed")
        void enabled() {
            CurrencyRegistry restricted = new CurrencyRegistry(new RegistrySettings("USD", null,
                new BigDecimal("0.01"), new BigDecimal("1000000"), true));

            RestrictionCheck cn = restricted.checkRegionalRestrictions("USD", "cn");
            assertFalse(cn.allowed());
            assertTrue(cn.requiresCompliance());
            assertEquals(1, cn.reasons().size());

            assertFalse(restricted.checkRegionalRestrictions("EUR", "RU").allowed());
            assertTrue(restricted.checkRegionalRestrictions("GBP", "RU").allowed());
            assertTrue(restricted.checkRegionalRestrictions("USD", "ZZ").allowed());
        }

        @Test
        @DisplayName("added restriction applies, removing it lifts it")
        void addAndRemove() {
            CurrencyRegistry restricted = new CurrencyRegistry(new RegistrySettings("USD", null,
                new BigDecimal("0.01"), new BigDecimal("1000000"), true));

            restricted.addRegionalRestriction("EU", "CNY", "sanctions review");
            assertFalse(restricted.checkRegionalRestrictions("CNY", "EU").allowed());

            assertTrue(restricted.removeRegionalRestriction("EU", "CNY"));
            assertTrue(restricted.checkRegionalRestrictions("CNY", "EU").allowed());
            assertFalse(restricted.removeRegionalRestriction("EU", "CNY"));
        }
    }

    // ── market hours and rounding ─────────────────────────────────────────────

    @Nested
    @DisplayName("market hours")
    class MarketHours {

        @Test
        @DisplayName("pair window is the intersection of both currencies' windows")
        void intersection() {
            assertTrue(registry.isMarketOpen("USD", "CNY", Instant.parse("2024-03-01T05:00:00Z")));
            assertFalse(registry.isMarketOpen("USD", "CNY", Instant.parse("2024-03-01T12:00:00Z")));
            assertTrue(registry.isMarketOpen("USD", "EUR", Instant.parse("2024-03-01T12:00:00Z")));
        }

        @Test
        @DisplayName("unknown pair is never open")
        void unknownPair() {
            assertFalse(registry.isMarketOpen("USD", "XYZ", Instant.parse("2024-03-01T05:00:00Z")));
        }
    }

    @Test
    @DisplayName("roundAmount rounds half up to the currency's decimal places")
    void rounding() {
        assertEquals(new BigDecimal("1235"), registry.roundAmount(new BigDecimal("1234.5"), "JPY"));
        assertEquals(new BigDecimal("1.01"), registry.roundAmount(new BigDecimal("1.005"), "USD"));
    }

    @Test
    @DisplayName("statistics and health reflect the active set")
    void statistics() {
        RegistryStatistics stats = registry.getStatistics();
        assertEquals("USD", stats.baseCurrency());
        assertEquals(10, stats.activeCurrencies());
        assertEquals(90, stats.activePairs());
        assertEquals("healthy", registry.healthStatus());
    }
}
