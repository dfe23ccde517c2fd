package com.fxplatform.common.registry;

import com.fxplatform.common.exception.CurrencyNotFoundException;
import com.fxplatform.common.exception.CurrencyValidationException;
import com.fxplatform.common.model.CurrencyCategory;
import com.fxplatform.common.model.CurrencyDefinition;
import com.fxplatform.common.model.CurrencyPair;
import com.fxplatform.common.model.RegionalRestriction;
import com.fxplatform.common.model.RestrictionCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Canonical catalog of currencies, the pairs derived from them and regional restrictions.
 *
 * <p>One instance is owned by the application context and injected wherever currency or pair
 * checks are needed. Mutators are {@code synchronized}; reads go straight to concurrent maps.
 *
 * <h3>Invariants</h3>
 * <ul>
 *   <li>The base currency is always active. Removing or deactivating it always fails.</li>
 *   <li>For every two distinct active currencies A and B both {@code A/B} and {@code B/A} exist.</li>
 *   <li>Every mutation notifies each registered {@link RegistryChangeListener}.</li>
 * </ul>
 */
public class CurrencyRegistry {

    private static final Logger log = LoggerFactory.getLogger(CurrencyRegistry.class);

    private static final BigDecimal ONE_MILLION = new BigDecimal("1000000");

    private final RegistrySettings settings;

    private final Map<String, CurrencyDefinition> definitions  = new ConcurrentHashMap<>();
    private final Map<String, CurrencyPair> pairs              = new ConcurrentHashMap<>();
    private final Map<String, RegionalRestriction> restrictions = new ConcurrentHashMap<>();
    private final List<RegistryChangeListener> listeners        = new CopyOnWriteArrayList<>();

    public CurrencyRegistry(RegistrySettings settings) {
        this.settings = settings;

        Set<String> supported = new HashSet<>(settings.supportedCurrencies());
        supported.add(settings.baseCurrency());
        for (CurrencyDefinition def : DefaultCurrencies.definitions()) {
            definitions.put(def.code(), def.withActive(supported.contains(def.code())));
        }
        if (!definitions.containsKey(settings.baseCurrency())) {
            throw new IllegalArgumentException("Base currency " + settings.baseCurrency() + " is not a known currency");
        }
        for (RegionalRestriction r : DefaultCurrencies.restrictions()) {
            restrictions.put(r.region(), r);
        }
        for (String code : activeCodes()) {
            addPairsFor(code);
        }
        log.info("REGISTRY_INIT base={} active={} pairs={}",
                 settings.baseCurrency(), activeCodes(), pairs.size());
    }

    public CurrencyRegistry() {
        this(RegistrySettings.defaults());
    }

    public void addListener(RegistryChangeListener listener) {
        listeners.add(listener);
    }

    public String getBaseCurrency() {
        return settings.baseCurrency();
    }

    // ── currency lifecycle ────────────────────────────────────────────────────

    public synchronized void addCurrency(CurrencyDefinition definition) {
        if (definition == null) {
            throw new CurrencyValidationException("definition", "Currency definition is required");
        }
        if (definition.code() != null && definitions.containsKey(definition.code())) {
            throw new CurrencyValidationException("code", "Currency " + definition.code() + " already exists");
        }
        validateCurrencyDefinition(definition);
        boolean numericTaken = definitions.values().stream()
            .anyMatch(d -> definition.numericCode().equals(d.numericCode()));
        if (numericTaken) {
            throw new CurrencyValidationException("numericCode",
                "Numeric code " + definition.numericCode() + " is already assigned");
        }

        definitions.put(definition.code(), definition.withActive(true));
        addPairsFor(definition.code());
        log.info("CURRENCY_ADDED code={} category={} pairs={}", definition.code(), definition.category(), pairs.size());
        notifyListeners(RegistryChangeEvent.of(RegistryChangeType.CURRENCY_ADDED, definition.code()));
    }

    /** Deactivates the currency and drops its pairs. The definition itself is retained. */
    public synchronized void removeCurrency(String currencyCode) {
        String code = normalize(currencyCode);
        CurrencyDefinition def = definitions.get(code);
        if (def == null) {
            throw new CurrencyNotFoundException(code);
        }
        if (code.equals(settings.baseCurrency())) {
            throw new CurrencyValidationException("code", "Cannot remove base currency");
        }
        definitions.put(code, def.withActive(false));
        removePairsFor(code);
        log.info("CURRENCY_REMOVED code={} pairs={}", code, pairs.size());
        notifyListeners(RegistryChangeEvent.of(RegistryChangeType.CURRENCY_REMOVED, code));
    }

    /**
     * @return {@code false} if the currency is already active
     */
    public synchronized boolean activateCurrency(String currencyCode) {
        String code = normalize(currencyCode);
        CurrencyDefinition def = definitions.get(code);
        if (def == null) {
            throw new CurrencyNotFoundException(code);
        }
        if (def.active()) {
            return false;
        }
        definitions.put(code, def.withActive(true));
        addPairsFor(code);
        log.info("CURRENCY_ACTIVATED code={} pairs={}", code, pairs.size());
        notifyListeners(RegistryChangeEvent.of(RegistryChangeType.CURRENCY_ACTIVATED, code));
        return true;
    }

    /**
     * @return {@code false} if the currency is unknown or already inactive
     */
    public synchronized boolean deactivateCurrency(String currencyCode) {
        String code = normalize(currencyCode);
        if (code.equals(settings.baseCurrency())) {
            throw new CurrencyValidationException("code", "Cannot deactivate base currency");
        }
        CurrencyDefinition def = definitions.get(code);
        if (def == null || !def.active()) {
            return false;
        }
        definitions.put(code, def.withActive(false));
        removePairsFor(code);
        log.info("CURRENCY_DEACTIVATED code={} pairs={}", code, pairs.size());
        notifyListeners(RegistryChangeEvent.of(RegistryChangeType.CURRENCY_DEACTIVATED, code));
        return true;
    }

    // ── lookups ───────────────────────────────────────────────────────────────

    public Optional<CurrencyDefinition> getCurrencyDefinition(String code) {
        if (code == null) return Optional.empty();
        return Optional.ofNullable(definitions.get(normalize(code)));
    }

    public List<CurrencyDefinition> getAllCurrencies() {
        return definitions.values().stream()
            .sorted((a, b) -> a.code().compareTo(b.code()))
            .toList();
    }

    public List<String> getActiveCurrencies() {
        return activeCodes();
    }

    public boolean isCurrencySupported(String code) {
        return getCurrencyDefinition(code).map(CurrencyDefinition::active).orElse(false);
    }

    public Optional<CurrencyPair> getCurrencyPair(String base, String quote) {
        if (base == null || quote == null) return Optional.empty();
        return Optional.ofNullable(pairs.get(normalize(base) + "/" + normalize(quote)));
    }

    public List<CurrencyPair> getAllCurrencyPairs() {
        return pairs.values().stream()
            .filter(CurrencyPair::active)
            .sorted((a, b) -> a.symbol().compareTo(b.symbol()))
            .toList();
    }

    // ── amounts ───────────────────────────────────────────────────────────────

    /**
     * Validates a raw amount string, rejecting anything that is not a number.
     */
    public void validateCurrencyAmount(String amount, String currencyCode) {
        if (amount == null || amount.isBlank()) {
            throw new CurrencyValidationException("amount", "Amount must be a valid number");
        }
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(amount.trim());
        } catch (NumberFormatException e) {
            throw new CurrencyValidationException("amount", "Amount must be a valid number");
        }
        validateCurrencyAmount(parsed, currencyCode);
    }

    public void validateCurrencyAmount(BigDecimal amount, String currencyCode) {
        CurrencyDefinition def = requireActive(currencyCode);
        if (amount == null) {
            throw new CurrencyValidationException("amount", "Amount must be a valid number");
        }
        if (amount.signum() < 0) {
            throw new CurrencyValidationException("amount", "Amount cannot be negative");
        }
        if (amount.compareTo(settings.minAmount()) < 0) {
            throw new CurrencyValidationException("amount", "Amount below minimum: " + settings.minAmount().toPlainString());
        }
        if (amount.compareTo(settings.maxAmount()) > 0) {
            throw new CurrencyValidationException("amount", "Amount above maximum: " + settings.maxAmount().toPlainString());
        }
        int scale = Math.max(0, amount.stripTrailingZeros().scale());
        if (scale > def.decimalPlaces()) {
            throw new CurrencyValidationException("amount",
                "Too many decimal places for " + def.code() + ". Maximum: " + def.decimalPlaces());
        }
    }

    public BigDecimal roundAmount(BigDecimal amount, String currencyCode) {
        CurrencyDefinition def = requireKnown(currencyCode);
        return amount.setScale(def.decimalPlaces(), RoundingMode.HALF_UP);
    }

    public FormattedAmount formatAmount(BigDecimal amount, String currencyCode) {
        CurrencyDefinition def = requireKnown(currencyCode);
        BigDecimal rounded = roundAmount(amount, def.code());
        return new FormattedAmount(rounded, def.symbol() + rounded.toPlainString(), def.code(), def.symbol());
    }

    // ── market hours ──────────────────────────────────────────────────────────

    public boolean isMarketOpen(String base, String quote, Instant at) {
        return getCurrencyPair(base, quote)
            .map(p -> p.tradingHours().isOpenAt(at))
            .orElse(false);
    }

    public boolean isMarketOpen(String base, String quote) {
        return isMarketOpen(base, quote, Instant.now());
    }

    // ── regional restrictions ─────────────────────────────────────────────────

    public RestrictionCheck checkRegionalRestrictions(String currencyCode, String region) {
        if (!settings.regionalRestrictionsEnabled() || region == null) {
            return RestrictionCheck.unrestricted();
        }
        RegionalRestriction restriction = restrictions.get(region.toUpperCase(Locale.ROOT));
        if (restriction == null) {
            return RestrictionCheck.unrestricted();
        }
        String code = normalize(currencyCode);
        boolean restricted = restriction.restricts(code);
        return new RestrictionCheck(
            !restricted,
            restriction.requiresCompliance(),
            restricted ? List.of("Currency " + code + " is restricted in region " + restriction.region()) : List.of()
        );
    }

    public synchronized void addRegionalRestriction(String region, String currencyCode, String reason) {
        String key  = region.toUpperCase(Locale.ROOT);
        String code = normalize(currencyCode);
        RegionalRestriction current = restrictions.getOrDefault(key, new RegionalRestriction(key, Set.of(), true));
        if (current.restricts(code)) {
            return;
        }
        Set<String> updated = new HashSet<>(current.restrictedCurrencies());
        updated.add(code);
        restrictions.put(key, new RegionalRestriction(key, updated, current.requiresCompliance()));
        log.info("RESTRICTION_ADDED region={} currency={} reason={}", key, code, reason);
        notifyListeners(new RegistryChangeEvent(RegistryChangeType.RESTRICTION_ADDED, code, key, reason, Instant.now()));
    }

    /**
     * @return {@code false} if no such restriction existed
     */
    public synchronized boolean removeRegionalRestriction(String region, String currencyCode) {
        String key  = region.toUpperCase(Locale.ROOT);
        String code = normalize(currencyCode);
        RegionalRestriction current = restrictions.get(key);
        if (current == null || !current.restricts(code)) {
            return false;
        }
        Set<String> updated = new HashSet<>(current.restrictedCurrencies());
        updated.remove(code);
        restrictions.put(key, new RegionalRestriction(key, updated, current.requiresCompliance()));
        log.info("RESTRICTION_REMOVED region={} currency={}", key, code);
        notifyListeners(new RegistryChangeEvent(RegistryChangeType.RESTRICTION_REMOVED, code, key, null, Instant.now()));
        return true;
    }

    public Map<String, RegionalRestriction> getRegionalRestrictions() {
        return Map.copyOf(restrictions);
    }

    // ── monitoring ────────────────────────────────────────────────────────────

    public RegistryStatistics getStatistics() {
        List<String> active = activeCodes();
        return new RegistryStatistics(definitions.size(), active.size(), getAllCurrencyPairs().size(),
            settings.baseCurrency(), active, settings.regionalRestrictionsEnabled(), restrictions.size());
    }

    /** {@code unhealthy} without an active base, {@code degraded} below two active currencies. */
    public String healthStatus() {
        if (!isCurrencySupported(settings.baseCurrency())) return "unhealthy";
        if (activeCodes().size() < 2) return "degraded";
        return "healthy";
    }

    // ── validation of definitions ─────────────────────────────────────────────

    static void validateCurrencyDefinition(CurrencyDefinition d) {
        requireField("code", d.code());
        requireField("name", d.name());
        requireField("symbol", d.symbol());
        if (d.decimalPlaces() == null) missing("decimalPlaces");
        if (d.numericCode() == null) missing("numericCode");

        if (d.code().length() != 3) {
            throw new CurrencyValidationException("code", "Currency code must be 3 characters");
        }
        if (d.decimalPlaces() < 0 || d.decimalPlaces() > 8) {
            throw new CurrencyValidationException("decimalPlaces", "Decimal places must be between 0 and 8");
        }
        if (d.numericCode() < 1 || d.numericCode() > 999) {
            throw new CurrencyValidationException("numericCode", "Numeric code must be between 1 and 999");
        }
    }

    private static void requireField(String field, String value) {
        if (value == null || value.isBlank()) missing(field);
    }

    private static void missing(String field) {
        throw new CurrencyValidationException(field, "Missing required field: " + field);
    }

    // ── pair generation ───────────────────────────────────────────────────────

    private void addPairsFor(String code) {
        for (String other : activeCodes()) {
            if (other.equals(code)) continue;
            putPair(code, other);
            putPair(other, code);
        }
    }

    private void removePairsFor(String code) {
        pairs.values().removeIf(p -> p.base().equals(code) || p.quote().equals(code));
    }

    private void putPair(String base, String quote) {
        CurrencyDefinition b = definitions.get(base);
        CurrencyDefinition q = definitions.get(quote);
        String symbol = base + "/" + quote;
        pairs.put(symbol, new CurrencyPair(base, quote, symbol,
            minTradeAmount(b, q), maxTradeAmount(b, q), tickSize(b, q),
            b.tradingHours().intersect(q.tradingHours()), settlementDays(base, quote), true));
    }

    static BigDecimal minTradeAmount(CurrencyDefinition b, CurrencyDefinition q) {
        if (bothMajor(b, q)) return new BigDecimal("1.00");
        if (anyEmerging(b, q)) return new BigDecimal("10.00");
        return new BigDecimal("5.00");
    }

    static BigDecimal maxTradeAmount(CurrencyDefinition b, CurrencyDefinition q) {
        if (bothMajor(b, q)) return BigDecimal.TEN.multiply(ONE_MILLION);
        if (anyEmerging(b, q)) return ONE_MILLION;
        return new BigDecimal("5").multiply(ONE_MILLION);
    }

    static BigDecimal tickSize(CurrencyDefinition b, CurrencyDefinition q) {
        if ("JPY".equals(b.code()) || "JPY".equals(q.code())) return new BigDecimal("0.01");
        if (bothMajor(b, q)) return new BigDecimal("0.0001");
        return new BigDecimal("0.00001");
    }

    static int settlementDays(String base, String quote) {
        boolean usdCad = ("USD".equals(base) && "CAD".equals(quote)) || ("CAD".equals(base) && "USD".equals(quote));
        return usdCad ? 1 : 2;
    }

    private static boolean bothMajor(CurrencyDefinition b, CurrencyDefinition q) {
        return b.category() == CurrencyCategory.MAJOR && q.category() == CurrencyCategory.MAJOR;
    }

    private static boolean anyEmerging(CurrencyDefinition b, CurrencyDefinition q) {
        return b.category() == CurrencyCategory.EMERGING || q.category() == CurrencyCategory.EMERGING;
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private List<String> activeCodes() {
        List<String> codes = new ArrayList<>();
        definitions.values().forEach(d -> { if (d.active()) codes.add(d.code()); });
        codes.sort(String::compareTo);
        return codes;
    }

    private CurrencyDefinition requireKnown(String currencyCode) {
        String code = normalize(currencyCode);
        CurrencyDefinition def = definitions.get(code);
        if (def == null) {
            throw new CurrencyNotFoundException(code);
        }
        return def;
    }

    private CurrencyDefinition requireActive(String currencyCode) {
        CurrencyDefinition def = requireKnown(currencyCode);
        if (!def.active()) {
            throw new CurrencyValidationException("currency", "Currency " + def.code() + " is not active");
        }
        return def;
    }

    private static String normalize(String code) {
        if (code == null) {
            throw new CurrencyValidationException("code", "Missing required field: code");
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }

    private void notifyListeners(RegistryChangeEvent event) {
        for (RegistryChangeListener listener : listeners) {
            try {
                listener.onChange(event);
            } catch (RuntimeException e) {
                log.warn("Registry listener failed. type={} currency={}", event.type(), event.currency(), e);
            }
        }
    }
}
