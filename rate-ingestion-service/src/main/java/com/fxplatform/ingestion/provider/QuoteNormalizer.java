package com.fxplatform.ingestion.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fxplatform.common.model.PairKey;
import com.fxplatform.common.model.RawQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a provider's {@code rates} object into {@link RawQuote}s.
 *
 * <p>Each entry is either a bare number (the rate) or an object carrying {@code rate} (falling
 * back to {@code mid}, then {@code price}) and optionally {@code bid}, {@code ask} and
 * {@code spread}. A missing spread is derived from bid/ask; a missing rate is their midpoint.
 * Entries that end up without a finite positive rate are skipped and logged.
 */
public final class QuoteNormalizer {

    private static final Logger log = LoggerFactory.getLogger(QuoteNormalizer.class);

    private QuoteNormalizer() {}

    public static List<RawQuote> normalizeRates(String provider, double reliability, String baseCurrency,
                                                JsonNode rates, Collection<String> targets, Instant timestamp) {
        List<RawQuote> quotes = new ArrayList<>();
        if (rates == null || !rates.isObject()) {
            return quotes;
        }
        String base = baseCurrency.toUpperCase(Locale.ROOT);
        Set<String> wanted = targets.stream()
            .map(t -> t.toUpperCase(Locale.ROOT))
            .collect(Collectors.toSet());

        Iterator<Map.Entry<String, JsonNode>> fields = rates.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String currency = entry.getKey().toUpperCase(Locale.ROOT);
            if (currency.equals(base) || !wanted.contains(currency)) {
                continue;
            }
            normalize(provider, reliability, PairKey.of(base, currency), entry.getValue(), timestamp, false)
                .ifPresent(quotes::add);
        }
        return quotes;
    }

    public static Optional<RawQuote> normalize(String provider, double reliability, PairKey pair,
                                               JsonNode value, Instant timestamp, boolean streaming) {
        Double rate;
        Double bid    = null;
        Double ask    = null;
        Double spread = null;

        if (value == null || value.isNull() || value.isMissingNode()) {
            rate = null;
        } else if (value.isObject()) {
            rate   = firstNumber(value, "rate", "mid", "price");
            bid    = number(value.get("bid"));
            ask    = number(value.get("ask"));
            spread = number(value.get("spread"));
        } else {
            rate = number(value);
        }

        if (spread == null && bid != null && ask != null) {
            spread = ask - bid;
        }
        if (rate == null && bid != null && ask != null) {
            rate = (bid + ask) / 2;
        }
        if (rate == null || !Double.isFinite(rate) || rate <= 0) {
            log.warn("QUOTE_DISCARDED provider={} pair={} value={}", provider, pair, value);
            return Optional.empty();
        }
        return Optional.of(new RawQuote(provider, pair, rate, bid, ask, spread, timestamp, reliability, streaming));
    }

    static Double firstNumber(JsonNode node, String... fields) {
        for (String field : fields) {
            Double n = number(node.get(field));
            if (n != null) {
                return n;
            }
        }
        return null;
    }

    static Double number(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                log.debug("Non-numeric value ignored. value={}", node.asText());
                return null;
            }
        }
        return null;
    }
}
