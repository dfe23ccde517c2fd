package com.fxplatform.ingestion.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fxplatform.common.model.PairKey;
import com.fxplatform.common.model.RawQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parses one streaming frame. Only {@code {"type":"rate_update","data":{...}}} frames produce a
 * quote; anything else (heartbeats, subscription acks, garbage) yields empty.
 */
public final class StreamMessageParser {

    private static final Logger log = LoggerFactory.getLogger(StreamMessageParser.class);

    static final String RATE_UPDATE = "rate_update";

    private StreamMessageParser() {}

    public static Optional<RawQuote> parse(String provider, double reliability, String payload,
                                           ObjectMapper objectMapper, Instant now) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("STREAM_MESSAGE_MALFORMED provider={} error={}", provider, e.getOriginalMessage());
            return Optional.empty();
        }
        if (root == null || !RATE_UPDATE.equals(root.path("type").asText(null))) {
            return Optional.empty();
        }
        JsonNode data = root.path("data");
        if (!data.isObject()) {
            log.warn("STREAM_MESSAGE_MALFORMED provider={} reason=missing data", provider);
            return Optional.empty();
        }

        String symbol = data.hasNonNull("symbol") ? data.get("symbol").asText() : data.path("pair").asText(null);
        PairKey pair;
        try {
            pair = PairKey.parse(symbol);
        } catch (IllegalArgumentException e) {
            log.warn("STREAM_MESSAGE_MALFORMED provider={} reason={}", provider, e.getMessage());
            return Optional.empty();
        }

        Double rate = QuoteNormalizer.firstNumber(data, "rate", "price");
        Double bid  = QuoteNormalizer.number(data.get("bid"));
        Double ask  = QuoteNormalizer.number(data.get("ask"));
        Double spread = bid != null && ask != null ? ask - bid : null;

        // Streaming quotes are passed on as-is; validation rejects bad rates downstream.
        return Optional.of(new RawQuote(provider, pair, rate != null ? rate : Double.NaN, bid, ask, spread,
                                        timestamp(data.get("timestamp"), now), reliability, true));
    }

    static Instant timestamp(JsonNode node, Instant fallback) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            log.debug("Unparseable stream timestamp, using receive time. value={}", node.asText());
            return fallback;
        }
    }
}
