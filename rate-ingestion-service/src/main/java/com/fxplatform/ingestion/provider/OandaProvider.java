package com.fxplatform.ingestion.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fxplatform.common.exception.ProviderException;
import com.fxplatform.common.exception.ProviderFailureKind;
import com.fxplatform.common.model.RawQuote;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * OANDA v3 {@code /pricing}. Instruments are {@code BASE_QUOTE}; only prices whose base matches
 * the requested base are kept. Rate is the mid of the top bid and ask.
 */
public class OandaProvider extends AbstractStreamingRateProvider {

    public static final String NAME = "oanda";
    public static final double RELIABILITY = 0.92;
    public static final String DEFAULT_BASE_URL = "https://api-fxtrade.oanda.com/v3";
    public static final String DEFAULT_STREAM_URL = "wss://stream-fxtrade.oanda.com/v3/pricing/stream";

    public OandaProvider(ProviderSettings settings, WebClient webClient, ObjectMapper objectMapper,
                         Clock clock, WebSocketClient webSocketClient) {
        super(settings, webClient, objectMapper, clock, webSocketClient);
    }

    @Override
    protected Mono<List<RawQuote>> doFetch(String baseCurrency, List<String> targets) {
        String instruments = targets.stream()
            .map(t -> baseCurrency + "_" + t.toUpperCase())
            .collect(Collectors.joining(","));
        return getJson(uri -> uri.path("/pricing")
                .queryParam("instruments", instruments)
                .build(), bearerAuth())
            .map(root -> normalize(baseCurrency, toRates(baseCurrency, requireField(root, "prices")), targets));
    }

    ObjectNode toRates(String baseCurrency, JsonNode prices) {
        if (!prices.isArray()) {
            throw new ProviderException(name(), ProviderFailureKind.MALFORMED_RESPONSE, "prices is not an array");
        }
        ObjectNode rates = objectMapper.createObjectNode();
        for (JsonNode price : prices) {
            String[] instrument = price.path("instrument").asText("").split("_");
            if (instrument.length != 2 || !instrument[0].equalsIgnoreCase(baseCurrency)) {
                continue;
            }
            Double bid = QuoteNormalizer.number(price.path("bids").path(0).get("price"));
            Double ask = QuoteNormalizer.number(price.path("asks").path(0).get("price"));
            if (bid == null || ask == null) {
                log.warn("QUOTE_DISCARDED provider={} instrument={} reason=missing bid/ask", name(),
                         price.path("instrument").asText());
                continue;
            }
            ObjectNode entry = rates.putObject(instrument[1]);
            entry.put("rate",   (bid + ask) / 2);
            entry.put("bid",    bid);
            entry.put("ask",    ask);
            entry.put("spread", ask - bid);
        }
        return rates;
    }
}
