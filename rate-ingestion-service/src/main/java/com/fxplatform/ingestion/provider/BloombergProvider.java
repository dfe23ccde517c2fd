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

/**
 * Bloomberg {@code /rates} with bid/ask. Response is a {@code data} array of
 * {@code {quote_currency, mid_rate, bid_rate, ask_rate, spread}} items.
 */
public class BloombergProvider extends AbstractStreamingRateProvider {

    public static final String NAME = "bloomberg";
    public static final double RELIABILITY = 0.99;
    public static final String DEFAULT_BASE_URL = "https://api.bloomberg.com/fx/v1";
    public static final String DEFAULT_STREAM_URL = "wss://stream.bloomberg.com/fx";

    public BloombergProvider(ProviderSettings settings, WebClient webClient, ObjectMapper objectMapper,
                             Clock clock, WebSocketClient webSocketClient) {
        super(settings, webClient, objectMapper, clock, webSocketClient);
    }

    @Override
    protected Mono<List<RawQuote>> doFetch(String baseCurrency, List<String> targets) {
        return getJson(uri -> uri.path("/rates")
                .queryParam("base_currency", baseCurrency)
                .queryParam("quote_currencies", joined(targets))
                .queryParam("include_bid_ask", true)
                .build(), bearerAuth())
            .map(root -> normalize(baseCurrency, toRates(requireField(root, "data")), targets));
    }

    ObjectNode toRates(JsonNode data) {
        if (!data.isArray()) {
            throw new ProviderException(name(), ProviderFailureKind.MALFORMED_RESPONSE, "data is not an array");
        }
        ObjectNode rates = objectMapper.createObjectNode();
        for (JsonNode item : data) {
            String quote = item.path("quote_currency").asText(null);
            if (quote == null) {
                log.warn("QUOTE_DISCARDED provider={} reason=missing quote_currency", name());
                continue;
            }
            ObjectNode entry = rates.putObject(quote);
            entry.set("rate",   item.get("mid_rate"));
            entry.set("bid",    item.get("bid_rate"));
            entry.set("ask",    item.get("ask_rate"));
            entry.set("spread", item.get("spread"));
        }
        return rates;
    }
}
