package com.fxplatform.ingestion.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fxplatform.common.model.RawQuote;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * currencylayer {@code /live}. Quotes come keyed by concatenated pair ({@code "USDEUR"}),
 * so the three-letter source prefix is stripped before normalization.
 */
public class CurrencyLayerProvider extends AbstractRateProvider {

    public static final String NAME = "currencylayer";
    public static final double RELIABILITY = 0.85;
    public static final String DEFAULT_BASE_URL = "http://api.currencylayer.com";

    public CurrencyLayerProvider(ProviderSettings settings, WebClient webClient,
                                 ObjectMapper objectMapper, Clock clock) {
        super(settings, webClient, objectMapper, clock);
    }

    @Override
    protected Mono<List<RawQuote>> doFetch(String baseCurrency, List<String> targets) {
        return getJson(uri -> uri.path("/live")
                .queryParam("access_key", settings.apiKey())
                .queryParam("source", baseCurrency)
                .queryParam("currencies", joined(targets))
                .build(), noHeaders())
            .map(this::requireSuccess)
            .map(root -> normalize(baseCurrency, stripSourcePrefix(requireField(root, "quotes")), targets));
    }

    ObjectNode stripSourcePrefix(JsonNode quotes) {
        ObjectNode rates = objectMapper.createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = quotes.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getKey().length() > 3) {
                rates.set(entry.getKey().substring(3), entry.getValue());
            }
        }
        return rates;
    }
}
