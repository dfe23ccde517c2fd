package com.fxplatform.ingestion.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fxplatform.common.model.RawQuote;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

public class ReutersProvider extends AbstractStreamingRateProvider {

    public static final String NAME = "reuters";
    public static final double RELIABILITY = 0.98;
    public static final String DEFAULT_BASE_URL = "https://api.reuters.com/fx/v1";
    public static final String DEFAULT_STREAM_URL = "wss://stream.reuters.com/fx";

    public ReutersProvider(ProviderSettings settings, WebClient webClient, ObjectMapper objectMapper,
                           Clock clock, WebSocketClient webSocketClient) {
        super(settings, webClient, objectMapper, clock, webSocketClient);
    }

    @Override
    protected Mono<List<RawQuote>> doFetch(String baseCurrency, List<String> targets) {
        return getJson(uri -> uri.path("/rates")
                .queryParam("base", baseCurrency)
                .queryParam("symbols", joined(targets))
                .queryParam("format", "json")
                .build(), bearerAuth())
            .map(root -> normalize(baseCurrency, requireField(root, "rates"), targets));
    }
}
