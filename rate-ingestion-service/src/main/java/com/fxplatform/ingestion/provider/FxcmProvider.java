package com.fxplatform.ingestion.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fxplatform.common.model.RawQuote;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

public class FxcmProvider extends AbstractStreamingRateProvider {

    public static final String NAME = "fxcm";
    public static final double RELIABILITY = 0.88;
    public static final String DEFAULT_BASE_URL = "https://api.fxcm.com/v1";
    public static final String DEFAULT_STREAM_URL = "wss://api.fxcm.com/socketio";

    public FxcmProvider(ProviderSettings settings, WebClient webClient, ObjectMapper objectMapper,
                        Clock clock, WebSocketClient webSocketClient) {
        super(settings, webClient, objectMapper, clock, webSocketClient);
    }

    @Override
    protected Mono<List<RawQuote>> doFetch(String baseCurrency, List<String> targets) {
        return getJson(uri -> uri.path("/rates")
                .queryParam("base", baseCurrency)
                .queryParam("symbols", joined(targets))
                .build(), bearerAuth())
            .map(root -> normalize(baseCurrency, requireField(root, "rates"), targets));
    }
}
