package com.fxplatform.ingestion.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fxplatform.common.model.RawQuote;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/** fxapi.com {@code /latest}, authenticated with an {@code access_key} query parameter. */
public class FxApiProvider extends AbstractRateProvider {

    public static final String NAME = "fxapi";
    public static final double RELIABILITY = 0.95;
    public static final String DEFAULT_BASE_URL = "https://api.fxapi.com/v1";

    public FxApiProvider(ProviderSettings settings, WebClient webClient, ObjectMapper objectMapper, Clock clock) {
        super(settings, webClient, objectMapper, clock);
    }

    @Override
    protected Mono<List<RawQuote>> doFetch(String baseCurrency, List<String> targets) {
        return getJson(uri -> uri.path("/latest")
                .queryParam("access_key", settings.apiKey())
                .queryParam("base", baseCurrency)
                .queryParam("symbols", joined(targets))
                .build(), noHeaders())
            .map(this::requireSuccess)
            .map(root -> normalize(baseCurrency, requireField(root, "rates"), targets));
    }
}
