package com.fxplatform.ingestion.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fxplatform.common.model.RawQuote;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/** exchangerate-api.com {@code /latest/{base}}. Public endpoint, no key. Returns every currency. */
public class ExchangeRateApiProvider extends AbstractRateProvider {

    public static final String NAME = "exchangerate";
    public static final double RELIABILITY = 0.90;
    public static final String DEFAULT_BASE_URL = "https://api.exchangerate-api.com/v4";

    public ExchangeRateApiProvider(ProviderSettings settings, WebClient webClient,
                                   ObjectMapper objectMapper, Clock clock) {
        super(settings, webClient, objectMapper, clock);
    }

    @Override
    protected boolean requiresCredential() {
        return false;
    }

    @Override
    protected Mono<List<RawQuote>> doFetch(String baseCurrency, List<String> targets) {
        return getJson(uri -> uri.path("/latest/{base}").build(baseCurrency), noHeaders())
            .map(root -> normalize(baseCurrency, requireField(root, "rates"), targets));
    }
}
