package com.fxplatform.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fxplatform.ingestion.provider.BloombergProvider;
import com.fxplatform.ingestion.provider.CurrencyLayerProvider;
import com.fxplatform.ingestion.provider.ExchangeRateApiProvider;
import com.fxplatform.ingestion.provider.FxApiProvider;
import com.fxplatform.ingestion.provider.FxcmProvider;
import com.fxplatform.ingestion.provider.OandaProvider;
import com.fxplatform.ingestion.provider.ProviderSettings;
import com.fxplatform.ingestion.provider.ReutersProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;

import java.time.Clock;
import java.time.Duration;

/**
 * One bean per rate source. Credentials come in through {@code ${ENV:}} placeholders in
 * application.yml and stay blank when unset; such a provider fails every fetch with a credential
 * error while the others keep working.
 */
@Configuration
public class ProviderConfig {

    @Value("${fx.providers.timeout-ms:10000}")
    private long timeoutMs;

    // ── fxapi ────────────────────────────────────────────────────────────────
    @Value("${fx.providers.fxapi.base-url:" + FxApiProvider.DEFAULT_BASE_URL + "}")
    private String fxApiBaseUrl;

    @Value("${fx.providers.fxapi.api-key:}")
    private String fxApiKey;

    // ── exchangerate ─────────────────────────────────────────────────────────
    @Value("${fx.providers.exchangerate.base-url:" + ExchangeRateApiProvider.DEFAULT_BASE_URL + "}")
    private String exchangeRateBaseUrl;

    // ── currencylayer ────────────────────────────────────────────────────────
    @Value("${fx.providers.currencylayer.base-url:" + CurrencyLayerProvider.DEFAULT_BASE_URL + "}")
    private String currencyLayerBaseUrl;

    @Value("${fx.providers.currencylayer.api-key:}")
    private String currencyLayerKey;

    // ── reuters ──────────────────────────────────────────────────────────────
    @Value("${fx.providers.reuters.base-url:" + ReutersProvider.DEFAULT_BASE_URL + "}")
    private String reutersBaseUrl;

    @Value("${fx.providers.reuters.stream-url:" + ReutersProvider.DEFAULT_STREAM_URL + "}")
    private String reutersStreamUrl;

    @Value("${fx.providers.reuters.api-key:}")
    private String reutersKey;

    // ── bloomberg ────────────────────────────────────────────────────────────
    @Value("${fx.providers.bloomberg.base-url:" + BloombergProvider.DEFAULT_BASE_URL + "}")
    private String bloombergBaseUrl;

    @Value("${fx.providers.bloomberg.stream-url:" + BloombergProvider.DEFAULT_STREAM_URL + "}")
    private String bloombergStreamUrl;

    @Value("${fx.providers.bloomberg.api-key:}")
    private String bloombergKey;

    // ── oanda ────────────────────────────────────────────────────────────────
    @Value("${fx.providers.oanda.base-url:" + OandaProvider.DEFAULT_BASE_URL + "}")
    private String oandaBaseUrl;

    @Value("${fx.providers.oanda.stream-url:" + OandaProvider.DEFAULT_STREAM_URL + "}")
    private String oandaStreamUrl;

    @Value("${fx.providers.oanda.api-key:}")
    private String oandaKey;

    // ── fxcm ─────────────────────────────────────────────────────────────────
    @Value("${fx.providers.fxcm.base-url:" + FxcmProvider.DEFAULT_BASE_URL + "}")
    private String fxcmBaseUrl;

    @Value("${fx.providers.fxcm.stream-url:" + FxcmProvider.DEFAULT_STREAM_URL + "}")
    private String fxcmStreamUrl;

    @Value("${fx.providers.fxcm.api-key:}")
    private String fxcmKey;

    @Bean
    public FxApiProvider fxApiProvider(@Qualifier("providerWebClient") WebClient webClient,
                                       ObjectMapper objectMapper, Clock clock) {
        return new FxApiProvider(settings(FxApiProvider.NAME, fxApiBaseUrl, null, fxApiKey, FxApiProvider.RELIABILITY),
                                 webClient, objectMapper, clock);
    }

    @Bean
    public ExchangeRateApiProvider exchangeRateApiProvider(@Qualifier("providerWebClient") WebClient webClient,
                                                           ObjectMapper objectMapper, Clock clock) {
        return new ExchangeRateApiProvider(settings(ExchangeRateApiProvider.NAME, exchangeRateBaseUrl, null, null,
                                                    ExchangeRateApiProvider.RELIABILITY),
                                           webClient, objectMapper, clock);
    }

    @Bean
    public CurrencyLayerProvider currencyLayerProvider(@Qualifier("providerWebClient") WebClient webClient,
                                                       ObjectMapper objectMapper, Clock clock) {
        return new CurrencyLayerProvider(settings(CurrencyLayerProvider.NAME, currencyLayerBaseUrl, null,
                                                  currencyLayerKey, CurrencyLayerProvider.RELIABILITY),
                                         webClient, objectMapper, clock);
    }

    @Bean
    public ReutersProvider reutersProvider(@Qualifier("providerWebClient") WebClient webClient,
                                           ObjectMapper objectMapper, Clock clock, WebSocketClient webSocketClient) {
        return new ReutersProvider(settings(ReutersProvider.NAME, reutersBaseUrl, reutersStreamUrl, reutersKey,
                                            ReutersProvider.RELIABILITY),
                                   webClient, objectMapper, clock, webSocketClient);
    }

    @Bean
    public BloombergProvider bloombergProvider(@Qualifier("providerWebClient") WebClient webClient,
                                               ObjectMapper objectMapper, Clock clock, WebSocketClient webSocketClient) {
        return new BloombergProvider(settings(BloombergProvider.NAME, bloombergBaseUrl, bloombergStreamUrl,
                                              bloombergKey, BloombergProvider.RELIABILITY),
                                     webClient, objectMapper, clock, webSocketClient);
    }

    @Bean
    public OandaProvider oandaProvider(@Qualifier("providerWebClient") WebClient webClient,
                                       ObjectMapper objectMapper, Clock clock, WebSocketClient webSocketClient) {
        return new OandaProvider(settings(OandaProvider.NAME, oandaBaseUrl, oandaStreamUrl, oandaKey,
                                          OandaProvider.RELIABILITY),
                                 webClient, objectMapper, clock, webSocketClient);
    }

    @Bean
    public FxcmProvider fxcmProvider(@Qualifier("providerWebClient") WebClient webClient,
                                     ObjectMapper objectMapper, Clock clock, WebSocketClient webSocketClient) {
        return new FxcmProvider(settings(FxcmProvider.NAME, fxcmBaseUrl, fxcmStreamUrl, fxcmKey,
                                         FxcmProvider.RELIABILITY),
                                webClient, objectMapper, clock, webSocketClient);
    }

    private ProviderSettings settings(String name, String baseUrl, String streamUrl, String apiKey, double reliability) {
        return new ProviderSettings(name, baseUrl, streamUrl, apiKey, reliability, Duration.ofMillis(timeoutMs));
    }
}
