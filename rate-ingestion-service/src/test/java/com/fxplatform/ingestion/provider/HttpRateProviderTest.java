package com.fxplatform.ingestion.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fxplatform.common.exception.ProviderException;
import com.fxplatform.common.exception.ProviderFailureKind;
import com.fxplatform.common.model.PairKey;
import com.fxplatform.common.model.RawQuote;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Request shape, response mapping and failure classification of the HTTP providers,
 * driven through a stubbed exchange function.
 */
class HttpRateProviderTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final List<String> TARGETS = List.of("EUR", "GBP", "JPY");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private static ProviderSettings settings(String name, String apiKey, double reliability) {
        return new ProviderSettings(name, "https://provider.test/v1", null, apiKey, reliability, Duration.ofSeconds(2));
    }

    private FxApiProvider fxApi(StubExchange stub, String apiKey) {
        return new FxApiProvider(settings(FxApiProvider.NAME, apiKey, FxApiProvider.RELIABILITY),
                                 stub.webClient(), objectMapper, clock);
    }

    private static void assertFailure(Throwable e, ProviderFailureKind kind) {
        ProviderException pe = assertInstanceOf(ProviderException.class, e);
        assertEquals(kind, pe.getKind());
    }

    // ── fxapi ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("fxapi")
    class FxApi {

        @Test
        @DisplayName("maps rates, drops the base and untargeted currencies")
        void mapsRates() {
            StubExchange stub = StubExchange.ok(
                "{\"success\":true,\"rates\":{\"USD\":1,\"EUR\":0.92,\"GBP\":\"0.79\",\"CHF\":0.88,\"JPY\":149.5}}");
            FxApiProvider provider = fxApi(stub, "secret");

            StepVerifier.create(provider.fetch("usd", TARGETS))
                .assertNext(quotes -> {
                    assertEquals(3, quotes.size());
                    RawQuote eur = quotes.stream().filter(q -> q.pair().quote().equals("EUR")).findFirst().orElseThrow();
                    assertEquals(PairKey.of("USD", "EUR"), eur.pair());
                    assertEquals(0.92, eur.rate());
                    assertEquals(FxApiProvider.RELIABILITY, eur.reliability());
                    assertEquals(NOW, eur.timestamp());
                    assertFalse(eur.streaming());
                })
                .verifyComplete();

            String query = stub.lastRequest().url().getQuery();
            assertTrue(query.contains("access_key=secret"));
            assertTrue(query.contains("base=USD"));
            assertTrue(query.contains("symbols=EUR,GBP,JPY"));
            assertTrue(stub.lastRequest().url().getPath().endsWith("/v1/latest"));

            ProviderStats stats = provider.stats();
            assertEquals(1, stats.requests());
            assertEquals(1, stats.successes());
            assertTrue(stats.healthy());
        }

        @Test
        @DisplayName("success=false → API error carrying the provider's message")
        void apiError() {
            StubExchange stub = StubExchange.ok("{\"success\":false,\"error\":{\"info\":\"quota exceeded\"}}");

            StepVerifier.create(fxApi(stub, "secret").fetch("USD", TARGETS))
                .expectErrorSatisfies(e -> {
                    assertFailure(e, ProviderFailureKind.API_ERROR);
                    assertTrue(e.getMessage().contains("fxapi error: quota exceeded"));
                })
                .verify();
        }

        @Test
        @DisplayName("missing key → credential failure, no request is sent")
        void missingKey() {
            StubExchange stub = StubExchange.ok("{}");
            FxApiProvider provider = fxApi(stub, " ");

            StepVerifier.create(provider.fetch("USD", TARGETS))
                .expectErrorSatisfies(e -> {
                    assertFailure(e, ProviderFailureKind.MISSING_CREDENTIAL);
                    assertTrue(e.getMessage().contains("fxapi API key not configured"));
                })
                .verify();

            assertEquals(0, stub.requestCount());
            assertEquals(1, provider.stats().failures());
            assertFalse(provider.stats().healthy());
        }

        @Test
        @DisplayName("no targeted currency in the response → malformed")
        void noUsableRates() {
            StubExchange stub = StubExchange.ok("{\"rates\":{\"CHF\":0.88}}");

            StepVerifier.create(fxApi(stub, "secret").fetch("USD", TARGETS))
                .expectErrorSatisfies(e -> assertFailure(e, ProviderFailureKind.MALFORMED_RESPONSE))
                .verify();
        }

        @Test
        @DisplayName("missing rates field → malformed")
        void noRatesField() {
            StepVerifier.create(fxApi(StubExchange.ok("{\"base\":\"USD\"}"), "secret").fetch("USD", TARGETS))
                .expectErrorSatisfies(e -> {
                    assertFailure(e, ProviderFailureKind.MALFORMED_RESPONSE);
                    assertTrue(e.getMessage().contains("No rates in response"));
                })
                .verify();
        }

        @Test
        @DisplayName("body that is not JSON → malformed")
        void notJson() {
            StepVerifier.create(fxApi(StubExchange.ok("<html>oops</html>"), "secret").fetch("USD", TARGETS))
                .expectErrorSatisfies(e -> assertFailure(e, ProviderFailureKind.MALFORMED_RESPONSE))
                .verify();
        }
    }

    // ── classification ────────────────────────────────────────────────────

    @Nested
    @DisplayName("failure classification")
    class Classification {

        @Test
        void unauthorized() {
            StepVerifier.create(fxApi(StubExchange.status(HttpStatus.UNAUTHORIZED), "k").fetch("USD", TARGETS))
                .expectErrorSatisfies(e -> assertFailure(e, ProviderFailureKind.AUTHENTICATION))
                .verify();
        }

        @Test
        void rateLimited() {
            StepVerifier.create(fxApi(StubExchange.status(HttpStatus.TOO_MANY_REQUESTS), "k").fetch("USD", TARGETS))
                .expectErrorSatisfies(e -> assertFailure(e, ProviderFailureKind.RATE_LIMITED))
                .verify();
        }

        @Test
        void serverError() {
            StepVerifier.create(fxApi(StubExchange.status(HttpStatus.BAD_GATEWAY), "k").fetch("USD", TARGETS))
                .expectErrorSatisfies(e -> assertFailure(e, ProviderFailureKind.SERVER_ERROR))
                .verify();
        }

        @Test
        @DisplayName("no response within the provider timeout")
        void timeout() {
            FxApiProvider provider = new FxApiProvider(
                new ProviderSettings(FxApiProvider.NAME, "https://provider.test", null, "k", 0.95, Duration.ofSeconds(10)),
                StubExchange.hanging().webClient(), objectMapper, clock);

            StepVerifier.withVirtualTime(() -> provider.fetch("USD", TARGETS))
                .expectSubscription()
                .thenAwait(Duration.ofSeconds(10))
                .expectErrorSatisfies(e -> assertFailure(e, ProviderFailureKind.TIMEOUT))
                .verify(Duration.ofSeconds(5));
        }
    }

    // ── other providers ───────────────────────────────────────────────────

    @Nested
    @DisplayName("response shapes")
    class Shapes {

        @Test
        @DisplayName("exchangerate-api needs no key and puts the base in the path")
        void exchangeRateApi() {
            StubExchange stub = StubExchange.ok("{\"base\":\"USD\",\"rates\":{\"EUR\":0.92,\"GBP\":0.79}}");
            ExchangeRateApiProvider provider = new ExchangeRateApiProvider(
                settings(ExchangeRateApiProvider.NAME, "", ExchangeRateApiProvider.RELIABILITY),
                stub.webClient(), objectMapper, clock);

            StepVerifier.create(provider.fetch("USD", TARGETS))
                .assertNext(quotes -> assertEquals(2, quotes.size()))
                .verifyComplete();
            assertTrue(stub.lastRequest().url().getPath().endsWith("/latest/USD"));
        }

        @Test
        @DisplayName("currencylayer strips the source prefix from quote keys")
        void currencyLayer() {
            StubExchange stub = StubExchange.ok("{\"success\":true,\"quotes\":{\"USDEUR\":0.92,\"USDJPY\":149.5}}");
            CurrencyLayerProvider provider = new CurrencyLayerProvider(
                settings(CurrencyLayerProvider.NAME, "k", CurrencyLayerProvider.RELIABILITY),
                stub.webClient(), objectMapper, clock);

            StepVerifier.create(provider.fetch("USD", TARGETS))
                .assertNext(quotes -> {
                    assertEquals(2, quotes.size());
                    assertTrue(quotes.stream().anyMatch(q -> q.pair().equals(PairKey.of("USD", "JPY"))
                                                             && q.rate() == 149.5));
                })
                .verifyComplete();
            assertTrue(stub.lastRequest().url().getQuery().contains("source=USD"));
        }

        @Test
        @DisplayName("reuters sends a bearer token")
        void reuters() {
            StubExchange stub = StubExchange.ok("{\"rates\":{\"EUR\":{\"rate\":0.92,\"bid\":0.9199,\"ask\":0.9201}}}");
            ReutersProvider provider = new ReutersProvider(
                settings(ReutersProvider.NAME, "tok", ReutersProvider.RELIABILITY),
                stub.webClient(), objectMapper, clock, mock(WebSocketClient.class));

            StepVerifier.create(provider.fetch("USD", TARGETS))
                .assertNext(quotes -> {
                    RawQuote eur = quotes.get(0);
                    assertEquals(0.9199, eur.bid());
                    assertEquals(0.9201, eur.ask());
                    assertEquals(0.0002, eur.spread(), 1e-12);
                })
                .verifyComplete();
            assertEquals("Bearer tok", stub.lastRequest().headers().getFirst(HttpHeaders.AUTHORIZATION));
        }

        @Test
        @DisplayName("bloomberg data array → rates with bid and ask")
        void bloomberg() {
            StubExchange stub = StubExchange.ok("{\"data\":["
                + "{\"quote_currency\":\"EUR\",\"mid_rate\":0.92,\"bid_rate\":0.9198,\"ask_rate\":0.9202},"
                + "{\"quote_currency\":\"GBP\",\"mid_rate\":0.79,\"bid_rate\":0.7898,\"ask_rate\":0.7902}]}");
            BloombergProvider provider = new BloombergProvider(
                settings(BloombergProvider.NAME, "k", BloombergProvider.RELIABILITY),
                stub.webClient(), objectMapper, clock, mock(WebSocketClient.class));

            StepVerifier.create(provider.fetch("USD", TARGETS))
                .assertNext(quotes -> {
                    assertEquals(2, quotes.size());
                    assertTrue(quotes.stream().allMatch(RawQuote::hasBidAsk));
                })
                .verifyComplete();
            assertTrue(stub.lastRequest().url().getQuery().contains("include_bid_ask=true"));
        }
    }
}
