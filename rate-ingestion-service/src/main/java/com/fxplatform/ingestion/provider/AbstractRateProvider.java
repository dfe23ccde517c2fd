package com.fxplatform.ingestion.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fxplatform.common.exception.ProviderException;
import com.fxplatform.common.exception.ProviderFailureKind;
import com.fxplatform.common.model.RawQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Shared fetch pipeline for HTTP rate providers: credential check, request accounting,
 * per-provider timeout, failure classification and stats. Subclasses only build the request
 * and map the response body.
 */
public abstract class AbstractRateProvider implements RateProvider {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final ProviderSettings settings;
    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;
    protected final Clock clock;
    protected final ProviderHealthTracker health;

    protected AbstractRateProvider(ProviderSettings settings, WebClient webClient,
                                   ObjectMapper objectMapper, Clock clock) {
        this.settings     = settings;
        this.webClient    = webClient.mutate().baseUrl(settings.baseUrl()).build();
        this.objectMapper = objectMapper;
        this.clock        = clock;
        this.health       = new ProviderHealthTracker(settings.name(), settings.reliability(), clock);
    }

    /** Issues the provider-specific request. Only called once the credential check passed. */
    protected abstract Mono<List<RawQuote>> doFetch(String baseCurrency, List<String> targets);

    protected boolean requiresCredential() {
        return true;
    }

    @Override
    public String name() {
        return settings.name();
    }

    @Override
    public double reliability() {
        return settings.reliability();
    }

    @Override
    public Duration timeout() {
        return settings.timeout();
    }

    @Override
    public boolean supportsStreaming() {
        return false;
    }

    @Override
    public ProviderStats stats() {
        return health.snapshot();
    }

    public ProviderSettings settings() {
        return settings;
    }

    @Override
    public final Mono<List<RawQuote>> fetch(String baseCurrency, List<String> targets) {
        return Mono.defer(() -> {
            health.recordRequest();
            long started = System.nanoTime();

            Mono<List<RawQuote>> call = requiresCredential() && !settings.hasCredential()
                ? Mono.error(new ProviderException(name(), ProviderFailureKind.MISSING_CREDENTIAL,
                                                   name() + " API key not configured"))
                : doFetch(baseCurrency.toUpperCase(), targets);

            return call
                .timeout(settings.timeout())
                .filter(quotes -> !quotes.isEmpty())
                .switchIfEmpty(Mono.error(() -> new ProviderException(name(),
                    ProviderFailureKind.MALFORMED_RESPONSE, "No usable rates in response")))
                .onErrorMap(this::classify)
                .doOnSuccess(quotes -> {
                    long elapsedMs = (System.nanoTime() - started) / 1_000_000;
                    health.recordSuccess(elapsedMs);
                    log.debug("PROVIDER_FETCH_OK provider={} quotes={} elapsedMs={}", name(), quotes.size(), elapsedMs);
                })
                .doOnError(e -> {
                    health.recordFailure();
                    log.warn("PROVIDER_FETCH_FAILED provider={} error={}", name(), e.getMessage());
                });
        });
    }

    // ── Error classification ────────────────────────────────────────────────

    protected ProviderException classify(Throwable e) {
        if (e instanceof ProviderException pe) {
            return pe;
        }
        if (e instanceof TimeoutException) {
            return new ProviderException(name(), ProviderFailureKind.TIMEOUT,
                "No response within " + settings.timeout().toMillis() + "ms", e);
        }
        if (e instanceof WebClientResponseException wre) {
            int status = wre.getStatusCode().value();
            ProviderFailureKind kind;
            if (status == 401 || status == 403) {
                kind = ProviderFailureKind.AUTHENTICATION;
            } else if (status == 429) {
                kind = ProviderFailureKind.RATE_LIMITED;
            } else if (status >= 500) {
                kind = ProviderFailureKind.SERVER_ERROR;
            } else {
                kind = ProviderFailureKind.UNKNOWN;
            }
            return new ProviderException(name(), kind, "HTTP " + status, e);
        }
        if (e instanceof WebClientRequestException) {
            return new ProviderException(name(), ProviderFailureKind.CONNECTION, e.getMessage(), e);
        }
        if (e instanceof JsonProcessingException) {
            return new ProviderException(name(), ProviderFailureKind.MALFORMED_RESPONSE, "Response is not valid JSON", e);
        }
        return new ProviderException(name(), ProviderFailureKind.UNKNOWN,
            e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
    }

    // ── Request helpers ─────────────────────────────────────────────────────

    protected Mono<JsonNode> getJson(Function<UriBuilder, URI> uri, Consumer<HttpHeaders> headers) {
        return webClient.get()
            .uri(uri)
            .headers(headers)
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(String.class)
            .map(this::readTree);
    }

    protected Consumer<HttpHeaders> bearerAuth() {
        return h -> h.setBearerAuth(settings.apiKey());
    }

    protected static Consumer<HttpHeaders> noHeaders() {
        return h -> { };
    }

    protected JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(name(), ProviderFailureKind.MALFORMED_RESPONSE, "Response is not valid JSON", e);
        }
    }

    /** Fails when the body carries {@code "success": false}, using {@code error.info} as the message. */
    protected JsonNode requireSuccess(JsonNode root) {
        if (root.has("success") && !root.path("success").asBoolean(false)) {
            String info = root.path("error").path("info").asText("Unknown error");
            throw new ProviderException(name(), ProviderFailureKind.API_ERROR, name() + " error: " + info);
        }
        return root;
    }

    protected JsonNode requireField(JsonNode root, String field) {
        JsonNode node = root.path(field);
        if (node.isMissingNode() || node.isNull()) {
            throw new ProviderException(name(), ProviderFailureKind.MALFORMED_RESPONSE, "No " + field + " in response");
        }
        return node;
    }

    protected List<RawQuote> normalize(String baseCurrency, JsonNode rates, List<String> targets) {
        return QuoteNormalizer.normalizeRates(name(), reliability(), baseCurrency, rates, targets, clock.instant());
    }

    protected static String joined(List<String> targets) {
        return String.join(",", targets);
    }
}
