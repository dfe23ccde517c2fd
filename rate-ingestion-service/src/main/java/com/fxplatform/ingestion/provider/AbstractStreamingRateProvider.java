package com.fxplatform.ingestion.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fxplatform.common.exception.ProviderException;
import com.fxplatform.common.exception.ProviderFailureKind;
import com.fxplatform.common.model.PairKey;
import com.fxplatform.common.model.RawQuote;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.util.List;

/**
 * HTTP provider that additionally streams {@code rate_update} frames over a WebSocket.
 * The connection is authenticated with a bearer token and sends a single subscribe
 * message listing {@code BASE/QUOTE} for every target once open.
 */
public abstract class AbstractStreamingRateProvider extends AbstractRateProvider implements StreamingRateProvider {

    private final WebSocketClient webSocketClient;

    protected AbstractStreamingRateProvider(ProviderSettings settings, WebClient webClient,
                                            ObjectMapper objectMapper, Clock clock,
                                            WebSocketClient webSocketClient) {
        super(settings, webClient, objectMapper, clock);
        this.webSocketClient = webSocketClient;
    }

    @Override
    public boolean supportsStreaming() {
        return settings.hasStreamUrl();
    }

    @Override
    public Flux<RawQuote> connectStream(String baseCurrency, List<String> targets) {
        if (!supportsStreaming()) {
            return Flux.error(new ProviderException(name(), ProviderFailureKind.CONNECTION, "No stream URL configured"));
        }
        if (!settings.hasCredential()) {
            return Flux.error(new ProviderException(name(), ProviderFailureKind.MISSING_CREDENTIAL,
                                                    name() + " API key not configured"));
        }

        URI uri = URI.create(settings.streamUrl());
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(settings.apiKey());
        String subscription = subscriptionMessage(baseCurrency, targets);

        return Flux.create(sink -> {
            log.info("STREAM_CONNECTING provider={} url={} pairs={}", name(), uri, targets.size());
            Disposable connection = webSocketClient.execute(uri, headers, session ->
                    session.send(Mono.just(session.textMessage(subscription)))
                        .thenMany(session.receive()
                            .map(WebSocketMessage::getPayloadAsText)
                            .doOnNext(text -> StreamMessageParser
                                .parse(name(), reliability(), text, objectMapper, clock.instant())
                                .ifPresent(sink::next)))
                        .then())
                .subscribe(
                    null,
                    err -> {
                        health.recordFailure();
                        sink.error(classify(err));
                    },
                    sink::complete);
            sink.onDispose(connection);
        });
    }

    String subscriptionMessage(String baseCurrency, List<String> targets) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("action", "subscribe");
        ArrayNode symbols = message.putArray("symbols");
        targets.stream()
            .filter(t -> !t.equalsIgnoreCase(baseCurrency))
            .map(t -> PairKey.of(baseCurrency, t).symbol())
            .forEach(symbols::add);
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise subscription message", e);
        }
    }
}
