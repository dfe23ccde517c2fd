package com.fxplatform.ingestion.provider;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Canned HTTP responses for provider tests. Records every request it sees.
 */
class StubExchange implements ExchangeFunction {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private volatile HttpStatus status = HttpStatus.OK;
    private volatile String body = "{}";
    private volatile boolean hang;

    static StubExchange ok(String body) {
        StubExchange stub = new StubExchange();
        stub.body = body;
        return stub;
    }

    static StubExchange status(HttpStatus status) {
        StubExchange stub = new StubExchange();
        stub.status = status;
        return stub;
    }

    static StubExchange hanging() {
        StubExchange stub = new StubExchange();
        stub.hang = true;
        return stub;
    }

    WebClient webClient() {
        return WebClient.builder().exchangeFunction(this).build();
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        requests.add(request);
        if (hang) {
            return Mono.never();
        }
        return Mono.just(ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build());
    }

    ClientRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    int requestCount() {
        return requests.size();
    }
}
