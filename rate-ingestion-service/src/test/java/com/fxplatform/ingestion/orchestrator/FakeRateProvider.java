package com.fxplatform.ingestion.orchestrator;

import com.fxplatform.common.exception.ProviderException;
import com.fxplatform.common.exception.ProviderFailureKind;
import com.fxplatform.common.model.PairKey;
import com.fxplatform.common.model.RawQuote;
import com.fxplatform.ingestion.provider.ProviderStats;
import com.fxplatform.ingestion.provider.StreamingRateProvider;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Scriptable provider: answers every fetch from a fixed rate table, or fails, or hangs.
 * Streaming connections are backed by a sink the test drives.
 */
class FakeRateProvider implements StreamingRateProvider {

    private final String name;
    private final double reliability;
    private final Clock clock;

    volatile Map<String, Double> rates = Map.of();
    volatile boolean failing;
    volatile Mono<List<RawQuote>> override;
    volatile boolean streaming;
    volatile Supplier<Flux<RawQuote>> streamFactory;

    final AtomicInteger fetches     = new AtomicInteger();
    final AtomicInteger connections = new AtomicInteger();
    private final AtomicInteger failures = new AtomicInteger();

    FakeRateProvider(String name, double reliability, Clock clock) {
        this.name        = name;
        this.reliability = reliability;
        this.clock       = clock;
    }

    static FakeRateProvider serving(String name, Clock clock, Map<String, Double> rates) {
        FakeRateProvider p = new FakeRateProvider(name, 0.9, clock);
        p.rates = rates;
        return p;
    }

    static FakeRateProvider failing(String name, Clock clock) {
        FakeRateProvider p = new FakeRateProvider(name, 0.9, clock);
        p.failing = true;
        return p;
    }

    /** Streams whatever is pushed into the returned sink on every connection. */
    Sinks.Many<RawQuote> streamFromSink() {
        Sinks.Many<RawQuote> sink = Sinks.many().multicast().directBestEffort();
        streaming = true;
        streamFactory = sink::asFlux;
        return sink;
    }

    RawQuote tick(String quote, double rate) {
        return new RawQuote(name, PairKey.of("USD", quote), rate, null, null, null, clock.instant(), reliability, true);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double reliability() {
        return reliability;
    }

    @Override
    public Duration timeout() {
        return Duration.ofSeconds(10);
    }

    @Override
    public boolean supportsStreaming() {
        return streaming;
    }

    @Override
    public Mono<List<RawQuote>> fetch(String baseCurrency, List<String> targets) {
        return Mono.defer(() -> {
            fetches.incrementAndGet();
            if (override != null) {
                return override;
            }
            if (failing) {
                failures.incrementAndGet();
                return Mono.error(new ProviderException(name, ProviderFailureKind.CONNECTION, "connection refused"));
            }
            List<RawQuote> quotes = new ArrayList<>();
            for (String target : targets) {
                Double rate = rates.get(target);
                if (rate != null) {
                    quotes.add(new RawQuote(name, PairKey.of(baseCurrency, target), rate, null, null, null,
                                            clock.instant(), reliability, false));
                }
            }
            return Mono.just(quotes);
        });
    }

    @Override
    public Flux<RawQuote> connectStream(String baseCurrency, List<String> targets) {
        return Flux.defer(() -> {
            connections.incrementAndGet();
            return streamFactory.get();
        });
    }

    @Override
    public ProviderStats stats() {
        int f = failures.get();
        int n = fetches.get();
        return new ProviderStats(name, reliability, n, n - f, f, null, null, 1.0, f * 2 < Math.max(n, 1));
    }
}
