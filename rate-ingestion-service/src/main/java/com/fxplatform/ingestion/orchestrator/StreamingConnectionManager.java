package com.fxplatform.ingestion.orchestrator;

import com.fxplatform.common.exception.ProviderException;
import com.fxplatform.common.exception.ProviderFailureKind;
import com.fxplatform.common.model.RawQuote;
import com.fxplatform.ingestion.provider.StreamingRateProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * One long-lived stream per streaming provider, independent of the polling loop.
 *
 * <p>A dropped or failed connection is re-opened after {@code reconnectDelay}, but only while
 * {@code running} holds; a provider without credentials is not retried. Pending reconnects are
 * tracked alongside live connections so that {@link #closeAll()} cancels both.
 */
public class StreamingConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(StreamingConnectionManager.class);

    private final Map<String, Disposable> connections = new ConcurrentHashMap<>();
    private final Map<String, Disposable> reconnects  = new ConcurrentHashMap<>();
    private final Duration reconnectDelay;
    private final Scheduler scheduler;
    private final Consumer<RawQuote> tickHandler;
    private final BooleanSupplier running;

    public StreamingConnectionManager(Duration reconnectDelay, Scheduler scheduler,
                                      Consumer<RawQuote> tickHandler, BooleanSupplier running) {
        this.reconnectDelay = reconnectDelay;
        this.scheduler      = scheduler;
        this.tickHandler    = tickHandler;
        this.running        = running;
    }

    public void openAll(List<StreamingRateProvider> providers, String baseCurrency, List<String> targets) {
        for (StreamingRateProvider provider : providers) {
            if (provider.supportsStreaming()) {
                open(provider, baseCurrency, targets);
            }
        }
    }

    void open(StreamingRateProvider provider, String baseCurrency, List<String> targets) {
        String name = provider.name();
        // Registered before subscribing so a terminal signal on another thread always finds its own slot.
        Disposable.Swap slot = Disposables.swap();
        Disposable previous = connections.put(name, slot);
        if (previous != null) {
            previous.dispose();
        }
        slot.update(provider.connectStream(baseCurrency, targets)
            .subscribe(
                this::handleTick,
                err -> {
                    connections.remove(name, slot);
                    if (err instanceof ProviderException pe && pe.getKind() == ProviderFailureKind.MISSING_CREDENTIAL) {
                        log.warn("STREAM_DISABLED provider={} reason={}", name, pe.getMessage());
                        return;
                    }
                    log.warn("STREAM_ERROR provider={} error={}", name, err.getMessage());
                    scheduleReconnect(provider, baseCurrency, targets);
                },
                () -> {
                    log.info("STREAM_CLOSED provider={}", name);
                    connections.remove(name, slot);
                    scheduleReconnect(provider, baseCurrency, targets);
                }));
        if (!running.getAsBoolean()) {
            connections.remove(name, slot);
            slot.dispose();
            log.info("STREAM_CLOSED provider={} reason=shutdown", name);
            return;
        }
        if (connections.get(name) == slot) {
            log.info("STREAM_OPENED provider={}", name);
        }
    }

    private void handleTick(RawQuote quote) {
        try {
            tickHandler.accept(quote);
        } catch (RuntimeException e) {
            log.warn("STREAM_TICK_FAILED provider={} pair={} error={}", quote.provider(), quote.pair(), e.getMessage(), e);
        }
    }

    private void scheduleReconnect(StreamingRateProvider provider, String baseCurrency, List<String> targets) {
        if (!running.getAsBoolean()) {
            return;
        }
        String name = provider.name();
        log.info("STREAM_RECONNECT_SCHEDULED provider={} delayMs={}", name, reconnectDelay.toMillis());
        Disposable pending = Mono.delay(reconnectDelay, scheduler)
            .subscribe(t -> {
                reconnects.remove(name);
                if (running.getAsBoolean()) {
                    open(provider, baseCurrency, targets);
                }
            });
        Disposable previous = reconnects.put(name, pending);
        if (previous != null) {
            previous.dispose();
        }
    }

    public void closeAll() {
        reconnects.values().forEach(Disposable::dispose);
        reconnects.clear();
        connections.forEach((name, connection) -> {
            connection.dispose();
            log.info("STREAM_CLOSED provider={} reason=shutdown", name);
        });
        connections.clear();
    }

    public int activeConnections() {
        return connections.size();
    }
}
