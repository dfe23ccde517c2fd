package com.fxplatform.ingestion.orchestrator;

import com.fxplatform.common.consolidation.RateConsolidator;
import com.fxplatform.common.event.CriticalFailureEvent;
import com.fxplatform.common.event.CycleFailedEvent;
import com.fxplatform.common.event.RatesUpdatedEvent;
import com.fxplatform.common.exception.AllProvidersFailedException;
import com.fxplatform.common.model.ConsolidatedRate;
import com.fxplatform.common.model.PairKey;
import com.fxplatform.common.model.RawQuote;
import com.fxplatform.common.model.ValidationResult;
import com.fxplatform.common.publisher.RateEventPublisher;
import com.fxplatform.common.registry.CurrencyRegistry;
import com.fxplatform.common.trace.TraceContextUtil;
import com.fxplatform.common.validation.CycleValidationReport;
import com.fxplatform.common.validation.RateValidationEngine;
import com.fxplatform.ingestion.cache.RateCache;
import com.fxplatform.ingestion.provider.ProviderStats;
import com.fxplatform.ingestion.provider.RateProvider;
import com.fxplatform.ingestion.provider.StreamingRateProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives the ingestion loop: periodic pull cycles across all providers, continuous streams from
 * streaming-capable providers, and a consecutive-failure circuit breaker.
 *
 * <p>A cycle fans out to every provider concurrently and waits for all of them to settle. Any
 * single provider failing only drops its quotes; a cycle with zero successful providers is a hard
 * failure. Successful quotes are consolidated per pair, validated as a set, and the accepted rates
 * are cached, published and announced to listeners.
 *
 * <p>Cycles never overlap. A timer tick or manual refresh that arrives while a cycle is in flight
 * is skipped, not queued.
 *
 * <p>After {@code maxFailures} consecutive hard failures the orchestrator stops its timer and
 * streams, enters {@link IngestionState#FAILED} and emits exactly one critical failure event.
 */
public class IngestionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(IngestionOrchestrator.class);

    static final int STREAM_QUALITY         = 95;
    static final int FLAGGED_STREAM_QUALITY = 50;

    private final List<RateProvider> providers;
    private final RateConsolidator consolidator;
    private final RateValidationEngine validationEngine;
    private final RateCache cache;
    private final RateEventPublisher publisher;
    private final IngestionEventDispatcher dispatcher;
    private final CurrencyRegistry registry;
    private final IngestionSettings settings;
    private final Clock clock;
    private final Scheduler scheduler;
    private final StreamingConnectionManager streams;

    private final AtomicReference<IngestionState> state = new AtomicReference<>(IngestionState.STOPPED);
    private final AtomicBoolean cycleInFlight           = new AtomicBoolean(false);
    private final AtomicReference<CycleHandle> currentCycle = new AtomicReference<>();
    private final AtomicInteger consecutiveFailures     = new AtomicInteger();
    private final AtomicReference<Instant> lastUpdate   = new AtomicReference<>();
    private final AtomicReference<String> lastError     = new AtomicReference<>();

    private volatile Disposable timer;

    public IngestionOrchestrator(List<RateProvider> providers,
                                 RateConsolidator consolidator,
                                 RateValidationEngine validationEngine,
                                 RateCache cache,
                                 RateEventPublisher publisher,
                                 IngestionEventDispatcher dispatcher,
                                 CurrencyRegistry registry,
                                 IngestionSettings settings,
                                 Clock clock,
                                 Scheduler scheduler) {
        this.providers        = List.copyOf(providers);
        this.consolidator     = consolidator;
        this.validationEngine = validationEngine;
        this.cache            = cache;
        this.publisher        = publisher;
        this.dispatcher       = dispatcher;
        this.registry         = registry;
        this.settings         = settings;
        this.clock            = clock;
        this.scheduler        = scheduler;
        this.streams = new StreamingConnectionManager(settings.reconnectDelay(), scheduler,
                                                      this::onStreamQuote, this::isRunning);
    }

    // ── Lifecycle ───────────────────────────────────────────────────────────

    /**
     * Connects the cache, runs one priming cycle, then schedules the timer and opens streams.
     * A failed priming cycle counts toward the breaker but does not abort the start.
     * Starting while already started is a logged no-op.
     */
    public Mono<IngestionState> start() {
        return Mono.defer(() -> {
            IngestionState current = state.get();
            if ((current != IngestionState.STOPPED && current != IngestionState.FAILED)
                    || !state.compareAndSet(current, IngestionState.STARTING)) {
                log.warn("INGESTION_ALREADY_STARTED state={}", state.get());
                return Mono.just(state.get());
            }
            if (current == IngestionState.FAILED) {
                consecutiveFailures.set(0);
            }
            log.info("INGESTION_STARTING providers={} intervalSeconds={} maxFailures={}",
                     providers.size(), settings.updateInterval().toSeconds(), settings.maxFailures());

            return cache.connect()
                .then(runGuardedCycle())
                .then(Mono.fromCallable(this::completeStart));
        });
    }

    private IngestionState completeStart() {
        if (!state.compareAndSet(IngestionState.STARTING, IngestionState.RUNNING)) {
            log.warn("INGESTION_START_ABORTED state={}", state.get());
            return state.get();
        }
        timer = Flux.interval(settings.updateInterval(), settings.updateInterval(), scheduler)
            .subscribe(tick -> runGuardedCycle().subscribe());
        if (settings.streamingEnabled()) {
            streams.openAll(streamingProviders(), registry.getBaseCurrency(), targetCurrencies());
        }
        log.info("INGESTION_STARTED streams={}", streams.activeConnections());
        return IngestionState.RUNNING;
    }

    /**
     * Cancels the timer, any in-flight cycle and all streams. Does not wait for pending fetches;
     * an abandoned cycle caches, publishes and announces nothing.
     */
    public Mono<IngestionState> stop() {
        return Mono.fromCallable(() -> {
            IngestionState current = state.get();
            if ((current != IngestionState.RUNNING && current != IngestionState.STARTING)
                    || !state.compareAndSet(current, IngestionState.STOPPING)) {
                log.info("INGESTION_STOP_IGNORED state={}", state.get());
                return state.get();
            }
            haltActivity();
            state.set(IngestionState.STOPPED);
            log.info("INGESTION_STOPPED");
            return IngestionState.STOPPED;
        });
    }

    /** Clears the breaker and validation history. Only allowed while not running. */
    public Mono<IngestionState> reset() {
        return Mono.fromCallable(() -> {
            IngestionState current = state.get();
            if (current != IngestionState.STOPPED && current != IngestionState.FAILED) {
                throw new IllegalStateException("Cannot reset ingestion while " + current);
            }
            consecutiveFailures.set(0);
            lastError.set(null);
            validationEngine.clearHistory(null);
            state.compareAndSet(current, IngestionState.STOPPED);
            log.info("INGESTION_RESET previousState={}", current);
            return state.get();
        });
    }

    private void haltActivity() {
        haltTimerAndStreams();
        CycleHandle cycle = currentCycle.getAndSet(null);
        if (cycle != null) {
            cycle.abandon();
            log.info("CYCLE_ABANDONED cycleId={}", cycle.id());
        }
    }

    // ── Cycles ──────────────────────────────────────────────────────────────

    /**
     * Manual refresh. Emits {@code true} when a cycle ran, {@code false} when it was skipped
     * because one was already in flight.
     */
    public Mono<Boolean> refresh() {
        return Mono.defer(() -> {
            if (state.get() != IngestionState.RUNNING) {
                return Mono.error(new IllegalStateException("Ingestion is not running (state=" + state.get() + ")"));
            }
            return runGuardedCycle();
        });
    }

    /** Runs one cycle unless another is in flight. Never errors; failures feed the breaker. */
    Mono<Boolean> runGuardedCycle() {
        return Mono.defer(() -> {
            if (!cycleInFlight.compareAndSet(false, true)) {
                log.info("CYCLE_SKIPPED reason=in-flight");
                return Mono.just(false);
            }
            CycleHandle cycle = new CycleHandle(TraceContextUtil.newCycleId());
            currentCycle.set(cycle);
            return TraceContextUtil.withCycleId(executeCycle(cycle), cycle.id())
                .takeUntilOther(cycle.abandonSignal())
                .doOnNext(event -> {
                    if (!cycle.isAbandoned()) {
                        onCycleSuccess(event);
                    }
                })
                .thenReturn(true)
                .onErrorResume(e -> {
                    if (cycle.isAbandoned()) {
                        log.info("CYCLE_DISCARDED cycleId={} error={}", cycle.id(), e.getMessage());
                    } else {
                        onCycleFailure(cycle.id(), e);
                    }
                    return Mono.just(true);
                })
                .doFinally(signal -> {
                    currentCycle.compareAndSet(cycle, null);
                    cycleInFlight.set(false);
                });
        });
    }

    private Mono<RatesUpdatedEvent> executeCycle(CycleHandle cycle) {
        String cycleId = cycle.id();
        String base = registry.getBaseCurrency();
        List<String> targets = targetCurrencies();
        log.info("CYCLE_STARTED cycleId={} base={} targets={} providers={}", cycleId, base, targets, providers.size());

        return Flux.fromIterable(providers)
            .flatMap(provider -> provider.fetch(base, targets)
                .map(quotes -> ProviderOutcome.success(provider.name(), quotes))
                .onErrorResume(e -> Mono.deferContextual(ctx -> {
                    TraceContextUtil.withMdc(TraceContextUtil.getCycleId(ctx), () ->
                        log.warn("PROVIDER_SKIPPED cycleId={} provider={} error={}", cycleId, provider.name(), e.getMessage()));
                    return Mono.just(ProviderOutcome.failure(provider.name()));
                })))
            .collectList()
            .flatMap(outcomes -> consolidateAndStore(cycle, outcomes));
    }

    private Mono<RatesUpdatedEvent> consolidateAndStore(CycleHandle cycle, List<ProviderOutcome> outcomes) {
        String cycleId = cycle.id();
        if (cycle.isAbandoned()) {
            log.info("CYCLE_DISCARDED cycleId={} reason=abandoned", cycleId);
            return Mono.empty();
        }
        List<String> succeeded = new ArrayList<>();
        List<RawQuote> quotes = new ArrayList<>();
        for (ProviderOutcome outcome : outcomes) {
            if (outcome.ok()) {
                succeeded.add(outcome.provider());
                quotes.addAll(outcome.quotes());
            }
        }
        if (succeeded.isEmpty()) {
            return Mono.error(new AllProvidersFailedException(providers.size()));
        }

        Map<PairKey, ConsolidatedRate> consolidated = consolidator.consolidateAll(quotes);
        CycleValidationReport report = validationEngine.validateCycle(consolidated.values());

        List<ConsolidatedRate> accepted = new ArrayList<>();
        for (ConsolidatedRate rate : consolidated.values()) {
            ValidationResult result = report.results().get(rate.pair());
            if (report.isAccepted(rate.pair())) {
                accepted.add(rate.withValidation(result));
            } else {
                log.warn("RATE_REJECTED cycleId={} pair={} errors={}", cycleId, rate.pair(),
                         result == null ? List.of() : result.errors());
            }
        }
        int rejected = consolidated.size() - accepted.size();

        Mono<Boolean> reconnect = cache.isDurableConnected() ? Mono.just(true) : cache.connect();
        return reconnect
            .thenMany(Flux.fromIterable(accepted))
            .concatMap(cache::putConsolidated)
            .then(Mono.fromCallable(() -> {
                if (cycle.isAbandoned()) {
                    log.info("CYCLE_DISCARDED cycleId={} reason=abandoned stored={}", cycleId, accepted.size());
                    return null;
                }
                publisher.publishRates(accepted);
                log.info("CYCLE_COMPLETED cycleId={} providers={}/{} pairs={} rejected={} quality={}",
                         cycleId, succeeded.size(), providers.size(), accepted.size(), rejected,
                         report.overallQualityScore());
                return new RatesUpdatedEvent(cycleId, accepted, succeeded, providers.size(), succeeded.size(),
                                             report.overallQualityScore(), rejected,
                                             report.arbitrageOpportunities(), clock.instant());
            }));
    }

    private void onCycleSuccess(RatesUpdatedEvent event) {
        consecutiveFailures.set(0);
        lastUpdate.set(event.timestamp());
        dispatcher.ratesUpdated(event);
    }

    private void onCycleFailure(String cycleId, Throwable error) {
        int failures = consecutiveFailures.incrementAndGet();
        String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        lastError.set(reason);
        Instant now = clock.instant();

        if (failures >= settings.maxFailures()) {
            if (tripBreaker()) {
                log.error("INGESTION_CRITICAL_FAILURE cycleId={} consecutiveFailures={} lastError={}",
                          cycleId, failures, reason);
                dispatcher.criticalFailure(new CriticalFailureEvent(failures, reason, now));
            }
            return;
        }
        log.warn("CYCLE_FAILED cycleId={} consecutiveFailures={}/{} error={}",
                 cycleId, failures, settings.maxFailures(), reason);
        dispatcher.cycleFailed(new CycleFailedEvent(cycleId, reason, failures, settings.maxFailures(), now));
    }

    /** Only the caller that moves the state into FAILED gets {@code true}. */
    private boolean tripBreaker() {
        IngestionState current = state.get();
        while (current == IngestionState.RUNNING || current == IngestionState.STARTING) {
            if (state.compareAndSet(current, IngestionState.FAILED)) {
                haltTimerAndStreams();
                return true;
            }
            current = state.get();
        }
        return false;
    }

    private void haltTimerAndStreams() {
        Disposable t = timer;
        if (t != null) {
            t.dispose();
            timer = null;
        }
        streams.closeAll();
    }

    // ── Streaming ───────────────────────────────────────────────────────────

    void onStreamQuote(RawQuote quote) {
        ConsolidatedRate candidate = ConsolidatedRate.fromStreamingQuote(quote, STREAM_QUALITY);
        ValidationResult result = validationEngine.validateSingleRate(candidate);
        if (!result.valid()) {
            log.debug("STREAM_TICK_REJECTED provider={} pair={} errors={}", quote.provider(), quote.pair(), result.errors());
            return;
        }
        ConsolidatedRate tick = candidate
            .withQualityScore(result.flagged() ? FLAGGED_STREAM_QUALITY : STREAM_QUALITY)
            .withValidation(result);

        cache.putStreaming(tick)
            .subscribe(
                null,
                e -> log.warn("STREAM_TICK_CACHE_FAILED pair={} error={}", tick.pair(), e.getMessage()),
                () -> {
                    lastUpdate.set(tick.timestamp());
                    publisher.publishTick(tick);
                    dispatcher.streamRateUpdate(tick);
                });
    }

    // ── Queries ─────────────────────────────────────────────────────────────

    public Mono<IngestionHealth> health() {
        return cache.health().map(cacheHealth -> {
            List<ProviderStats> stats = getProviderStats();
            int healthy = (int) stats.stream().filter(ProviderStats::healthy).count();
            double pct = stats.isEmpty() ? 0.0 : healthy * 100.0 / stats.size();
            IngestionState current = state.get();

            String status;
            if (current == IngestionState.FAILED || consecutiveFailures.get() >= settings.maxFailures()) {
                status = "critical";
            } else if (current != IngestionState.RUNNING) {
                status = "stopped";
            } else if (pct < 50.0) {
                status = "degraded";
            } else {
                status = "running";
            }
            return new IngestionHealth(status, current, healthy, stats.size(), pct, stats, cacheHealth,
                                       consecutiveFailures.get(), settings.maxFailures(),
                                       streams.activeConnections(), lastUpdate.get(), lastError.get(),
                                       validationEngine.getValidationStats());
        });
    }

    public List<ProviderStats> getProviderStats() {
        return providers.stream().map(RateProvider::stats).toList();
    }

    public IngestionState state() {
        return state.get();
    }

    public int consecutiveFailures() {
        return consecutiveFailures.get();
    }

    public boolean isRunning() {
        return state.get() == IngestionState.RUNNING;
    }

    List<String> targetCurrencies() {
        String base = registry.getBaseCurrency();
        List<String> configured = settings.targetCurrencies().isEmpty()
            ? registry.getActiveCurrencies()
            : settings.targetCurrencies();
        return configured.stream()
            .map(String::toUpperCase)
            .filter(c -> !c.equals(base))
            .distinct()
            .toList();
    }

    private List<StreamingRateProvider> streamingProviders() {
        return providers.stream()
            .filter(RateProvider::supportsStreaming)
            .filter(StreamingRateProvider.class::isInstance)
            .map(StreamingRateProvider.class::cast)
            .toList();
    }

    private record ProviderOutcome(String provider, boolean ok, List<RawQuote> quotes) {

        static ProviderOutcome success(String provider, List<RawQuote> quotes) {
            return new ProviderOutcome(provider, true, quotes);
        }

        static ProviderOutcome failure(String provider) {
            return new ProviderOutcome(provider, false, List.of());
        }
    }

    /** One running cycle. Abandoning it cancels its fetches and suppresses every side effect still pending. */
    private static final class CycleHandle {

        private final String id;
        private final Sinks.One<Boolean> abandonSignal = Sinks.one();
        private volatile boolean abandoned;

        CycleHandle(String id) {
            this.id = id;
        }

        String id() {
            return id;
        }

        boolean isAbandoned() {
            return abandoned;
        }

        Mono<Boolean> abandonSignal() {
            return abandonSignal.asMono();
        }

        void abandon() {
            abandoned = true;
            abandonSignal.tryEmitValue(true);
        }
    }
}
