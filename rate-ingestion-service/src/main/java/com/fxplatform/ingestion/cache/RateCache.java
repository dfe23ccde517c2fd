package com.fxplatform.ingestion.cache;

import com.fxplatform.common.model.ConsolidatedRate;
import com.fxplatform.common.model.PairKey;
import com.fxplatform.common.model.RateProvenance;
import com.fxplatform.common.model.ResolvedRate;
import com.fxplatform.common.registry.CurrencyRegistry;
import com.fxplatform.common.registry.RegistryChangeEvent;
import com.fxplatform.common.registry.RegistryChangeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Two-tier rate cache: a bounded in-process map in front of a {@link DurableRateStore}.
 *
 * <p>Writes go to L1 then L2; reads try L1 then L2, and an L2 hit backfills L1. The durable tier
 * is optional at runtime. A failure is logged and counted, and marks the tier disconnected; L2 is
 * then bypassed until {@link #connect()} succeeds again. Reads never fail; a pair that cannot be
 * resolved is empty.
 */
public class RateCache {

    private static final Logger log = LoggerFactory.getLogger(RateCache.class);

    public static final int DEFAULT_MAX_ENTRIES = 1000;
    public static final Duration DEFAULT_STREAMING_TTL = Duration.ofSeconds(60);

    private static final double DEGRADED_ERROR_RATE = 0.10;

    private final Map<PairKey, CachedRate> l1 = new ConcurrentHashMap<>();
    private final DurableRateStore durableStore;
    private final CurrencyRegistry registry;
    private final RateAlertService alertService;
    private final Clock clock;
    private final int maxEntries;
    private final Duration streamingTtl;

    private final AtomicBoolean durableConnected = new AtomicBoolean(false);

    // ── Stats ────────────────────────────────────────────────────────────────
    private final AtomicLong l1Hits        = new AtomicLong();
    private final AtomicLong l1Misses      = new AtomicLong();
    private final AtomicLong l2Hits        = new AtomicLong();
    private final AtomicLong l2Misses      = new AtomicLong();
    private final AtomicLong sets          = new AtomicLong();
    private final AtomicLong deletes       = new AtomicLong();
    private final AtomicLong errors        = new AtomicLong();
    private final AtomicLong totalRequests = new AtomicLong();

    public RateCache(DurableRateStore durableStore, CurrencyRegistry registry, RateAlertService alertService,
                     Clock clock, int maxEntries, Duration streamingTtl) {
        this.durableStore = durableStore;
        this.registry     = registry;
        this.alertService = alertService;
        this.clock        = clock;
        this.maxEntries   = maxEntries;
        this.streamingTtl = streamingTtl;
    }

    /** Probes the durable tier. Never fails; emits whether the tier is usable. */
    public Mono<Boolean> connect() {
        return durableStore.ping()
            .onErrorResume(e -> {
                log.warn("CACHE_DURABLE_UNAVAILABLE error={}", e.getMessage());
                return Mono.just(false);
            })
            .doOnNext(ok -> {
                boolean was = durableConnected.getAndSet(ok);
                if (ok && !was) {
                    log.info("CACHE_DURABLE_CONNECTED");
                }
            });
    }

    // ── Writes ──────────────────────────────────────────────────────────────

    /** Cycle result: no expiry, overwritten by the next cycle. */
    public Mono<Void> putConsolidated(ConsolidatedRate rate) {
        return put(rate, null);
    }

    /** Accepted streaming tick: expires after the streaming TTL in both tiers. */
    public Mono<Void> putStreaming(ConsolidatedRate rate) {
        return put(rate, streamingTtl);
    }

    private Mono<Void> put(ConsolidatedRate rate, Duration ttl) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            putL1(rate.pair(), new CachedRate(rate, now, ttl == null ? null : now.plus(ttl)));
            sets.incrementAndGet();
            Mono<Void> durableWrite = durableConnected.get()
                ? durableStore.save(rate, ttl).onErrorResume(e -> durableFailure("write", rate.pair(), e))
                : Mono.empty();
            return durableWrite.then(Mono.defer(() -> alertService.evaluate(rate)));
        });
    }

    public Mono<Void> evict(PairKey pair) {
        return Mono.defer(() -> {
            l1.remove(pair);
            deletes.incrementAndGet();
            if (!durableConnected.get()) {
                return Mono.empty();
            }
            return durableStore.delete(pair)
                .onErrorResume(e -> durableFailure("delete", pair, e).thenReturn(false))
                .then();
        });
    }

    /**
     * Drops every cached pair involving a currency that was deactivated or removed, so reads stop
     * resolving it from either tier. Registered as a {@link CurrencyRegistry} listener.
     */
    public void onRegistryChange(RegistryChangeEvent event) {
        if (event.type() != RegistryChangeType.CURRENCY_DEACTIVATED
            && event.type() != RegistryChangeType.CURRENCY_REMOVED) {
            return;
        }
        String code = event.currency();
        Set<PairKey> stale = new LinkedHashSet<>();
        for (PairKey pair : l1.keySet()) {
            if (pair.involves(code)) {
                stale.add(pair);
            }
        }
        String base = registry.getBaseCurrency();
        if (!code.equals(base)) {
            stale.add(PairKey.of(base, code));
            stale.add(PairKey.of(code, base));
        }
        log.info("CACHE_CURRENCY_EVICTED currency={} pairs={}", code, stale.size());
        Flux.fromIterable(stale)
            .concatMap(this::evict)
            .subscribe(null, e -> log.error("CACHE_EVICT_FAILED currency={} error={}", code, e.getMessage(), e));
    }

    // Synchronized so concurrent cycle and stream writes cannot both pass the size check.
    private synchronized void putL1(PairKey pair, CachedRate entry) {
        if (!l1.containsKey(pair) && l1.size() >= maxEntries) {
            l1.entrySet().stream()
                .min(Comparator.comparing(e -> e.getValue().cachedAt()))
                .ifPresent(oldest -> {
                    l1.remove(oldest.getKey());
                    log.debug("CACHE_L1_EVICTED pair={}", oldest.getKey());
                });
        }
        l1.put(pair, entry);
    }

    // ── Reads ───────────────────────────────────────────────────────────────

    /**
     * Resolves {@code from/to}: direct, then inverse of {@code to/from}, then cross through the
     * base currency (only when neither side is the base). Empty when none is cached.
     */
    public Mono<ResolvedRate> getRate(String from, String to) {
        PairKey pair = PairKey.of(from, to);
        if (pair.base().equals(pair.quote())) {
            return Mono.just(new ResolvedRate(pair, 1.0, 1.0, 1.0, 100, 0, List.of(),
                                              clock.instant(), false, RateProvenance.IDENTITY));
        }
        return lookup(pair).map(ResolvedRate::direct)
            .switchIfEmpty(Mono.defer(() -> lookup(pair.inverse()).map(ResolvedRate::inverse)))
            .switchIfEmpty(Mono.defer(() -> crossRate(pair)));
    }

    private Mono<ResolvedRate> crossRate(PairKey pair) {
        String base = registry.getBaseCurrency();
        if (pair.involves(base)) {
            return Mono.empty();
        }
        return Mono.zip(lookup(PairKey.of(base, pair.base())), lookup(PairKey.of(base, pair.quote())))
            .map(legs -> cross(pair, legs.getT1(), legs.getT2()));
    }

    /** {@code from/to = (base/to) / (base/from)}. */
    static ResolvedRate cross(PairKey pair, ConsolidatedRate fromLeg, ConsolidatedRate toLeg) {
        double rate = toLeg.rate() / fromLeg.rate();
        Double bid = toLeg.bid() != null && fromLeg.ask() != null ? toLeg.bid() / fromLeg.ask() : null;
        Double ask = toLeg.ask() != null && fromLeg.bid() != null ? toLeg.ask() / fromLeg.bid() : null;

        Set<String> providers = new LinkedHashSet<>(fromLeg.providers());
        providers.addAll(toLeg.providers());
        Instant timestamp = fromLeg.timestamp().isBefore(toLeg.timestamp()) ? fromLeg.timestamp() : toLeg.timestamp();

        return new ResolvedRate(pair, rate, bid, ask,
            Math.min(fromLeg.qualityScore(), toLeg.qualityScore()),
            Math.min(fromLeg.providerCount(), toLeg.providerCount()),
            new ArrayList<>(providers), timestamp,
            fromLeg.streaming() || toLeg.streaming(),
            RateProvenance.CROSS);
    }

    /** L1 then L2 for one stored pair. Expired L1 entries are dropped on read. */
    Mono<ConsolidatedRate> lookup(PairKey pair) {
        return Mono.defer(() -> {
            totalRequests.incrementAndGet();
            Instant now = clock.instant();
            CachedRate cached = l1.get(pair);
            if (cached != null && !cached.isExpired(now)) {
                l1Hits.incrementAndGet();
                return Mono.just(cached.rate());
            }
            if (cached != null) {
                l1.remove(pair, cached);
            }
            l1Misses.incrementAndGet();
            if (!durableConnected.get()) {
                return Mono.empty();
            }

            return durableStore.find(pair)
                .doOnNext(rate -> {
                    l2Hits.incrementAndGet();
                    Instant expiresAt = rate.streaming() ? now.plus(streamingTtl) : null;
                    putL1(pair, new CachedRate(rate, now, expiresAt));
                })
                .switchIfEmpty(Mono.fromRunnable(l2Misses::incrementAndGet))
                .onErrorResume(e -> durableFailure("read", pair, e));
        });
    }

    /**
     * Base-relative rates for {@code currencies}, or for every active non-base currency when
     * none are given.
     */
    public Mono<LatestRates> getLatestRates(Collection<String> currencies) {
        String base = registry.getBaseCurrency();
        List<String> wanted = (currencies == null || currencies.isEmpty()
                ? registry.getActiveCurrencies()
                : currencies).stream()
            .map(c -> c.trim().toUpperCase(Locale.ROOT))
            .filter(c -> !c.isEmpty() && !c.equals(base))
            .distinct()
            .toList();

        return Flux.fromIterable(wanted)
            .concatMap(currency -> lookup(PairKey.of(base, currency)))
            .collectList()
            .map(rates -> {
                Map<String, ConsolidatedRate> byCurrency = new LinkedHashMap<>();
                Instant lastUpdate = null;
                for (ConsolidatedRate rate : rates) {
                    byCurrency.put(rate.pair().quote(), rate);
                    if (lastUpdate == null || rate.timestamp().isAfter(lastUpdate)) {
                        lastUpdate = rate.timestamp();
                    }
                }
                return new LatestRates(base, byCurrency, lastUpdate, l1.size());
            });
    }

    // ── Health ──────────────────────────────────────────────────────────────

    /** Re-probes the durable tier, then reports. */
    public Mono<CacheHealth> health() {
        return connect().map(ok -> snapshot());
    }

    /** Current counters without probing. */
    public CacheHealth snapshot() {
        long requests = totalRequests.get();
        long errorCount = errors.get();
        double errorRate = requests == 0 ? 0.0 : (double) errorCount / requests;
        boolean connected = durableConnected.get();

        CacheStatus status;
        if (!connected) {
            status = CacheStatus.UNHEALTHY;
        } else if (errorRate > DEGRADED_ERROR_RATE) {
            status = CacheStatus.DEGRADED;
        } else {
            status = CacheStatus.HEALTHY;
        }
        return new CacheHealth(status, connected, l1.size(), l1Hits.get(), l1Misses.get(), l2Hits.get(),
                               l2Misses.get(), sets.get(), deletes.get(), errorCount, requests, errorRate);
    }

    public int size() {
        return l1.size();
    }

    public boolean isDurableConnected() {
        return durableConnected.get();
    }

    private <T> Mono<T> durableFailure(String operation, PairKey pair, Throwable e) {
        errors.incrementAndGet();
        if (durableConnected.getAndSet(false)) {
            log.warn("CACHE_DURABLE_DISCONNECTED operation={} pair={} error={}", operation, pair, e.getMessage());
        } else {
            log.debug("Durable cache {} failed. pair={} error={}", operation, pair, e.getMessage());
        }
        return Mono.empty();
    }
}
