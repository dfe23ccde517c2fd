package com.fxplatform.ingestion.cache;

import com.fxplatform.common.event.AlertDirection;
import com.fxplatform.common.event.RateAlertEvent;
import com.fxplatform.common.exception.CurrencyValidationException;
import com.fxplatform.common.model.ConsolidatedRate;
import com.fxplatform.common.model.PairKey;
import com.fxplatform.ingestion.orchestrator.IngestionEventDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Threshold alerts on cached pairs. At most one alert per pair; setting a new one replaces it.
 * Checked on every cache write and notifies at most once per pair per {@link #NOTIFY_INTERVAL}.
 * Alerts live in process and are mirrored to the durable store with a 24 h expiry.
 */
public class RateAlertService {

    private static final Logger log = LoggerFactory.getLogger(RateAlertService.class);

    static final Duration ALERT_TTL       = Duration.ofHours(24);
    static final Duration NOTIFY_INTERVAL = Duration.ofSeconds(60);

    private final Map<PairKey, RateAlert> alerts = new ConcurrentHashMap<>();
    private final DurableRateStore durableStore;
    private final IngestionEventDispatcher dispatcher;
    private final Clock clock;

    public RateAlertService(DurableRateStore durableStore, IngestionEventDispatcher dispatcher, Clock clock) {
        this.durableStore = durableStore;
        this.dispatcher   = dispatcher;
        this.clock        = clock;
    }

    public Mono<RateAlert> setAlert(PairKey pair, double threshold, AlertDirection direction) {
        if (!Double.isFinite(threshold) || threshold <= 0) {
            return Mono.error(new CurrencyValidationException("threshold", "Threshold must be a positive number"));
        }
        RateAlert alert = RateAlert.create(pair, threshold, direction == null ? AlertDirection.BOTH : direction,
                                           clock.instant());
        alerts.put(pair, alert);
        log.info("RATE_ALERT_SET pair={} threshold={} direction={}", pair, threshold, alert.direction());
        return mirror(alert).thenReturn(alert);
    }

    public Mono<Boolean> removeAlert(PairKey pair) {
        boolean removed = alerts.remove(pair) != null;
        if (removed) {
            log.info("RATE_ALERT_REMOVED pair={}", pair);
        }
        return durableStore.deleteAlert(pair)
            .onErrorResume(e -> {
                log.warn("RATE_ALERT_MIRROR_FAILED pair={} error={}", pair, e.getMessage());
                return Mono.just(false);
            })
            .thenReturn(removed);
    }

    public Optional<RateAlert> getAlert(PairKey pair) {
        return Optional.ofNullable(alerts.get(pair));
    }

    public List<RateAlert> getAlerts() {
        return alerts.values().stream()
            .sorted(Comparator.comparing(a -> a.pair().symbol()))
            .toList();
    }

    /**
     * Evaluates the alert for {@code rate.pair()}, if any. On trigger the alert's statistics are
     * updated, listeners are notified and the updated alert is mirrored.
     */
    public Mono<Void> evaluate(ConsolidatedRate rate) {
        Instant now = clock.instant();
        AtomicReference<RateAlert> fired = new AtomicReference<>();
        alerts.computeIfPresent(rate.pair(), (pair, alert) -> {
            if (!alert.isBreachedBy(rate.rate())) {
                return alert;
            }
            if (alert.lastTriggered() != null && now.isBefore(alert.lastTriggered().plus(NOTIFY_INTERVAL))) {
                return alert;
            }
            RateAlert updated = alert.triggered(now);
            fired.set(updated);
            return updated;
        });

        RateAlert updated = fired.get();
        if (updated == null) {
            return Mono.empty();
        }
        log.info("RATE_ALERT_TRIGGERED pair={} rate={} threshold={} direction={} count={}",
                 updated.pair(), rate.rate(), updated.threshold(), updated.direction(), updated.triggerCount());
        dispatcher.rateAlert(new RateAlertEvent(updated.pair(), rate.rate(), updated.threshold(),
                                                updated.direction(), updated.triggerCount(), now));
        return mirror(updated);
    }

    private Mono<Void> mirror(RateAlert alert) {
        return durableStore.saveAlert(alert, ALERT_TTL)
            .onErrorResume(e -> {
                log.warn("RATE_ALERT_MIRROR_FAILED pair={} error={}", alert.pair(), e.getMessage());
                return Mono.empty();
            });
    }
}
