package com.fxplatform.ingestion.cache;

import com.fxplatform.common.event.AlertDirection;
import com.fxplatform.common.event.IngestionListener;
import com.fxplatform.common.event.RateAlertEvent;
import com.fxplatform.common.exception.CurrencyValidationException;
import com.fxplatform.common.model.ConsolidatedRate;
import com.fxplatform.common.model.PairKey;
import com.fxplatform.ingestion.orchestrator.IngestionEventDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class RateAlertServiceTest {

    private static final Instant START   = Instant.parse("2024-03-01T12:00:00Z");
    private static final PairKey USD_EUR = PairKey.of("USD", "EUR");

    private MutableClock clock;
    private InMemoryDurableRateStore store;
    private RateAlertService service;
    private List<RateAlertEvent> fired;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new InMemoryDurableRateStore(clock);
        fired = new CopyOnWriteArrayList<>();
        IngestionEventDispatcher dispatcher = new IngestionEventDispatcher(List.of(new IngestionListener() {
            @Override
            public void onRateAlert(RateAlertEvent event) {
                fired.add(event);
            }
        }));
        service = new RateAlertService(store, dispatcher, clock);
    }

    private static ConsolidatedRate rate(double value) {
        return new ConsolidatedRate(USD_EUR, value, null, null, null, 0.0, 90, 3, List.of("fxapi"),
            value, value, 0.9, START, List.of(), false, null);
    }

    // ── set / remove ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("managing alerts")
    class Managing {

        @Test
        @DisplayName("non-positive threshold is rejected")
        void invalidThreshold() {
            StepVerifier.create(service.setAlert(USD_EUR, 0.0, AlertDirection.ABOVE))
                .expectErrorSatisfies(e -> assertEquals("threshold",
                    assertInstanceOf(CurrencyValidationException.class, e).getField()))
                .verify();
            assertTrue(service.getAlerts().isEmpty());
        }

        @Test
        @DisplayName("direction defaults to BOTH, alert is mirrored with a 24h expiry")
        void defaultsAndMirror() {
            StepVerifier.create(service.setAlert(USD_EUR, 0.95, null))
                .assertNext(a -> {
                    assertEquals(AlertDirection.BOTH, a.direction());
                    assertEquals(START, a.createdAt());
                    assertEquals(0, a.triggerCount());
                })
                .verifyComplete();

            assertNotNull(store.storedAlert(USD_EUR));
            assertEquals(Duration.ofHours(24), store.alertTtls.get(USD_EUR));
        }

        @Test
        @DisplayName("a new alert replaces the pair's existing one")
        void replaces() {
            service.setAlert(USD_EUR, 0.95, AlertDirection.ABOVE).block();
            service.setAlert(USD_EUR, 0.90, AlertDirection.BELOW).block();

            assertEquals(1, service.getAlerts().size());
            assertEquals(AlertDirection.BELOW, service.getAlert(USD_EUR).orElseThrow().direction());
        }

        @Test
        @DisplayName("durable store outage does not fail setting or removing")
        void mirrorFailure() {
            store.failing = true;

            StepVerifier.create(service.setAlert(USD_EUR, 0.95, AlertDirection.ABOVE))
                .expectNextCount(1)
                .verifyComplete();
            StepVerifier.create(service.removeAlert(USD_EUR))
                .expectNext(true)
                .verifyComplete();
        }

        @Test
        void removeUnknown() {
            StepVerifier.create(service.removeAlert(USD_EUR))
                .expectNext(false)
                .verifyComplete();
        }
    }

    // ── evaluation ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("evaluation")
    class Evaluation {

        @Test
        @DisplayName("ABOVE fires once per minute while breached")
        void rateLimited() {
            service.setAlert(USD_EUR, 0.95, AlertDirection.ABOVE).block();

            service.evaluate(rate(0.94)).block();
            assertTrue(fired.isEmpty());

            service.evaluate(rate(0.96)).block();
            service.evaluate(rate(0.97)).block();
            assertEquals(1, fired.size());
            assertEquals(0.96, fired.get(0).currentRate());

            clock.advance(Duration.ofSeconds(60));
            service.evaluate(rate(0.97)).block();
            assertEquals(2, fired.size());
            assertEquals(2, fired.get(1).triggerCount());

            RateAlert stored = store.storedAlert(USD_EUR);
            assertEquals(2, stored.triggerCount());
            assertEquals(START.plusSeconds(60), stored.lastTriggered());
        }

        @Test
        @DisplayName("BELOW fires under the threshold only")
        void below() {
            service.setAlert(USD_EUR, 0.90, AlertDirection.BELOW).block();

            service.evaluate(rate(0.91)).block();
            service.evaluate(rate(0.89)).block();

            assertEquals(1, fired.size());
            assertEquals(AlertDirection.BELOW, fired.get(0).direction());
        }

        @Test
        @DisplayName("BOTH ignores moves within 1% of the threshold")
        void both() {
            service.setAlert(USD_EUR, 1.00, AlertDirection.BOTH).block();

            service.evaluate(rate(1.005)).block();
            assertTrue(fired.isEmpty());

            service.evaluate(rate(0.98)).block();
            assertEquals(1, fired.size());
        }

        @Test
        @DisplayName("pairs without an alert are ignored")
        void noAlert() {
            StepVerifier.create(service.evaluate(rate(5.0))).verifyComplete();
            assertTrue(fired.isEmpty());
        }
    }
}
