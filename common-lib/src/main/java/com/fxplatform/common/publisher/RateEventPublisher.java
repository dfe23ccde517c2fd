package com.fxplatform.common.publisher;

import com.fxplatform.common.model.ConsolidatedRate;

import java.util.Collection;

/**
 * Fan-out of accepted rates to the message bus, keyed by {@code "BASE/QUOTE"}.
 *
 * <p>Implementations MUST be fire-and-forget: no {@code .block()}, no exception escaping to the
 * caller. A failed publish is logged and dropped; consumers read the cache, not the bus, as the
 * source of truth.
 *
 * <p>Implementations: {@code KafkaRateEventPublisher} ({@code fx.events.publisher=kafka}, default)
 * and {@code LoggingRateEventPublisher} ({@code fx.events.publisher=log}).
 */
public interface RateEventPublisher {

    /** One message per consolidated rate of a completed cycle. */
    void publishRates(Collection<ConsolidatedRate> rates);

    /** A single accepted streaming tick. */
    void publishTick(ConsolidatedRate tick);
}
