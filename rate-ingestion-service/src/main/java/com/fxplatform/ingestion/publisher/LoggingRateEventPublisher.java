package com.fxplatform.ingestion.publisher;

import com.fxplatform.common.model.ConsolidatedRate;
import com.fxplatform.common.publisher.RateEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Publisher for local runs without a broker ({@code fx.events.publisher=log}).
 */
public class LoggingRateEventPublisher implements RateEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingRateEventPublisher.class);

    @Override
    public void publishRates(Collection<ConsolidatedRate> rates) {
        rates.forEach(r -> log.info("RATE_EVENT pair={} rate={} quality={} providers={}",
                                    r.pair(), r.rate(), r.qualityScore(), r.providers()));
    }

    @Override
    public void publishTick(ConsolidatedRate tick) {
        log.info("RATE_TICK pair={} rate={} quality={} provider={}",
                 tick.pair(), tick.rate(), tick.qualityScore(), tick.providers());
    }
}
