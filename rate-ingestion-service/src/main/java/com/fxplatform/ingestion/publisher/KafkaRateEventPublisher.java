package com.fxplatform.ingestion.publisher;

import com.fxplatform.common.model.ConsolidatedRate;
import com.fxplatform.common.publisher.RateEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.util.Collection;

/**
 * Publishes each rate to the rates topic keyed by {@code "BASE/QUOTE"}, so all updates of one
 * pair land on the same partition in order.
 *
 * <p>Fire-and-forget: the send future is observed only for logging. Neither a failed send nor a
 * synchronous producer exception reaches the caller.
 */
public class KafkaRateEventPublisher implements RateEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(KafkaRateEventPublisher.class);

    private final KafkaTemplate<String, RateMessage> kafkaTemplate;
    private final String topic;
    private final Clock clock;

    public KafkaRateEventPublisher(KafkaTemplate<String, RateMessage> kafkaTemplate, String topic, Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic         = topic;
        this.clock         = clock;
    }

    @Override
    public void publishRates(Collection<ConsolidatedRate> rates) {
        rates.forEach(this::send);
        log.debug("RATES_PUBLISHED topic={} count={}", topic, rates.size());
    }

    @Override
    public void publishTick(ConsolidatedRate tick) {
        send(tick);
    }

    private void send(ConsolidatedRate rate) {
        String key = rate.pair().symbol();
        try {
            kafkaTemplate.send(topic, key, RateMessage.from(rate, clock.instant()))
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("RATE_PUBLISH_FAILED topic={} key={} error={}", topic, key, ex.getMessage());
                    } else {
                        log.debug("RATE_PUBLISHED topic={} key={} offset={}", topic, key,
                                  result.getRecordMetadata().offset());
                    }
                });
        } catch (RuntimeException e) {
            log.error("RATE_PUBLISH_FAILED topic={} key={} error={}", topic, key, e.getMessage());
        }
    }

    public String topic() {
        return topic;
    }
}
