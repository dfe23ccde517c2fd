package com.fxplatform.ingestion.notification;

import com.fxplatform.common.event.CriticalFailureEvent;
import com.fxplatform.common.event.IngestionListener;
import com.fxplatform.common.event.RateAlertEvent;
import com.fxplatform.common.validation.AnomalyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

/**
 * Posts operator-facing ingestion events to a Slack incoming webhook: critical failures,
 * rate anomalies and threshold alerts. When Slack is disabled the event is logged instead.
 */
@Component
public class SlackAlertNotifier implements IngestionListener {

    private static final Logger log = LoggerFactory.getLogger(SlackAlertNotifier.class);

    private final WebClient webClient;

    @Value("${notification.slack.webhook-url:}")
    private String slackWebhookUrl;

    @Value("${notification.slack.enabled:false}")
    private boolean slackEnabled;

    public SlackAlertNotifier(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    @Override
    public void onCriticalFailure(CriticalFailureEvent event) {
        String message = String.format("*🚨 FX ingestion halted* after %d consecutive failed cycles%nLast error: `%s`",
                                       event.consecutiveFailures(), event.lastError());
        send("criticalFailure", message);
    }

    @Override
    public void onAnomaly(AnomalyEvent event) {
        String message = String.format("*⚠️ Rate anomaly* `%s` rate=%.6f z=%.2f (mean %.6f, σ %.6f)",
                                       event.pair(), event.rate(), event.zScore(), event.mean(), event.stdDev());
        send("anomaly", message);
    }

    @Override
    public void onRateAlert(RateAlertEvent event) {
        String message = String.format("*🔔 Rate alert* `%s` rate=%.6f threshold=%.6f direction=%s (trigger #%d)",
                                       event.pair(), event.currentRate(), event.threshold(),
                                       event.direction(), event.triggerCount());
        send("rateAlert", message);
    }

    void send(String eventName, String message) {
        if (!isEnabled()) {
            log.info("Slack disabled. Logging event instead. event={} message={}", eventName, message);
            return;
        }
        webClient.post()
            .uri(slackWebhookUrl)
            .bodyValue(Map.of("text", message))
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r -> log.info("Slack notification sent. event={} status={}", eventName, r.getStatusCode()),
                e -> log.error("Slack notification failed. event={}", eventName, e)
            );
    }

    boolean isEnabled() {
        return slackEnabled && slackWebhookUrl != null && !slackWebhookUrl.isBlank();
    }
}
