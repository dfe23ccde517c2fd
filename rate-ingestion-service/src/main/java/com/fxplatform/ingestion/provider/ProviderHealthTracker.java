package com.fxplatform.ingestion.provider;

import java.time.Clock;
import java.time.Instant;

/**
 * Mutable counters behind {@link ProviderStats}. Updated after every fetch attempt and stream
 * error of its own provider only; never reset while the process lives.
 *
 * <p>Success restores health. After a failure the provider is healthy while
 * {@code failures / requests < 0.5}.
 */
public class ProviderHealthTracker {

    private static final double UNHEALTHY_FAILURE_RATE = 0.5;

    private final String provider;
    private final double reliability;
    private final Clock clock;

    private long requests;
    private long successes;
    private long failures;
    private Instant lastSuccess;
    private Instant lastFailure;
    private double avgResponseTimeMs;
    private boolean healthy = true;

    public ProviderHealthTracker(String provider, double reliability, Clock clock) {
        this.provider    = provider;
        this.reliability = reliability;
        this.clock       = clock;
    }

    public synchronized void recordRequest() {
        requests++;
    }

    public synchronized void recordSuccess(long responseTimeMs) {
        successes++;
        lastSuccess = clock.instant();
        avgResponseTimeMs = ((avgResponseTimeMs * (successes - 1)) + responseTimeMs) / successes;
        healthy = true;
    }

    public synchronized void recordFailure() {
        failures++;
        lastFailure = clock.instant();
        double failureRate = (double) failures / Math.max(requests, 1);
        healthy = failureRate < UNHEALTHY_FAILURE_RATE;
    }

    public synchronized ProviderStats snapshot() {
        return new ProviderStats(provider, reliability, requests, successes, failures,
                                 lastSuccess, lastFailure, avgResponseTimeMs, healthy);
    }
}
