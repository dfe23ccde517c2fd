package com.fxplatform.ingestion.orchestrator;

import com.fxplatform.common.event.CriticalFailureEvent;
import com.fxplatform.common.event.CycleFailedEvent;
import com.fxplatform.common.event.IngestionListener;
import com.fxplatform.common.event.RateAlertEvent;
import com.fxplatform.common.event.RatesUpdatedEvent;
import com.fxplatform.common.model.ConsolidatedRate;
import com.fxplatform.common.validation.AnomalyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Delivers ingestion events to every registered {@link IngestionListener}. Each listener is
 * invoked in isolation: an exception is logged and the remaining listeners still run.
 */
public class IngestionEventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(IngestionEventDispatcher.class);

    private final List<IngestionListener> listeners = new CopyOnWriteArrayList<>();

    public IngestionEventDispatcher() {}

    public IngestionEventDispatcher(List<IngestionListener> listeners) {
        this.listeners.addAll(listeners);
    }

    public void register(IngestionListener listener) {
        listeners.add(listener);
    }

    public void unregister(IngestionListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void ratesUpdated(RatesUpdatedEvent event) {
        dispatch("ratesUpdated", l -> l.onRatesUpdated(event));
    }

    public void streamRateUpdate(ConsolidatedRate tick) {
        dispatch("streamRateUpdate", l -> l.onStreamRateUpdate(tick));
    }

    public void anomaly(AnomalyEvent event) {
        dispatch("anomaly", l -> l.onAnomaly(event));
    }

    public void cycleFailed(CycleFailedEvent event) {
        dispatch("cycleFailed", l -> l.onCycleFailed(event));
    }

    public void criticalFailure(CriticalFailureEvent event) {
        dispatch("criticalFailure", l -> l.onCriticalFailure(event));
    }

    public void rateAlert(RateAlertEvent event) {
        dispatch("rateAlert", l -> l.onRateAlert(event));
    }

    private void dispatch(String eventName, Consumer<IngestionListener> call) {
        for (IngestionListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                log.warn("LISTENER_FAILED event={} listener={} error={}",
                         eventName, listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
