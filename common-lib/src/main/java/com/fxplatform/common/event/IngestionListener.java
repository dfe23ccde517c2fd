package com.fxplatform.common.event;

import com.fxplatform.common.model.ConsolidatedRate;
import com.fxplatform.common.validation.AnomalyEvent;

/**
 * Observer of ingestion outcomes. Every method has an empty default so a listener implements
 * only what it needs. Listeners are invoked independently: one throwing never stops the others
 * or the ingestion path.
 */
public interface IngestionListener {

    default void onRatesUpdated(RatesUpdatedEvent event) {}

    default void onStreamRateUpdate(ConsolidatedRate tick) {}

    default void onAnomaly(AnomalyEvent event) {}

    default void onCycleFailed(CycleFailedEvent event) {}

    default void onCriticalFailure(CriticalFailureEvent event) {}

    default void onRateAlert(RateAlertEvent event) {}
}
