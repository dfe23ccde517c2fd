package com.fxplatform.common.validation;

@FunctionalInterface
public interface AnomalyListener {
    void anomalyDetected(AnomalyEvent event);
}
