package com.fxplatform.ingestion.cache;

public enum CacheStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
