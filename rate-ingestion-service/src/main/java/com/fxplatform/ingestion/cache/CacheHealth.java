package com.fxplatform.ingestion.cache;

public record CacheHealth(
    CacheStatus status,
    boolean durableConnected,
    int l1Size,
    long l1Hits,
    long l1Misses,
    long l2Hits,
    long l2Misses,
    long sets,
    long deletes,
    long errors,
    long totalRequests,
    double errorRate
) {}
