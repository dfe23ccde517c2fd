package com.fxplatform.common.model;

/** How a rate returned by the cache read API was obtained. */
public enum RateProvenance {
    DIRECT,
    INVERSE,
    CROSS,
    IDENTITY
}
