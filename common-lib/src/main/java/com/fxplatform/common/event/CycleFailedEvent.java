package com.fxplatform.common.event;

import java.time.Instant;

public record CycleFailedEvent(String cycleId, String reason, int consecutiveFailures, int maxFailures, Instant timestamp) {}
