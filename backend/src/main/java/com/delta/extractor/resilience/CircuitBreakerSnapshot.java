package com.delta.extractor.resilience;

import java.time.Instant;

public record CircuitBreakerSnapshot(
    String name,
    CircuitState state,
    int failureCount,
    int successCount,
    Instant lastFailureTime,
    int failureThreshold,
    long recoveryTimeoutSeconds,
    int recoveryThreshold
) {
}
