package com.delta.extractor.resilience;

import com.delta.extractor.config.ExtractorProperties;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named breakers, one per logical remote resource, built from the shared breaker settings.
 */
public class CircuitBreakerRegistry {
    public static final String DOWNLOAD = "download";
    public static final String ARTIFACT_DOCUMENT = "artifact-document";
    public static final String ARTIFACT_SCRIPT = "artifact-script";

    private final ExtractorProperties.Breaker settings;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(ExtractorProperties.Breaker settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public CircuitBreaker breaker(String name) {
        return breakers.computeIfAbsent(
            name,
            ignored -> new CircuitBreaker(
                name,
                settings.getFailureThreshold(),
                Duration.ofSeconds(settings.getRecoveryTimeoutSeconds()),
                settings.getRecoveryThreshold(),
                clock
            )
        );
    }

    public List<CircuitBreakerSnapshot> snapshots() {
        return breakers.values().stream()
            .map(CircuitBreaker::snapshot)
            .sorted(Comparator.comparing(CircuitBreakerSnapshot::name))
            .toList();
    }
}
