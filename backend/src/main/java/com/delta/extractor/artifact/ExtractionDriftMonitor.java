package com.delta.extractor.artifact;

import com.delta.extractor.config.ExtractorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Tracks extraction outcomes and warns when the failure rate suggests the upstream
 * format has drifted away from the configured patterns.
 */
@Component
public class ExtractionDriftMonitor {
    private static final Logger log = LoggerFactory.getLogger(ExtractionDriftMonitor.class);

    private final double failureThreshold;
    private final int minSamples;
    private long attempts;
    private long failures;

    @Autowired
    public ExtractionDriftMonitor(ExtractorProperties properties) {
        this(properties.getArtifact().getDriftFailureThreshold(), properties.getArtifact().getDriftMinSamples());
    }

    ExtractionDriftMonitor(double failureThreshold, int minSamples) {
        this.failureThreshold = failureThreshold;
        this.minSamples = Math.max(1, minSamples);
    }

    public synchronized void recordAttempt(boolean success) {
        attempts++;
        if (!success) {
            failures++;
        }
        if (!success && isDrifting()) {
            log.warn(
                "Extraction drift: failure rate {}% over {} attempts ({} failures); patterns likely need updating",
                String.format("%.1f", failureRate() * 100.0),
                attempts,
                failures
            );
        }
    }

    public synchronized double failureRate() {
        return attempts == 0 ? 0.0 : (double) failures / attempts;
    }

    public synchronized boolean isDrifting() {
        return attempts >= minSamples && failureRate() > failureThreshold;
    }

    public synchronized long attempts() {
        return attempts;
    }
}
