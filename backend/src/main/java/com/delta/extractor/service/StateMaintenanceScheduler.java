package com.delta.extractor.service;

import com.delta.extractor.config.ExtractorProperties;
import com.delta.extractor.error.StateStoreException;
import com.delta.extractor.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodically deletes persisted artifacts older than {@code extractor.state.artifact-max-age-hours}.
 */
@Component
public class StateMaintenanceScheduler {
    private static final Logger log = LoggerFactory.getLogger(StateMaintenanceScheduler.class);

    private final StateStore stateStore;
    private final ExtractorProperties properties;

    public StateMaintenanceScheduler(StateStore stateStore, ExtractorProperties properties) {
        this.stateStore = stateStore;
        this.properties = properties;
    }

    @Scheduled(
        initialDelayString = "${extractor.state.cleanup-initial-delay-ms:60000}",
        fixedDelayString = "${extractor.state.cleanup-interval-ms:3600000}"
    )
    public void scheduledCleanup() {
        if (!properties.getState().isCleanupEnabled()) {
            return;
        }
        runCleanup();
    }

    public int runCleanup() {
        Duration maxAge = Duration.ofHours(properties.getState().getArtifactMaxAgeHours());
        try {
            int removed = stateStore.cleanupExpiredArtifacts(maxAge);
            if (removed > 0) {
                log.info("Removed {} artifact(s) older than {}h", removed, maxAge.toHours());
            }
            return removed;
        } catch (StateStoreException e) {
            log.warn("Artifact cleanup failed", e);
            return 0;
        }
    }
}
