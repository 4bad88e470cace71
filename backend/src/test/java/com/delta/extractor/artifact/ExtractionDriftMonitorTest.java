package com.delta.extractor.artifact;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionDriftMonitorTest {

    @Test
    void needsMinimumSamplesBeforeReportingDrift() {
        ExtractionDriftMonitor monitor = new ExtractionDriftMonitor(0.2, 10);
        for (int i = 0; i < 5; i++) {
            monitor.recordAttempt(false);
        }

        assertThat(monitor.failureRate()).isEqualTo(1.0);
        assertThat(monitor.isDrifting()).isFalse();
    }

    @Test
    void reportsDriftAboveThreshold() {
        ExtractionDriftMonitor monitor = new ExtractionDriftMonitor(0.2, 10);
        for (int i = 0; i < 7; i++) {
            monitor.recordAttempt(true);
        }
        for (int i = 0; i < 3; i++) {
            monitor.recordAttempt(false);
        }

        assertThat(monitor.attempts()).isEqualTo(10);
        assertThat(monitor.isDrifting()).isTrue();
    }

    @Test
    void rateAtThresholdIsNotDrift() {
        ExtractionDriftMonitor monitor = new ExtractionDriftMonitor(0.2, 10);
        for (int i = 0; i < 8; i++) {
            monitor.recordAttempt(true);
        }
        monitor.recordAttempt(false);
        monitor.recordAttempt(false);

        assertThat(monitor.isDrifting()).isFalse();
    }
}
