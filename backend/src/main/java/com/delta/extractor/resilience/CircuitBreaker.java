package com.delta.extractor.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Failure/recovery state machine for one logical resource.
 *
 * <p>CLOSED lets every attempt through and opens after {@code failureThreshold} consecutive
 * failures. OPEN rejects attempts until {@code recoveryTimeout} has passed since the last
 * failure, then moves to HALF_OPEN. HALF_OPEN lets probes through; {@code recoveryThreshold}
 * successes close the breaker, a single failure reopens it.
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int recoveryThreshold;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureTime;

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout, int recoveryThreshold, Clock clock) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.recoveryTimeout = recoveryTimeout == null || recoveryTimeout.isNegative() ? Duration.ZERO : recoveryTimeout;
        this.recoveryThreshold = Math.max(1, recoveryThreshold);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public String name() {
        return name;
    }

    public synchronized boolean canAttempt() {
        if (state == CircuitState.CLOSED) {
            return true;
        }
        if (state == CircuitState.OPEN) {
            if (recoveryWindowElapsed()) {
                halfOpen();
                return true;
            }
            return false;
        }
        return true;
    }

    public synchronized void recordSuccess() {
        if (state == CircuitState.HALF_OPEN) {
            successCount++;
            if (successCount >= recoveryThreshold) {
                close();
            }
        } else if (state == CircuitState.CLOSED) {
            failureCount = 0;
        }
    }

    public synchronized void recordFailure() {
        failureCount++;
        lastFailureTime = clock.instant();
        if (state == CircuitState.HALF_OPEN) {
            open();
        } else if (state == CircuitState.CLOSED && failureCount >= failureThreshold) {
            open();
        }
    }

    public synchronized CircuitState state() {
        return state;
    }

    public synchronized CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(
            name,
            state,
            failureCount,
            successCount,
            lastFailureTime,
            failureThreshold,
            recoveryTimeout.toSeconds(),
            recoveryThreshold
        );
    }

    private boolean recoveryWindowElapsed() {
        if (lastFailureTime == null) {
            return true;
        }
        return Duration.between(lastFailureTime, clock.instant()).compareTo(recoveryTimeout) >= 0;
    }

    private void open() {
        state = CircuitState.OPEN;
        successCount = 0;
        log.warn("Circuit breaker {} OPENED after {} failure(s); rejecting attempts for {}s",
            name, failureCount, recoveryTimeout.toSeconds());
    }

    private void halfOpen() {
        state = CircuitState.HALF_OPEN;
        successCount = 0;
        log.info("Circuit breaker {} HALF_OPEN; probing recovery", name);
    }

    private void close() {
        state = CircuitState.CLOSED;
        failureCount = 0;
        successCount = 0;
        log.info("Circuit breaker {} CLOSED; normal operation resumed", name);
    }
}
