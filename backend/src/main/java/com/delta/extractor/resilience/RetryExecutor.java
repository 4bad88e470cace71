package com.delta.extractor.resilience;

import com.delta.extractor.config.ExtractorProperties;
import com.delta.extractor.error.BreakerOpenException;
import com.delta.extractor.error.ErrorKind;
import com.delta.extractor.error.ExtractorException;
import com.delta.extractor.error.TransferDrainedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Runs an operation up to {@code maxRetries + 1} times, gated by an optional breaker.
 * Attempts are sequential; the only wait between them is the backoff sleep.
 */
public class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    @FunctionalInterface
    public interface Attempt<T> {
        T call() throws Exception;
    }

    private final int maxRetries;
    private final double backoffBase;
    private final double jitterMaxSeconds;
    private final Sleeper sleeper;

    public RetryExecutor(int maxRetries, double backoffBase, double jitterMaxSeconds, Sleeper sleeper) {
        this.maxRetries = Math.max(0, maxRetries);
        this.backoffBase = Math.max(0.0, backoffBase);
        this.jitterMaxSeconds = Math.max(0.0, jitterMaxSeconds);
        this.sleeper = sleeper == null ? Sleeper.THREAD : sleeper;
    }

    public static RetryExecutor fromProperties(ExtractorProperties.Retry retry, Sleeper sleeper) {
        return new RetryExecutor(retry.getMaxRetries(), retry.getBackoffBase(), retry.getJitterMaxSeconds(), sleeper);
    }

    public int maxRetries() {
        return maxRetries;
    }

    public <T> T execute(String operationName, Attempt<T> operation) {
        return execute(operationName, null, operation);
    }

    public <T> T execute(String operationName, CircuitBreaker breaker, Attempt<T> operation) {
        Exception lastError = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (breaker != null && !breaker.canAttempt()) {
                throw new BreakerOpenException(breaker.name(), operationName);
            }
            try {
                T result = operation.call();
                if (breaker != null) {
                    breaker.recordSuccess();
                }
                return result;
            } catch (TransferDrainedException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExtractorException(ErrorKind.TRANSIENT_NETWORK, operationName + " interrupted", e);
            } catch (Exception e) {
                lastError = e;
                if (breaker != null) {
                    breaker.recordFailure();
                }
                if (FailureClassifier.classify(e) == FailureClass.TERMINAL) {
                    log.warn("{} - terminal error, not retrying: {}", operationName, e.getMessage());
                    throw rethrowable(e);
                }
                if (attempt >= maxRetries) {
                    log.warn("{} - max retries exhausted after {} attempt(s): {}", operationName, attempt + 1, e.getMessage());
                    throw rethrowable(e);
                }
                Duration backoff = computeBackoff(attempt);
                log.warn(
                    "{} - attempt {}/{} failed, retrying in {}ms: {}",
                    operationName,
                    attempt + 1,
                    maxRetries + 1,
                    backoff.toMillis(),
                    e.getMessage()
                );
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new ExtractorException(
                        ErrorKind.TRANSIENT_NETWORK,
                        operationName + " interrupted during backoff",
                        e
                    );
                }
            }
        }
        throw rethrowable(lastError);
    }

    /**
     * {@code base^attempt + uniform(0, jitterMax)} seconds, attempt counted from 0.
     */
    public Duration computeBackoff(int attempt) {
        double exponential = Math.pow(backoffBase, Math.max(0, attempt));
        double jitter = jitterMaxSeconds > 0.0 ? ThreadLocalRandom.current().nextDouble(0.0, jitterMaxSeconds) : 0.0;
        long nanos = (long) ((exponential + jitter) * 1_000_000_000L);
        return Duration.ofNanos(Math.max(0L, nanos));
    }

    private static RuntimeException rethrowable(Exception error) {
        if (error == null) {
            return new IllegalStateException("retry loop finished without a result");
        }
        if (error instanceof RuntimeException runtime) {
            return runtime;
        }
        if (error instanceof IOException io) {
            return new UncheckedIOException(io.getMessage(), io);
        }
        return new ExtractorException(ErrorKind.TERMINAL_REQUEST, error.getMessage(), error);
    }
}
