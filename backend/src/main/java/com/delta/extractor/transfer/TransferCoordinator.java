package com.delta.extractor.transfer;

import com.delta.extractor.config.ExtractorProperties;
import com.delta.extractor.error.StateStoreException;
import com.delta.extractor.error.TransferDrainedException;
import com.delta.extractor.error.TransferRejectedException;
import com.delta.extractor.model.JobState;
import com.delta.extractor.model.ResourceDescriptor;
import com.delta.extractor.state.StateStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for running transfers. Bounds how many run at once, refuses a second
 * submission for a job id that is still running, and drains in-flight work on shutdown.
 */
@Service
public class TransferCoordinator {
    private static final Logger log = LoggerFactory.getLogger(TransferCoordinator.class);

    private final ResumableTransfer transfer;
    private final StateStore stateStore;
    private final ResourceResolver resourceResolver;
    private final ExecutorService executor;
    private final ExtractorProperties.Transfer properties;
    private final Semaphore permits;
    private final Map<String, CompletableFuture<Path>> active = new ConcurrentHashMap<>();
    private final AtomicBoolean accepting = new AtomicBoolean(true);

    public TransferCoordinator(
        ResumableTransfer transfer,
        StateStore stateStore,
        ResourceResolver resourceResolver,
        @Qualifier("transferExecutor") ExecutorService executor,
        ExtractorProperties properties
    ) {
        this.transfer = transfer;
        this.stateStore = stateStore;
        this.resourceResolver = resourceResolver;
        this.executor = executor;
        this.properties = properties.getTransfer();
        this.permits = new Semaphore(this.properties.getMaxConcurrentTransfers());
    }

    public String newJobId() {
        return UUID.randomUUID().toString();
    }

    public CompletableFuture<Path> submit(String jobId, ResourceDescriptor descriptor, String targetPath) {
        if (!accepting.get()) {
            throw new TransferRejectedException(jobId, "shutting down");
        }
        CompletableFuture<Path> future = new CompletableFuture<>();
        if (active.putIfAbsent(jobId, future) != null) {
            throw new TransferRejectedException(jobId, "a transfer with this job id is already running");
        }
        try {
            executor.submit(() -> run(jobId, descriptor, targetPath, future));
        } catch (RejectedExecutionException e) {
            active.remove(jobId, future);
            throw new TransferRejectedException(jobId, "executor rejected the task");
        }
        log.info("Submitted transfer {} for {}", jobId, descriptor == null ? null : descriptor.resourceId());
        return future;
    }

    /**
     * Re-submits every pending or in-progress job found in the state directory. Jobs whose
     * descriptor cannot be resolved, or that are already running, are skipped.
     */
    public Map<String, CompletableFuture<Path>> resumeIncompleteJobs() {
        Map<String, JobState> incomplete = stateStore.listIncompleteJobs();
        Map<String, CompletableFuture<Path>> submitted = new LinkedHashMap<>();
        if (incomplete.isEmpty()) {
            log.info("No incomplete jobs to resume");
            return submitted;
        }
        log.info("Resuming {} incomplete job(s)", incomplete.size());
        for (JobState state : incomplete.values()) {
            if (active.containsKey(state.jobId())) {
                log.info("Job {} is already running", state.jobId());
                continue;
            }
            Optional<ResourceDescriptor> descriptor = resourceResolver.resolve(state);
            if (descriptor.isEmpty()) {
                log.warn("Cannot resolve resource {} for job {}; skipping", state.resourceId(), state.jobId());
                continue;
            }
            try {
                submitted.put(state.jobId(), submit(state.jobId(), descriptor.get(), state.targetPath()));
            } catch (TransferRejectedException e) {
                log.warn("Could not resume job {}: {}", state.jobId(), e.getMessage());
            }
        }
        return submitted;
    }

    public List<String> activeJobIds() {
        return new ArrayList<>(active.keySet());
    }

    public boolean isAccepting() {
        return accepting.get();
    }

    @PreDestroy
    public void shutdown() {
        if (!accepting.compareAndSet(true, false)) {
            return;
        }
        transfer.requestStop();
        List<CompletableFuture<Path>> running = new ArrayList<>(active.values());
        if (running.isEmpty()) {
            return;
        }
        log.info("Draining {} in-flight transfer(s)", running.size());
        try {
            CompletableFuture.allOf(running.toArray(new CompletableFuture[0]))
                .get(properties.getDrainTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Transfers still running after {}s drain timeout: {}", properties.getDrainTimeoutSeconds(), active.keySet());
        } catch (ExecutionException e) {
            log.info("Drain finished; at least one transfer ended with {}", e.getCause() == null ? e : e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining transfers");
        }
    }

    private void run(String jobId, ResourceDescriptor descriptor, String targetPath, CompletableFuture<Path> future) {
        boolean acquired = false;
        Path result = null;
        Throwable failure = null;
        try {
            permits.acquire();
            acquired = true;
            if (transfer.isStopRequested()) {
                failure = notStarted(jobId, descriptor, targetPath);
            } else {
                result = transfer.transfer(jobId, descriptor, targetPath);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = e;
        } catch (RuntimeException e) {
            failure = e;
        } finally {
            if (acquired) {
                permits.release();
            }
            active.remove(jobId, future);
        }
        // the job id is released before callers observe completion
        if (failure != null) {
            future.completeExceptionally(failure);
        } else {
            future.complete(result);
        }
    }

    // queued before shutdown; keep a record so the next start resumes it
    private TransferDrainedException notStarted(String jobId, ResourceDescriptor descriptor, String targetPath) {
        long persisted = 0L;
        try {
            Optional<JobState> existing = stateStore.getJob(jobId);
            if (existing.isPresent()) {
                persisted = existing.get().bytesCompleted();
            } else if (descriptor != null && descriptor.hasUrl() && targetPath != null && !targetPath.isBlank()) {
                stateStore.putJob(JobState.pending(jobId, descriptor, targetPath, Instant.now()));
            }
        } catch (StateStoreException | IllegalArgumentException e) {
            log.warn("Could not record queued job {} during shutdown", jobId, e);
        }
        log.info("Transfer {} not started; shutdown in progress", jobId);
        return new TransferDrainedException(jobId, persisted);
    }
}
