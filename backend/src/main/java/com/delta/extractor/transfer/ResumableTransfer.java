package com.delta.extractor.transfer;

import com.delta.extractor.config.ExtractorProperties;
import com.delta.extractor.error.ErrorKind;
import com.delta.extractor.error.ExtractorException;
import com.delta.extractor.error.HttpStatusException;
import com.delta.extractor.error.StateStoreException;
import com.delta.extractor.error.TransferDrainedException;
import com.delta.extractor.error.TransferFailedException;
import com.delta.extractor.error.TransportFailureException;
import com.delta.extractor.http.ResilientHttpClient;
import com.delta.extractor.model.JobState;
import com.delta.extractor.model.ResourceDescriptor;
import com.delta.extractor.model.ResumeInfo;
import com.delta.extractor.resilience.CircuitBreakerRegistry;
import com.delta.extractor.resilience.FailureClass;
import com.delta.extractor.resilience.FailureClassifier;
import com.delta.extractor.resilience.RetryExecutor;
import com.delta.extractor.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.http.HttpResponse;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Moves the bytes of one resource into {@code <target>.part}, checkpointing progress to the
 * {@link StateStore}, then renames the partial file over the target.
 *
 * <p>Resumes from {@code max(persisted progress, partial file size)} with a range request. A
 * changed ETag (or Last-Modified when there is no ETag) restarts the download from zero inside
 * the same attempt.
 */
@Service
public class ResumableTransfer {
    private static final Logger log = LoggerFactory.getLogger(ResumableTransfer.class);
    private static final Pattern CONTENT_RANGE_TOTAL = Pattern.compile("bytes\\s+\\d+-\\d+/(\\d+)");

    private final ResilientHttpClient httpClient;
    private final StateStore stateStore;
    private final RetryExecutor retryExecutor;
    private final CircuitBreakerRegistry breakers;
    private final ExtractorProperties.Transfer properties;
    private final Clock clock;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public ResumableTransfer(
        ResilientHttpClient httpClient,
        StateStore stateStore,
        RetryExecutor retryExecutor,
        CircuitBreakerRegistry breakers,
        ExtractorProperties properties,
        Clock clock
    ) {
        this.httpClient = httpClient;
        this.stateStore = stateStore;
        this.retryExecutor = retryExecutor;
        this.breakers = breakers;
        this.properties = properties.getTransfer();
        this.clock = clock;
    }

    /**
     * Asks running transfers to stop after their current chunk. Progress is checkpointed and
     * the job stays resumable.
     */
    public void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            log.info("Stop requested; in-flight transfers will checkpoint and drain");
        }
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public Path transfer(String jobId, ResourceDescriptor descriptor, String targetPath) {
        if (descriptor == null || !descriptor.hasUrl()) {
            throw new TransferFailedException(
                ErrorKind.TERMINAL_REQUEST,
                jobId,
                descriptor,
                new ExtractorException(ErrorKind.TERMINAL_REQUEST, "Resource reference is missing")
            );
        }
        if (targetPath == null || targetPath.isBlank()) {
            throw new TransferFailedException(
                ErrorKind.TERMINAL_REQUEST,
                jobId,
                descriptor,
                new ExtractorException(ErrorKind.TERMINAL_REQUEST, "Target path is missing")
            );
        }

        Path target = Path.of(targetPath);
        Path partFile = stateStore.partPath(targetPath);
        try {
            JobState state = loadOrCreate(jobId, descriptor, targetPath);
            if (stopRequested.get()) {
                throw new TransferDrainedException(jobId, state.bytesCompleted());
            }
            createParentDirectories(partFile);
            long written = retryExecutor.execute(
                "download " + jobId,
                breakers.breaker(CircuitBreakerRegistry.DOWNLOAD),
                () -> runAttempt(jobId, descriptor.url(), targetPath, partFile)
            );
            finalizeTransfer(jobId, partFile, target, written);
            return target;
        } catch (TransferDrainedException e) {
            log.info("Transfer {} drained at {} bytes; resumable", jobId, e.bytesCompleted());
            throw e;
        } catch (RuntimeException e) {
            ErrorKind kind = kindOf(e);
            log.warn("Transfer {} failed ({}): {}", jobId, kind, e.getMessage());
            recordFailure(jobId, e.getMessage(), kind == ErrorKind.TERMINAL_REQUEST);
            throw new TransferFailedException(kind, jobId, descriptor, e);
        }
    }

    private JobState loadOrCreate(String jobId, ResourceDescriptor descriptor, String targetPath) {
        Optional<JobState> existing = stateStore.getJob(jobId);
        if (existing.isEmpty()) {
            JobState created = JobState.pending(jobId, descriptor, targetPath, clock.instant());
            stateStore.putJob(created);
            log.info("Created job {} for {}", jobId, descriptor.resourceId());
            return created;
        }
        JobState state = existing.get();
        if (!descriptor.url().equals(state.resourceUrl())) {
            state = state.withResourceUrl(descriptor.url());
            stateStore.putJob(state);
        }
        log.info("Resuming job {} ({} bytes persisted, status {})", jobId, state.bytesCompleted(), state.status().value());
        return state;
    }

    private long runAttempt(String jobId, String url, String targetPath, Path partFile)
        throws IOException, InterruptedException {
        JobState state = stateStore.getJob(jobId)
            .orElseThrow(() -> new ExtractorException(ErrorKind.STATE_INCONSISTENCY, "Job " + jobId + " disappeared"));
        ResumeInfo resume = stateStore.resumeInfo(jobId, targetPath);
        long offset = resume.offset();
        long onDisk = Files.exists(partFile) ? Files.size(partFile) : 0L;
        if (offset > onDisk) {
            log.warn("Job {} checkpoint {} is past the partial file size {}; resuming from {}", jobId, offset, onDisk, onDisk);
            offset = onDisk;
        }
        if (offset < state.bytesCompleted()) {
            stateStore.rewindProgress(jobId, offset, resume.etag(), resume.lastModified());
        }

        Long totalLength = state.totalLength();
        if (offset > 0 && totalLength != null && offset > totalLength) {
            log.warn("Job {} partial file has {} bytes but the resource has {}; restarting from byte 0", jobId, offset, totalLength);
            offset = 0L;
            stateStore.rewindProgress(jobId, 0L, null, null);
            resume = ResumeInfo.fresh();
        }
        if (offset > 0 && totalLength != null && offset == totalLength) {
            log.info("Job {} already has all {} bytes; finalizing without a request", jobId, totalLength);
            return offset;
        }
        if (stopRequested.get()) {
            throw new TransferDrainedException(jobId, offset);
        }

        HttpResponse<InputStream> response = httpClient.openStream(url, offset);
        if (offset > 0) {
            if (response.statusCode() != 206) {
                closeQuietly(response);
                throw new HttpStatusException(response.statusCode(), url, "Resumed request was not answered with 206");
            }
            if (validatorChanged(resume, response)) {
                log.warn("Resource for job {} changed since the last checkpoint; restarting from byte 0", jobId);
                closeQuietly(response);
                offset = 0L;
                stateStore.rewindProgress(jobId, 0L, null, null);
                response = httpClient.openStream(url, 0L);
            }
        }
        if (offset == 0 && (response.statusCode() < 200 || response.statusCode() >= 300)) {
            closeQuietly(response);
            throw new HttpStatusException(response.statusCode(), url, "Unexpected response status");
        }

        String etag = response.headers().firstValue("ETag").orElse(null);
        String lastModified = response.headers().firstValue("Last-Modified").orElse(null);
        Long expectedTotal = totalLengthOf(response, offset);
        if (expectedTotal != null && !expectedTotal.equals(state.totalLength())) {
            stateStore.getJob(jobId).ifPresent(current -> stateStore.putJob(current.withTotalLength(expectedTotal)));
        }
        stateStore.updateProgress(jobId, offset, etag, lastModified);
        return copyBody(jobId, response, partFile, offset, expectedTotal, etag, lastModified);
    }

    private long copyBody(
        String jobId,
        HttpResponse<InputStream> response,
        Path partFile,
        long offset,
        Long expectedTotal,
        String etag,
        String lastModified
    ) throws IOException {
        OpenOption[] options = offset > 0
            ? new OpenOption[] {StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND}
            : new OpenOption[] {StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING};
        byte[] buffer = new byte[properties.getChunkSizeBytes()];
        int checkpointInterval = properties.getCheckpointIntervalChunks();
        long bytes = offset;
        long chunks = 0;
        try (InputStream body = response.body(); OutputStream out = Files.newOutputStream(partFile, options)) {
            while (true) {
                int read;
                try {
                    read = body.readNBytes(buffer, 0, buffer.length);
                } catch (IOException e) {
                    out.flush();
                    stateStore.updateProgress(jobId, bytes, etag, lastModified);
                    throw new TransportFailureException("connection_reset", "Body read failed at byte " + bytes + ": " + e.getMessage(), e);
                }
                if (read <= 0) {
                    break;
                }
                out.write(buffer, 0, read);
                bytes += read;
                chunks++;
                if (chunks % checkpointInterval == 0) {
                    out.flush();
                    stateStore.updateProgress(jobId, bytes, etag, lastModified);
                    logProgress(jobId, bytes, expectedTotal);
                }
                if (stopRequested.get()) {
                    out.flush();
                    stateStore.updateProgress(jobId, bytes, etag, lastModified);
                    throw new TransferDrainedException(jobId, bytes);
                }
            }
            out.flush();
        }
        if (expectedTotal != null && bytes < expectedTotal) {
            stateStore.updateProgress(jobId, bytes, etag, lastModified);
            throw new TransportFailureException(
                "connection_reset",
                "Body ended at byte " + bytes + " of " + expectedTotal
            );
        }
        stateStore.updateProgress(jobId, bytes, etag, lastModified);
        return bytes;
    }

    private void finalizeTransfer(String jobId, Path partFile, Path target, long expectedSize) {
        try {
            if (!Files.exists(partFile)) {
                throw new ExtractorException(ErrorKind.TERMINAL_REQUEST, "Partial file " + partFile + " is missing");
            }
            long finalSize = Files.size(partFile);
            if (finalSize != expectedSize) {
                log.warn("Job {} partial file has {} bytes, expected {}", jobId, finalSize, expectedSize);
            }
            Files.deleteIfExists(target);
            try {
                Files.move(partFile, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(partFile, target, StandardCopyOption.REPLACE_EXISTING);
            }
            stateStore.getJob(jobId).ifPresent(state -> stateStore.putJob(state.completed(finalSize, clock.instant())));
            stateStore.deleteJob(jobId);
            log.info("Transfer {} completed: {} ({} bytes)", jobId, target, finalSize);
        } catch (IOException e) {
            throw new ExtractorException(ErrorKind.TERMINAL_REQUEST, "Cannot finalize " + target + ": " + e.getMessage(), e);
        }
    }

    private static boolean validatorChanged(ResumeInfo resume, HttpResponse<InputStream> response) {
        if (resume.etag() != null) {
            Optional<String> etag = response.headers().firstValue("ETag");
            return etag.isPresent() && !etag.get().equals(resume.etag());
        }
        if (resume.lastModified() != null) {
            Optional<String> lastModified = response.headers().firstValue("Last-Modified");
            return lastModified.isPresent() && !lastModified.get().equals(resume.lastModified());
        }
        return false;
    }

    private static Long totalLengthOf(HttpResponse<InputStream> response, long offset) {
        Optional<String> contentRange = response.headers().firstValue("Content-Range");
        if (contentRange.isPresent()) {
            Matcher matcher = CONTENT_RANGE_TOTAL.matcher(contentRange.get().trim().toLowerCase(Locale.ROOT));
            if (matcher.matches()) {
                return Long.parseLong(matcher.group(1));
            }
        }
        Optional<String> contentLength = response.headers().firstValue("Content-Length");
        if (contentLength.isPresent()) {
            try {
                return Long.parseLong(contentLength.get().trim()) + offset;
            } catch (NumberFormatException e) {
                log.debug("Ignoring malformed Content-Length {}", contentLength.get());
            }
        }
        return null;
    }

    private void logProgress(String jobId, long bytes, Long expectedTotal) {
        if (expectedTotal != null && expectedTotal > 0) {
            log.debug("Job {} checkpoint at {} bytes ({}%)", jobId, bytes, String.format("%.1f", bytes * 100.0 / expectedTotal));
        } else {
            log.debug("Job {} checkpoint at {} bytes", jobId, bytes);
        }
    }

    private void recordFailure(String jobId, String message, boolean terminal) {
        try {
            stateStore.recordFailure(jobId, message, terminal);
        } catch (StateStoreException | IllegalArgumentException e) {
            log.warn("Could not record failure for job {}", jobId, e);
        }
    }

    private static ErrorKind kindOf(RuntimeException error) {
        if (error instanceof ExtractorException extractorException) {
            return extractorException.kind();
        }
        return FailureClassifier.classify(error) == FailureClass.RETRYABLE
            ? ErrorKind.TRANSIENT_NETWORK
            : ErrorKind.TERMINAL_REQUEST;
    }

    private static void createParentDirectories(Path partFile) {
        Path parent = partFile.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new ExtractorException(ErrorKind.TERMINAL_REQUEST, "Partial path " + partFile + " is not writable", e);
        }
    }

    private static void closeQuietly(HttpResponse<InputStream> response) {
        try (InputStream ignored = response.body()) {
            log.trace("Discarding body of {} response", response.statusCode());
        } catch (IOException e) {
            log.debug("Failed to close response body", e);
        }
    }
}
