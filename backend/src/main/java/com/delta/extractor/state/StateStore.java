package com.delta.extractor.state;

import com.delta.extractor.error.StateStoreException;
import com.delta.extractor.model.ArtifactRecord;
import com.delta.extractor.model.JobState;
import com.delta.extractor.model.ResumeInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * File-backed store for job and artifact records. One JSON file per record; every write
 * goes to a temp file in the same directory and is renamed over the target.
 *
 * <p>Layout: {@code jobs/<jobId>.json}, {@code artifacts/<versionId>.json} and
 * {@code artifacts/by-url/<urlVersionId>.ref} (holds the version id). There is no
 * cross-process locking; one process owns a state directory.
 */
public class StateStore {
    private static final Logger log = LoggerFactory.getLogger(StateStore.class);
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]{1,200}");
    private static final String JSON = ".json";
    private static final String REF = ".ref";

    private final Path jobDir;
    private final Path artifactDir;
    private final Path urlIndexDir;
    private final Duration artifactTtl;
    private final String partSuffix;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public StateStore(Path stateDir, Duration artifactTtl, String partSuffix, ObjectMapper objectMapper, Clock clock) {
        this.jobDir = stateDir.resolve("jobs");
        this.artifactDir = stateDir.resolve("artifacts");
        this.urlIndexDir = artifactDir.resolve("by-url");
        this.artifactTtl = artifactTtl;
        this.partSuffix = partSuffix;
        this.objectMapper = objectMapper;
        this.clock = clock;
        try {
            Files.createDirectories(jobDir);
            Files.createDirectories(urlIndexDir);
        } catch (IOException e) {
            throw new StateStoreException("Cannot create state directory " + stateDir, e);
        }
    }

    // ---- jobs ----

    public void putJob(JobState state) {
        writeJson(jobFile(state.jobId()), state);
        log.debug("Saved job state {} ({} bytes, {})", state.jobId(), state.bytesCompleted(), state.status().value());
    }

    public Optional<JobState> getJob(String jobId) {
        Path file = jobFile(jobId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(readJson(file, JobState.class));
    }

    public void deleteJob(String jobId) {
        try {
            if (Files.deleteIfExists(jobFile(jobId))) {
                log.info("Deleted completed job state {}", jobId);
            }
        } catch (IOException e) {
            throw new StateStoreException("Cannot delete job " + jobId, e);
        }
    }

    /**
     * Checkpoint. Progress never moves backwards here; use {@link #rewindProgress} when the
     * partial output is discarded. Unknown job ids are logged and ignored.
     */
    public boolean updateProgress(String jobId, long bytesCompleted, String etag, String lastModified) {
        Optional<JobState> existing = getJob(jobId);
        if (existing.isEmpty()) {
            log.warn("Cannot update progress for unknown job {}", jobId);
            return false;
        }
        JobState state = existing.get();
        long bytes = Math.max(bytesCompleted, state.bytesCompleted());
        putJob(state.withProgress(bytes, etag, lastModified, clock.instant()));
        return true;
    }

    public boolean rewindProgress(String jobId, long bytesCompleted, String etag, String lastModified) {
        Optional<JobState> existing = getJob(jobId);
        if (existing.isEmpty()) {
            log.warn("Cannot rewind progress for unknown job {}", jobId);
            return false;
        }
        JobState state = existing.get();
        JobState rewound = new JobState(
            state.jobId(),
            state.resourceId(),
            state.variantId(),
            state.resourceUrl(),
            state.targetPath(),
            Math.max(0L, bytesCompleted),
            state.totalLength(),
            etag,
            lastModified,
            state.status(),
            state.retryCount(),
            clock.instant(),
            state.errorMessage(),
            state.createdAt()
        );
        putJob(rewound);
        return true;
    }

    public boolean recordFailure(String jobId, String message, boolean terminal) {
        Optional<JobState> existing = getJob(jobId);
        if (existing.isEmpty()) {
            log.warn("Cannot record failure for unknown job {}", jobId);
            return false;
        }
        putJob(existing.get().failed(message, terminal));
        return true;
    }

    public Map<String, JobState> listIncompleteJobs() {
        Map<String, JobState> incomplete = new TreeMap<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(jobDir, "*" + JSON)) {
            for (Path file : files) {
                try {
                    JobState state = readJson(file, JobState.class);
                    if (state.status() != null && state.status().isIncomplete()) {
                        incomplete.put(state.jobId(), state);
                    }
                } catch (StateStoreException e) {
                    log.warn("Skipping unreadable job file {}", file.getFileName(), e);
                }
            }
        } catch (IOException e) {
            throw new StateStoreException("Cannot list jobs in " + jobDir, e);
        }
        return incomplete;
    }

    /**
     * Offset to resume from: the larger of the persisted progress and the partial file size.
     * Zero when the job is unknown or no partial file exists.
     */
    public ResumeInfo resumeInfo(String jobId, String targetPath) {
        Optional<JobState> existing = getJob(jobId);
        if (existing.isEmpty()) {
            return ResumeInfo.fresh();
        }
        JobState state = existing.get();
        Path partFile = partPath(targetPath);
        long offset = 0L;
        if (Files.exists(partFile)) {
            try {
                offset = Math.max(Files.size(partFile), state.bytesCompleted());
            } catch (IOException e) {
                throw new StateStoreException("Cannot stat partial file " + partFile, e);
            }
        }
        return new ResumeInfo(offset, state.etag(), state.lastModified());
    }

    public Path partPath(String targetPath) {
        return Path.of(targetPath + partSuffix);
    }

    // ---- artifacts ----

    public void putArtifact(ArtifactRecord artifact) {
        writeJson(artifactFile(artifact.versionId()), artifact);
        if (artifact.urlVersionId() != null) {
            linkUrlVersion(artifact.urlVersionId(), artifact.versionId());
        }
        log.info("Cached artifact {}", shortId(artifact.versionId()));
    }

    /**
     * Artifact by content hash; records older than the TTL are treated as absent.
     */
    public Optional<ArtifactRecord> getArtifact(String versionId) {
        Path file = artifactFile(versionId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        ArtifactRecord artifact = readJson(file, ArtifactRecord.class);
        if (artifact.isExpired(clock.instant(), artifactTtl)) {
            log.info("Artifact {} expired, will refresh", shortId(versionId));
            return Optional.empty();
        }
        return Optional.of(artifact);
    }

    public void linkUrlVersion(String urlVersionId, String versionId) {
        writeBytes(urlIndexFile(urlVersionId), requireSafeId(versionId).getBytes(StandardCharsets.UTF_8));
    }

    public Optional<ArtifactRecord> getArtifactByUrlVersion(String urlVersionId) {
        Path ref = urlIndexFile(urlVersionId);
        if (!Files.exists(ref)) {
            return Optional.empty();
        }
        try {
            String versionId = Files.readString(ref, StandardCharsets.UTF_8).trim();
            if (versionId.isEmpty()) {
                return Optional.empty();
            }
            return getArtifact(versionId);
        } catch (IOException e) {
            throw new StateStoreException("Cannot read artifact index " + ref, e);
        }
    }

    /**
     * Deletes artifact records created more than {@code maxAge} ago, along with index entries
     * pointing at them. Returns how many records were removed.
     */
    public int cleanupExpiredArtifacts(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        Map<String, Boolean> removed = new LinkedHashMap<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(artifactDir, "*" + JSON)) {
            for (Path file : files) {
                Instant createdAt = createdAtOf(file);
                if (createdAt.isBefore(cutoff)) {
                    String name = file.getFileName().toString();
                    removed.put(name.substring(0, name.length() - JSON.length()), Files.deleteIfExists(file));
                    log.info("Cleaned up old artifact {}", name);
                }
            }
        } catch (IOException e) {
            throw new StateStoreException("Cannot clean artifacts in " + artifactDir, e);
        }
        if (!removed.isEmpty()) {
            pruneUrlIndex(removed);
        }
        return (int) removed.values().stream().filter(Boolean::booleanValue).count();
    }

    private void pruneUrlIndex(Map<String, Boolean> removedVersions) {
        try (DirectoryStream<Path> refs = Files.newDirectoryStream(urlIndexDir, "*" + REF)) {
            for (Path ref : refs) {
                String target = Files.readString(ref, StandardCharsets.UTF_8).trim();
                if (removedVersions.containsKey(target)) {
                    Files.deleteIfExists(ref);
                }
            }
        } catch (IOException e) {
            throw new StateStoreException("Cannot prune artifact index " + urlIndexDir, e);
        }
    }

    private Instant createdAtOf(Path file) throws IOException {
        try {
            ArtifactRecord artifact = readJson(file, ArtifactRecord.class);
            if (artifact.createdAt() != null) {
                return artifact.createdAt();
            }
        } catch (StateStoreException e) {
            log.warn("Unreadable artifact {}, falling back to file time", file.getFileName());
        }
        return Files.getLastModifiedTime(file).toInstant();
    }

    // ---- io ----

    private Path jobFile(String jobId) {
        return jobDir.resolve(requireSafeId(jobId) + JSON);
    }

    private Path artifactFile(String versionId) {
        return artifactDir.resolve(requireSafeId(versionId) + JSON);
    }

    private Path urlIndexFile(String urlVersionId) {
        return urlIndexDir.resolve(requireSafeId(urlVersionId) + REF);
    }

    private static String requireSafeId(String id) {
        if (id == null || !SAFE_ID.matcher(id).matches() || id.equals(".") || id.equals("..")) {
            throw new IllegalArgumentException("Invalid record id: " + id);
        }
        return id;
    }

    private <T> T readJson(Path file, Class<T> type) {
        try {
            return objectMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new StateStoreException("Cannot read " + file, e);
        }
    }

    private void writeJson(Path target, Object value) {
        try {
            writeBytes(target, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value));
        } catch (IOException e) {
            throw new StateStoreException("Cannot serialize " + target.getFileName(), e);
        }
    }

    private void writeBytes(Path target, byte[] bytes) {
        Path temp = null;
        try {
            temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            Files.write(temp, bytes);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StateStoreException("Cannot write " + target, e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to remove temp file {}", temp, e);
        }
    }

    private static String shortId(String versionId) {
        if (versionId == null) {
            return "<none>";
        }
        return versionId.length() <= 12 ? versionId : versionId.substring(0, 12) + "...";
    }
}
