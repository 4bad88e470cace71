package com.delta.extractor.state;

import com.delta.extractor.config.ExtractorConfig;
import com.delta.extractor.model.ArtifactRecord;
import com.delta.extractor.model.ExtractedFields;
import com.delta.extractor.model.JobState;
import com.delta.extractor.model.JobStatus;
import com.delta.extractor.model.ResourceDescriptor;
import com.delta.extractor.model.ResumeInfo;
import com.delta.extractor.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StateStoreTest {
    @TempDir
    Path tempDir;

    private MutableClock clock;
    private StateStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        store = new StateStore(
            tempDir.resolve("state"),
            Duration.ofHours(1),
            ".part",
            ExtractorConfig.defaultObjectMapper(),
            clock
        );
    }

    @Test
    void jobRoundTripsThroughDisk() {
        JobState job = pendingJob("job-1", tempDir.resolve("out.bin"));
        store.putJob(job);

        Optional<JobState> loaded = store.getJob("job-1");

        assertThat(loaded).contains(job);
        assertThat(tempDir.resolve("state/jobs/job-1.json")).exists();
        assertThat(store.getJob("missing")).isEmpty();
    }

    @Test
    void deleteJobIsIdempotent() {
        store.putJob(pendingJob("job-1", tempDir.resolve("out.bin")));

        store.deleteJob("job-1");
        store.deleteJob("job-1");

        assertThat(store.getJob("job-1")).isEmpty();
    }

    @Test
    void updateProgressMarksInProgressAndNeverMovesBackwards() {
        store.putJob(pendingJob("job-1", tempDir.resolve("out.bin")));

        assertThat(store.updateProgress("job-1", 4096, "\"v1\"", null)).isTrue();
        store.updateProgress("job-1", 1024, null, null);

        JobState state = store.getJob("job-1").orElseThrow();
        assertThat(state.status()).isEqualTo(JobStatus.IN_PROGRESS);
        assertThat(state.bytesCompleted()).isEqualTo(4096);
        assertThat(state.etag()).isEqualTo("\"v1\"");
    }

    @Test
    void updateProgressForUnknownJobIsANoOp() {
        assertThat(store.updateProgress("ghost", 10, null, null)).isFalse();
        assertThat(store.getJob("ghost")).isEmpty();
    }

    @Test
    void rewindResetsProgressAndValidators() {
        store.putJob(pendingJob("job-1", tempDir.resolve("out.bin")));
        store.updateProgress("job-1", 4096, "\"v1\"", "Wed, 01 May 2024 09:00:00 GMT");

        store.rewindProgress("job-1", 0, null, null);

        JobState state = store.getJob("job-1").orElseThrow();
        assertThat(state.bytesCompleted()).isZero();
        assertThat(state.etag()).isNull();
        assertThat(state.lastModified()).isNull();
    }

    @Test
    void recordFailureOnlyFailsJobWhenTerminal() {
        store.putJob(pendingJob("job-1", tempDir.resolve("out.bin")));
        store.updateProgress("job-1", 10, null, null);

        store.recordFailure("job-1", "timeout", false);
        JobState transientFailure = store.getJob("job-1").orElseThrow();
        assertThat(transientFailure.status()).isEqualTo(JobStatus.IN_PROGRESS);
        assertThat(transientFailure.retryCount()).isEqualTo(1);
        assertThat(transientFailure.errorMessage()).isEqualTo("timeout");

        store.recordFailure("job-1", "404", true);
        JobState terminal = store.getJob("job-1").orElseThrow();
        assertThat(terminal.status()).isEqualTo(JobStatus.FAILED);
        assertThat(terminal.retryCount()).isEqualTo(2);
    }

    @Test
    void listsOnlyPendingAndInProgressJobs() {
        store.putJob(pendingJob("a", tempDir.resolve("a.bin")));
        store.putJob(pendingJob("b", tempDir.resolve("b.bin")));
        store.updateProgress("b", 5, null, null);
        store.putJob(pendingJob("c", tempDir.resolve("c.bin")));
        store.recordFailure("c", "gone", true);

        Map<String, JobState> incomplete = store.listIncompleteJobs();

        assertThat(incomplete).containsOnlyKeys("a", "b");
    }

    @Test
    void resumeInfoUsesLargerOfPersistedAndPartialSize() throws Exception {
        Path target = tempDir.resolve("out.bin");
        store.putJob(pendingJob("job-1", target));
        store.updateProgress("job-1", 3000, "\"v1\"", null);
        Files.write(store.partPath(target.toString()), new byte[4096]);

        ResumeInfo info = store.resumeInfo("job-1", target.toString());

        assertThat(info.offset()).isEqualTo(4096);
        assertThat(info.etag()).isEqualTo("\"v1\"");
    }

    @Test
    void resumeInfoIsZeroWithoutJobOrPartialFile() {
        Path target = tempDir.resolve("out.bin");
        assertThat(store.resumeInfo("job-1", target.toString()).offset()).isZero();

        store.putJob(pendingJob("job-1", target));
        store.updateProgress("job-1", 3000, null, null);

        assertThat(store.resumeInfo("job-1", target.toString()).offset()).isZero();
    }

    @Test
    void artifactsExpireAfterTtl() {
        ArtifactRecord artifact = artifact("abc123", "url123", clock.instant());
        store.putArtifact(artifact);

        assertThat(store.getArtifact("abc123")).contains(artifact);
        assertThat(store.getArtifactByUrlVersion("url123")).contains(artifact);

        clock.advance(Duration.ofMinutes(61));

        assertThat(store.getArtifact("abc123")).isEmpty();
        assertThat(store.getArtifactByUrlVersion("url123")).isEmpty();
        assertThat(tempDir.resolve("state/artifacts/abc123.json")).exists();
    }

    @Test
    void artifactFieldsSurviveSerialization() {
        store.putArtifact(artifact("abc123", "url123", clock.instant()));

        ArtifactRecord loaded = store.getArtifact("abc123").orElseThrow();

        assertThat(loaded.fields().signatureTimestamp()).isEqualTo("19461");
        assertThat(loaded.fields().decipherFunction()).contains("xy=function(a){return a}");
        assertThat(loaded.fields().throttleFunction()).isEmpty();
    }

    @Test
    void cleanupRemovesOldArtifactsAndTheirIndexEntries() {
        store.putArtifact(artifact("old", "old-url", clock.instant().minus(Duration.ofHours(30))));
        store.putArtifact(artifact("fresh", "fresh-url", clock.instant()));

        int removed = store.cleanupExpiredArtifacts(Duration.ofHours(24));

        assertThat(removed).isEqualTo(1);
        assertThat(tempDir.resolve("state/artifacts/old.json")).doesNotExist();
        assertThat(tempDir.resolve("state/artifacts/by-url/old-url.ref")).doesNotExist();
        assertThat(store.getArtifact("fresh")).isPresent();
    }

    @Test
    void rejectsIdsThatEscapeTheStateDirectory() {
        assertThatThrownBy(() -> store.getJob("../etc/passwd"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void writesLeaveNoTempFilesBehind() throws Exception {
        store.putJob(pendingJob("job-1", tempDir.resolve("out.bin")));
        store.updateProgress("job-1", 1, null, null);

        try (Stream<Path> files = Files.list(tempDir.resolve("state/jobs"))) {
            assertThat(files.map(path -> path.getFileName().toString())).containsExactly("job-1.json");
        }
    }

    private JobState pendingJob(String jobId, Path target) {
        ResourceDescriptor descriptor = new ResourceDescriptor("res-" + jobId, "http://example.test/" + jobId, null, "137");
        return JobState.pending(jobId, descriptor, target.toString(), clock.instant());
    }

    private static ArtifactRecord artifact(String versionId, String urlVersionId, Instant createdAt) {
        return new ArtifactRecord(
            versionId,
            urlVersionId,
            "https://example.test/s/player/abc/player_ias.vflset/base.js",
            new ExtractedFields("19461", Optional.of("xy=function(a){return a}"), Optional.empty()),
            "2.0",
            createdAt,
            createdAt,
            0
        );
    }
}
