package com.delta.extractor.api;

import com.delta.extractor.artifact.ArtifactCache;
import com.delta.extractor.config.ExtractorProperties;
import com.delta.extractor.model.ArtifactCacheSnapshot;
import com.delta.extractor.model.ArtifactRecord;
import com.delta.extractor.model.JobState;
import com.delta.extractor.model.ResourceDescriptor;
import com.delta.extractor.model.ResumeSummary;
import com.delta.extractor.model.TransferAccepted;
import com.delta.extractor.resilience.CircuitBreakerRegistry;
import com.delta.extractor.resilience.CircuitBreakerSnapshot;
import com.delta.extractor.state.StateStore;
import com.delta.extractor.transfer.TransferCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class TransferController {
    private static final Logger log = LoggerFactory.getLogger(TransferController.class);

    private final TransferCoordinator coordinator;
    private final StateStore stateStore;
    private final ArtifactCache artifactCache;
    private final CircuitBreakerRegistry breakers;
    private final ExtractorProperties properties;

    public TransferController(
        TransferCoordinator coordinator,
        StateStore stateStore,
        ArtifactCache artifactCache,
        CircuitBreakerRegistry breakers,
        ExtractorProperties properties
    ) {
        this.coordinator = coordinator;
        this.stateStore = stateStore;
        this.artifactCache = artifactCache;
        this.breakers = breakers;
        this.properties = properties;
    }

    @PostMapping("/transfers")
    public ResponseEntity<TransferAccepted> submitTransfer(@RequestBody TransferApiRequest request) {
        if (request == null || request.url() == null || request.url().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "url is required");
        }
        String jobId = isBlank(request.jobId()) ? coordinator.newJobId() : request.jobId().trim();
        String resourceId = isBlank(request.resourceId()) ? jobId : request.resourceId().trim();
        String targetPath = isBlank(request.targetPath())
            ? Path.of(properties.getTransfer().getOutputDir(), resourceId).toString()
            : request.targetPath().trim();
        ResourceDescriptor descriptor = new ResourceDescriptor(
            resourceId,
            request.url().trim(),
            request.expectedLength(),
            request.variantId()
        );
        coordinator.submit(jobId, descriptor, targetPath)
            .exceptionally(error -> {
                log.warn("Transfer {} ended with error: {}", jobId, error.getMessage());
                return null;
            });
        return ResponseEntity.accepted().body(new TransferAccepted(jobId, resourceId, targetPath));
    }

    @GetMapping("/jobs/incomplete")
    public List<JobState> incompleteJobs() {
        return new ArrayList<>(stateStore.listIncompleteJobs().values());
    }

    @GetMapping("/jobs/{jobId}")
    public JobState job(@PathVariable("jobId") String jobId) {
        return stateStore.getJob(jobId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Unknown job " + jobId));
    }

    @PostMapping("/jobs/resume")
    public ResumeSummary resumeIncomplete() {
        List<String> resumed = new ArrayList<>(coordinator.resumeIncompleteJobs().keySet());
        return new ResumeSummary(resumed, coordinator.activeJobIds());
    }

    @GetMapping("/artifact")
    public ArtifactRecord currentArtifact() {
        return artifactCache.getCurrent();
    }

    @PostMapping("/artifact/refresh")
    public ArtifactRecord refreshArtifact() {
        return artifactCache.getCurrent(true);
    }

    @GetMapping("/artifact/status")
    public ArtifactCacheSnapshot artifactStatus() {
        return artifactCache.snapshot();
    }

    @GetMapping("/breakers")
    public List<CircuitBreakerSnapshot> breakers() {
        return breakers.snapshots();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
