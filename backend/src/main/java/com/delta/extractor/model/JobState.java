package com.delta.extractor.model;

import java.time.Instant;

public record JobState(
    String jobId,
    String resourceId,
    String variantId,
    String resourceUrl,
    String targetPath,
    long bytesCompleted,
    Long totalLength,
    String etag,
    String lastModified,
    JobStatus status,
    int retryCount,
    Instant lastSuccessAt,
    String errorMessage,
    Instant createdAt
) {
    public static JobState pending(String jobId, ResourceDescriptor descriptor, String targetPath, Instant now) {
        return new JobState(
            jobId,
            descriptor.resourceId(),
            descriptor.variantId(),
            descriptor.url(),
            targetPath,
            0L,
            descriptor.expectedLength(),
            null,
            null,
            JobStatus.PENDING,
            0,
            now,
            null,
            now
        );
    }

    public JobState withProgress(long bytes, String newEtag, String newLastModified, Instant now) {
        return new JobState(
            jobId,
            resourceId,
            variantId,
            resourceUrl,
            targetPath,
            bytes,
            totalLength,
            newEtag != null ? newEtag : etag,
            newLastModified != null ? newLastModified : lastModified,
            JobStatus.IN_PROGRESS,
            retryCount,
            now,
            errorMessage,
            createdAt
        );
    }

    public JobState withTotalLength(Long length) {
        return new JobState(
            jobId, resourceId, variantId, resourceUrl, targetPath, bytesCompleted, length,
            etag, lastModified, status, retryCount, lastSuccessAt, errorMessage, createdAt
        );
    }

    public JobState withResourceUrl(String url) {
        return new JobState(
            jobId, resourceId, variantId, url, targetPath, bytesCompleted, totalLength,
            etag, lastModified, status, retryCount, lastSuccessAt, errorMessage, createdAt
        );
    }

    public JobState completed(long finalSize, Instant now) {
        return new JobState(
            jobId, resourceId, variantId, resourceUrl, targetPath, finalSize, finalSize,
            etag, lastModified, JobStatus.COMPLETED, retryCount, now, null, createdAt
        );
    }

    public JobState failed(String message, boolean terminal) {
        JobStatus nextStatus = terminal ? JobStatus.FAILED : status;
        return new JobState(
            jobId, resourceId, variantId, resourceUrl, targetPath, bytesCompleted, totalLength,
            etag, lastModified, nextStatus, retryCount + 1, lastSuccessAt, message, createdAt
        );
    }
}
