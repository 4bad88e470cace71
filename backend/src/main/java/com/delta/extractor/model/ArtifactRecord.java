package com.delta.extractor.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Content-addressed artifact: {@code versionId} is the SHA-256 of the script body,
 * {@code urlVersionId} the hash of the URL it was fetched from.
 */
public record ArtifactRecord(
    String versionId,
    String urlVersionId,
    String sourceUrl,
    ExtractedFields fields,
    String extractionMethodVersion,
    Instant createdAt,
    Instant lastValidatedAt,
    int failureCount
) {
    public boolean isExpired(Instant now, Duration ttl) {
        return createdAt == null || Duration.between(createdAt, now).compareTo(ttl) > 0;
    }

    public ArtifactRecord validatedAt(Instant now) {
        return new ArtifactRecord(
            versionId, urlVersionId, sourceUrl, fields, extractionMethodVersion, createdAt, now, failureCount
        );
    }

    public ArtifactRecord withFailure() {
        return new ArtifactRecord(
            versionId, urlVersionId, sourceUrl, fields, extractionMethodVersion, createdAt, lastValidatedAt,
            failureCount + 1
        );
    }
}
