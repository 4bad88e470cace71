package com.delta.extractor.artifact;

import com.delta.extractor.model.ArtifactRecord;

import java.time.Instant;

/**
 * In-memory slot of {@link ArtifactCache}. Eviction orders by the artifact's creation time,
 * the access fields are kept for diagnostics.
 */
record CacheEntry(ArtifactRecord artifact, Instant insertedAt, Instant lastAccessedAt, long hits) {

    static CacheEntry of(ArtifactRecord artifact, Instant now) {
        return new CacheEntry(artifact, now, now, 0L);
    }

    CacheEntry touched(ArtifactRecord refreshed, Instant now) {
        return new CacheEntry(refreshed, insertedAt, now, hits + 1);
    }

    Instant createdAt() {
        return artifact.createdAt() == null ? insertedAt : artifact.createdAt();
    }
}
