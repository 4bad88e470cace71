package com.delta.extractor.model;

import java.time.Instant;
import java.util.List;

public record ArtifactCacheSnapshot(
    String currentVersionId,
    String sourceUrl,
    String signatureTimestamp,
    Instant refreshedAt,
    List<String> cachedVersionIds,
    double extractionFailureRate
) {
}
