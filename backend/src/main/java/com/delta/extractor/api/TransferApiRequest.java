package com.delta.extractor.api;

public record TransferApiRequest(
    String jobId,
    String resourceId,
    String url,
    String targetPath,
    Long expectedLength,
    String variantId
) {
}
