package com.delta.extractor.model;

public record TransferAccepted(String jobId, String resourceId, String targetPath) {
}
