package com.delta.extractor.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one GET. {@code bodyBytes} is an array, so record equality compares it by
 * identity; compare {@code body} or hash the bytes instead.
 */
public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    byte[] bodyBytes,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }
}
