package com.delta.extractor.model;

/**
 * What to fetch: a logical resource id, its current URL and, when known, its size and the
 * variant that was selected when the job started.
 */
public record ResourceDescriptor(
    String resourceId,
    String url,
    Long expectedLength,
    String variantId
) {
    public static ResourceDescriptor of(String resourceId, String url) {
        return new ResourceDescriptor(resourceId, url, null, null);
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }
}
