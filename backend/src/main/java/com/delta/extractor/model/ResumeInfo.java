package com.delta.extractor.model;

public record ResumeInfo(long offset, String etag, String lastModified) {
    public static ResumeInfo fresh() {
        return new ResumeInfo(0L, null, null);
    }
}
