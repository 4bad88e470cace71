package com.delta.extractor.error;

/**
 * Unexpected HTTP status from the remote side. The status drives retry classification.
 */
public class HttpStatusException extends RuntimeException {
    private final int statusCode;
    private final String url;

    public HttpStatusException(int statusCode, String url, String message) {
        super(message + " (status=" + statusCode + ", url=" + url + ")");
        this.statusCode = statusCode;
        this.url = url;
    }

    public int statusCode() {
        return statusCode;
    }

    public String url() {
        return url;
    }
}
