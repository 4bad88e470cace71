package com.delta.extractor.error;

/**
 * Base of every failure surfaced by transfers and artifact synchronization.
 */
public class ExtractorException extends RuntimeException {
    private final ErrorKind kind;

    public ExtractorException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ExtractorException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
