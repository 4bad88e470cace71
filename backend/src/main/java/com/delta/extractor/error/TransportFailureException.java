package com.delta.extractor.error;

/**
 * Request that never produced an HTTP status (timeout, refused connection, reset).
 */
public class TransportFailureException extends RuntimeException {
    private final String errorCode;

    public TransportFailureException(String errorCode, String message) {
        super(errorCode + ": " + message);
        this.errorCode = errorCode;
    }

    public TransportFailureException(String errorCode, String message, Throwable cause) {
        super(errorCode + ": " + message, cause);
        this.errorCode = errorCode;
    }

    public String errorCode() {
        return errorCode;
    }
}
