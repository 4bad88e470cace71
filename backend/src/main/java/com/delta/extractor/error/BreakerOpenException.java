package com.delta.extractor.error;

public class BreakerOpenException extends ExtractorException {
    private final String breakerName;

    public BreakerOpenException(String breakerName, String operationName) {
        super(ErrorKind.BREAKER_OPEN, "Circuit breaker OPEN for " + operationName + " (breaker=" + breakerName + ")");
        this.breakerName = breakerName;
    }

    public String breakerName() {
        return breakerName;
    }
}
