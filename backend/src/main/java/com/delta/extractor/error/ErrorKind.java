package com.delta.extractor.error;

public enum ErrorKind {
    BREAKER_OPEN,
    TRANSIENT_NETWORK,
    TERMINAL_REQUEST,
    RESOURCE_CHANGED,
    EXTRACTION_FAILURE,
    STATE_INCONSISTENCY
}
