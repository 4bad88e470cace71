package com.delta.extractor.resilience;

public enum FailureClass {
    RETRYABLE,
    TERMINAL
}
