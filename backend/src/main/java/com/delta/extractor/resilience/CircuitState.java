package com.delta.extractor.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
