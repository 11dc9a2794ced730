package com.docpulse.pipeline.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
