package com.patchpilot.orchestrator.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
