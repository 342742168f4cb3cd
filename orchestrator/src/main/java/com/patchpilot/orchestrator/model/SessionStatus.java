package com.patchpilot.orchestrator.model;

public enum SessionStatus {
    ACTIVE,
    COMPLETED,
    FAILED
}
