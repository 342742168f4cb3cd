package com.patchpilot.orchestrator.model;

/** Per-job outcome inside a parallel batch. */
public enum BatchItemStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILURE,
    CANCELLED;

    public boolean isFinished() {
        return this == SUCCESS || this == FAILURE || this == CANCELLED;
    }
}
