package com.patchpilot.orchestrator.engine;

public enum RunnerState {
    RUNNING,
    PAUSED,
    STOPPING,
    STOPPED
}
