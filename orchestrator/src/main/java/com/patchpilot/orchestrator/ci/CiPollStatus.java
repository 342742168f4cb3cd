package com.patchpilot.orchestrator.ci;

public enum CiPollStatus {
    SUCCESS,
    FAILURE,
    TIMEOUT,
    NO_CHECKS
}
