package com.patchpilot.orchestrator.ci;

public enum CiFinalStatus {
    SUCCESS,
    FAILURE,
    TIMEOUT,
    MAX_ITERATIONS,
    NO_CHECKS,
    SKIPPED;

    /** Whether the PR can go on to review. A repo with no CI counts as passing. */
    public boolean isPassing() {
        return this == SUCCESS || this == NO_CHECKS || this == SKIPPED;
    }
}
