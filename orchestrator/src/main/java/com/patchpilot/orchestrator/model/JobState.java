package com.patchpilot.orchestrator.model;

/**
 * Lifecycle of an issue from discovery to a terminal outcome.
 *
 * Happy path:
 *   DISCOVERED → QUEUED → IN_PROGRESS → PR_CREATED → AWAITING_FEEDBACK ⇄ ITERATING → MERGED
 *
 * MERGED, CLOSED and ABANDONED are terminal. The legal edges live in
 * {@link com.patchpilot.orchestrator.lifecycle.JobStateMachine}.
 */
public enum JobState {
    DISCOVERED,
    QUEUED,
    IN_PROGRESS,
    PR_CREATED,
    AWAITING_FEEDBACK,
    ITERATING,
    MERGED,
    CLOSED,
    ABANDONED;

    public boolean isTerminal() {
        return this == MERGED || this == CLOSED || this == ABANDONED;
    }
}
