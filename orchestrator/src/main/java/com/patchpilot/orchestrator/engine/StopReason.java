package com.patchpilot.orchestrator.engine;

/** Why an autonomous run ended. Exactly one per run. */
public enum StopReason {
    COMPLETED,
    MAX_ITERATIONS,
    MAX_DURATION,
    MAX_BUDGET,
    BUDGET_EXCEEDED,
    MANUAL_STOP,
    ERROR,
    EMPTY_QUEUE,
    RATE_LIMITED
}
