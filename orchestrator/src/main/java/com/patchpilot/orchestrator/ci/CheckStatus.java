package com.patchpilot.orchestrator.ci;

/** Normalized state of one CI check run. */
public enum CheckStatus {
    PENDING,
    SUCCESS,
    FAILURE,
    CANCELLED,
    SKIPPED;

    /**
     * Maps a GitHub check run's {@code status}/{@code conclusion} pair.
     * Anything not completed is pending; timed_out and action_required count as failures.
     */
    public static CheckStatus fromGitHub(String status, String conclusion) {
        if (!"completed".equals(status) || conclusion == null) {
            return PENDING;
        }
        return switch (conclusion) {
            case "success", "neutral" -> SUCCESS;
            case "cancelled"          -> CANCELLED;
            case "skipped"            -> SKIPPED;
            default                   -> FAILURE;
        };
    }
}
