package com.patchpilot.orchestrator.ci;

import java.util.List;

/** Terminal verdict of one polling run, with the snapshot it was decided on. */
public record CiPollResult(
        CiPollStatus   status,
        List<CheckRun> checks,
        CheckCounts    counts,
        long           durationMs,
        int            pollCount
) {

    public List<CheckRun> failedChecks() {
        return checks.stream().filter(c -> c.status() == CheckStatus.FAILURE).toList();
    }

    public List<CheckRun> passedChecks() {
        return checks.stream().filter(c -> c.status() == CheckStatus.SUCCESS).toList();
    }
}
