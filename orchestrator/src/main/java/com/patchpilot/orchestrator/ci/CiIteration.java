package com.patchpilot.orchestrator.ci;

/**
 * One poll-and-maybe-repair round.
 *
 * @param fixCommit  head SHA after pushing the fix; null when no fix was applied
 * @param fixSummary what the AI said it changed; null when no fix was applied
 */
public record CiIteration(
        int          attempt,
        CiPollResult checkResult,
        boolean      fixApplied,
        String       fixCommit,
        String       fixSummary,
        long         durationMs
) {

    static CiIteration withoutFix(int attempt, CiPollResult checkResult, long durationMs) {
        return new CiIteration(attempt, checkResult, false, null, null, durationMs);
    }
}
