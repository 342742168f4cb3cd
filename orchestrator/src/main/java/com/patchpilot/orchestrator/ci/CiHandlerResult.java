package com.patchpilot.orchestrator.ci;

import java.util.List;

/**
 * @param aiSessionId the AI conversation used by the last repair, for resuming later
 */
public record CiHandlerResult(
        CiFinalStatus     finalStatus,
        List<CiIteration> iterations,
        long              totalDurationMs,
        List<CheckRun>    finalChecks,
        String            summary,
        double            totalFixCostUsd,
        String            aiSessionId
) {

    public long fixesApplied() {
        return iterations.stream().filter(CiIteration::fixApplied).count();
    }
}
