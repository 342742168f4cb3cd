package com.patchpilot.orchestrator.worker;

import com.patchpilot.orchestrator.ci.ArtifactRef;

/**
 * @param artifact the opened pull request; null when none was created
 * @param error    null on success
 */
public record WorkerResult(
        boolean     success,
        ArtifactRef artifact,
        double      costUsd,
        int         turns,
        String      error
) {

    public static WorkerResult succeeded(ArtifactRef artifact, double costUsd, int turns) {
        return new WorkerResult(true, artifact, costUsd, turns, null);
    }

    public static WorkerResult failed(String error, double costUsd, int turns) {
        return new WorkerResult(false, null, costUsd, turns, error);
    }
}
