package com.patchpilot.orchestrator.ci;

import java.util.List;
import java.util.Optional;

/** Where CI verdicts come from. */
public interface CiStatusSource {

    /** Check runs on the PR's current head commit; empty if none are registered. */
    List<CheckRun> getChecks(ArtifactRef artifact) throws InterruptedException;

    /** Raw log of a failed check, when the CI system exposes one. */
    Optional<String> getCheckLog(ArtifactRef artifact, CheckRun check) throws InterruptedException;
}
