package com.patchpilot.orchestrator.worker;

import com.patchpilot.orchestrator.ci.ArtifactRef;

/** Opens the externally hosted change (a pull request) for a pushed branch. */
public interface ArtifactPublisher {

    ArtifactRef publish(String projectId, String branch, String title, String body) throws InterruptedException;
}
