package com.patchpilot.orchestrator.engine;

/**
 * Observer for {@link AutonomousRunner}. Called on the runner thread;
 * implementations must not block. Exceptions thrown here are logged and ignored.
 */
public interface RunnerListener {

    default void onJobStart(String url) {}

    default void onJobComplete(String url, String artifactUrl) {}

    default void onJobFailed(String url, String error) {}

    default void onQueueReplenished(int added) {}

    default void onStatusChanged(RunnerStatus status) {}
}
