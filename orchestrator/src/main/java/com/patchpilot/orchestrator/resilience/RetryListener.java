package com.patchpilot.orchestrator.resilience;

import java.time.Duration;

/** Fired before each retry sleep. {@code attempt} is 1 for the first retry. */
@FunctionalInterface
public interface RetryListener {

    void onRetry(RuntimeException error, int attempt, Duration delay);

    RetryListener NONE = (error, attempt, delay) -> {};
}
