package com.patchpilot.orchestrator.api.dto;

import com.patchpilot.orchestrator.engine.RunnerOptions;

import java.time.Duration;

/**
 * Request body for POST /runner/start. Every field is optional; an empty
 * body runs until the queue drains or a gate stops it.
 */
public record StartRunnerRequest(Integer maxIterations, Long maxDurationMs, Double maxBudgetUsd,
                                 Boolean dryRun) {

    public RunnerOptions applyTo(RunnerOptions defaults) {
        return defaults
                .withLimits(maxIterations,
                        maxDurationMs == null ? null : Duration.ofMillis(maxDurationMs),
                        maxBudgetUsd)
                .withDryRun(Boolean.TRUE.equals(dryRun));
    }
}
