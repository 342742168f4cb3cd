package com.patchpilot.orchestrator.engine;

import java.time.Instant;

/**
 * Point-in-time view of the autonomous runner.
 *
 * @param currentJobUrl null between jobs
 */
public record RunnerStatus(
        RunnerState state,
        int         iteration,
        Instant     startedAt,
        int         succeeded,
        int         failed,
        double      totalCostUsd,
        String      currentJobUrl,
        int         queueSize
) {}
