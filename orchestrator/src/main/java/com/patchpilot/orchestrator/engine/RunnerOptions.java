package com.patchpilot.orchestrator.engine;

import com.patchpilot.orchestrator.config.PatchPilotProperties;

import java.time.Duration;

/**
 * Limits for one autonomous run. A null limit is not enforced.
 *
 * @param dryRun pick jobs but do not execute them; each picked job is abandoned
 *               so it is not picked again
 */
public record RunnerOptions(
        Integer  maxIterations,
        Duration maxDuration,
        Double   maxBudgetUsd,
        Duration cooldown,
        boolean  autoReplenish,
        boolean  dryRun
) {

    public RunnerOptions {
        cooldown = cooldown == null ? Duration.ZERO : cooldown;
    }

    public static RunnerOptions defaults(PatchPilotProperties props) {
        return new RunnerOptions(null, null, null, props.runner().cooldown(), true, false);
    }

    public RunnerOptions withLimits(Integer maxIterations, Duration maxDuration, Double maxBudgetUsd) {
        return new RunnerOptions(maxIterations, maxDuration, maxBudgetUsd, cooldown, autoReplenish, dryRun);
    }

    public RunnerOptions withDryRun(boolean dryRun) {
        return new RunnerOptions(maxIterations, maxDuration, maxBudgetUsd, cooldown, autoReplenish, dryRun);
    }
}
