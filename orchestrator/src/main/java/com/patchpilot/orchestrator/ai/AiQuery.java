package com.patchpilot.orchestrator.ai;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Options for one AI invocation.
 *
 * @param model           null to use the configured default
 * @param maxBudgetUsd    cost ceiling for this call; 0 means unbounded
 * @param resumeSessionId AI conversation to continue, or null for a fresh one
 * @param timeout         stall timeout: the call is killed after this long without output
 */
public record AiQuery(
        Path     cwd,
        String   model,
        int      maxTurns,
        double   maxBudgetUsd,
        String   resumeSessionId,
        Duration timeout
) {

    public AiQuery withResume(String sessionId) {
        return new AiQuery(cwd, model, maxTurns, maxBudgetUsd, sessionId, timeout);
    }
}
