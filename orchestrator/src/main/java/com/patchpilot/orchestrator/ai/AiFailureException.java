package com.patchpilot.orchestrator.ai;

import com.patchpilot.orchestrator.OrchestratorException;

/** The AI could not produce a usable change for the job. */
public class AiFailureException extends OrchestratorException {

    private final double costUsd;

    public AiFailureException(String message, double costUsd) {
        super("AI_FAILURE", message);
        this.costUsd = costUsd;
    }

    public double getCostUsd() { return costUsd; }
}
