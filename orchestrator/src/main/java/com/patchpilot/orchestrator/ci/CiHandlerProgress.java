package com.patchpilot.orchestrator.ci;

/**
 * @param counts null outside the waiting phase
 */
public record CiHandlerProgress(Phase phase, int iteration, int maxIterations, String message, CheckCounts counts) {

    public enum Phase { WAITING, ANALYZING, FIXING, PUSHING, COMPLETE }
}
