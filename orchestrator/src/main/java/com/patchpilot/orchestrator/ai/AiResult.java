package com.patchpilot.orchestrator.ai;

/**
 * Outcome of one AI invocation. {@code success=false} carries {@code error};
 * cost and turns are reported either way since a failed run still spends money.
 */
public record AiResult(
        boolean success,
        String  output,
        double  costUsd,
        int     turns,
        String  sessionId,
        String  error
) {

    public static AiResult failed(String error) {
        return new AiResult(false, "", 0.0, 0, null, error);
    }
}
