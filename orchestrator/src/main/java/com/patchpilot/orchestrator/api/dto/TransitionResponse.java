package com.patchpilot.orchestrator.api.dto;

import com.patchpilot.orchestrator.model.JobState;
import com.patchpilot.orchestrator.model.JobTransition;

import java.time.Instant;
import java.util.UUID;

/** One row of GET /jobs/{id}/history. */
public record TransitionResponse(
        JobState from,
        JobState to,
        String   reason,
        UUID     sessionId,
        Instant  at
) {
    public static TransitionResponse from(JobTransition t) {
        return new TransitionResponse(t.getFromState(), t.getToState(), t.getReason(),
                t.getSessionId(), t.getCreatedAt());
    }
}
