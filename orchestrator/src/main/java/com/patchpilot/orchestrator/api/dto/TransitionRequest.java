package com.patchpilot.orchestrator.api.dto;

import com.patchpilot.orchestrator.model.JobState;

/** Request body for POST /jobs/{id}/transition. */
public record TransitionRequest(JobState target, String reason) {

    public TransitionRequest {
        if (reason == null || reason.isBlank()) reason = "Operator action";
    }
}
