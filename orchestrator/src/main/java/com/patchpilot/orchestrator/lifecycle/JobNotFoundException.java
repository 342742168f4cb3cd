package com.patchpilot.orchestrator.lifecycle;

import com.patchpilot.orchestrator.OrchestratorException;

import java.util.UUID;

public class JobNotFoundException extends OrchestratorException {

    public JobNotFoundException(UUID jobId) {
        super("JOB_NOT_FOUND", "Job not found: " + jobId);
    }
}
