package com.patchpilot.orchestrator.lifecycle;

import com.patchpilot.orchestrator.OrchestratorException;
import com.patchpilot.orchestrator.model.JobState;

import java.util.UUID;

/** The requested edge is not in the job lifecycle graph. */
public class InvalidTransitionException extends OrchestratorException {

    private final UUID     jobId;
    private final JobState from;
    private final JobState to;

    public InvalidTransitionException(UUID jobId, JobState from, JobState to) {
        super("INVALID_TRANSITION", "Job %s cannot move from %s to %s".formatted(jobId, from, to));
        this.jobId = jobId;
        this.from  = from;
        this.to    = to;
    }

    public UUID     getJobId() { return jobId; }
    public JobState getFrom()  { return from; }
    public JobState getTo()    { return to; }
}
