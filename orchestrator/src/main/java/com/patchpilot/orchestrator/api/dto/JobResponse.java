package com.patchpilot.orchestrator.api.dto;

import com.patchpilot.orchestrator.model.Job;
import com.patchpilot.orchestrator.model.JobState;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response body for the /jobs endpoints.
 * {@code linkedArtifactUrl} is set once the worker has opened a pull request.
 */
public record JobResponse(
        UUID         id,
        String       url,
        String       projectId,
        String       title,
        List<String> labels,
        JobState     state,
        String       lastReason,
        String       linkedArtifactUrl,
        Instant      queuedAt,
        Instant      createdAt,
        Instant      updatedAt
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getUrl(),
                job.getProjectId(),
                job.getTitle(),
                job.getLabels(),
                job.getState(),
                job.getLastReason(),
                job.getLinkedArtifactUrl(),
                job.getQueuedAt(),
                job.getCreatedAt(),
                job.getUpdatedAt()
        );
    }
}
