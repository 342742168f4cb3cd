package com.patchpilot.orchestrator.api.dto;

import com.patchpilot.orchestrator.model.ParallelBatch;

import java.time.Instant;
import java.util.UUID;

/** Stored summary of a batch, for GET /batches. */
public record BatchResponse(
        UUID    id,
        int     maxConcurrency,
        int     jobCount,
        int     pending,
        int     inProgress,
        int     completed,
        int     failed,
        int     cancelled,
        double  totalCostUsd,
        Instant startedAt,
        Instant finishedAt
) {
    public static BatchResponse from(ParallelBatch b) {
        return new BatchResponse(
                b.getId(),
                b.getMaxConcurrency(),
                b.getJobCount(),
                b.getPending(),
                b.getInProgress(),
                b.getCompleted(),
                b.getFailed(),
                b.getCancelled(),
                b.getTotalCostUsd(),
                b.getStartedAt(),
                b.getFinishedAt()
        );
    }
}
