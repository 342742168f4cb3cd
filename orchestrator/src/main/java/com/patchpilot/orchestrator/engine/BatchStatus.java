package com.patchpilot.orchestrator.engine;

import com.patchpilot.orchestrator.model.BatchItemStatus;

import java.util.List;
import java.util.UUID;

public record BatchStatus(
        UUID             batchId,
        int              total,
        int              pending,
        int              inProgress,
        int              completed,
        int              failed,
        int              cancelled,
        double           totalCostUsd,
        boolean          finished,
        List<JobOutcome> jobs
) {

    static BatchStatus of(UUID batchId, List<JobOutcome> jobs, boolean finished) {
        int pending = 0, inProgress = 0, completed = 0, failed = 0, cancelled = 0;
        double cost = 0.0;
        for (JobOutcome job : jobs) {
            cost += job.costUsd();
            switch (job.status()) {
                case PENDING   -> pending++;
                case RUNNING   -> inProgress++;
                case SUCCESS   -> completed++;
                case FAILURE   -> failed++;
                case CANCELLED -> cancelled++;
            }
        }
        return new BatchStatus(batchId, jobs.size(), pending, inProgress, completed, failed, cancelled,
                cost, finished, List.copyOf(jobs));
    }

    public long count(BatchItemStatus status) {
        return jobs.stream().filter(j -> j.status() == status).count();
    }
}
