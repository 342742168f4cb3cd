package com.patchpilot.orchestrator.engine;

import com.patchpilot.orchestrator.model.BatchItemStatus;

import java.util.UUID;

/** Where one job of a batch stands, or how it ended. */
public record JobOutcome(
        UUID            jobId,
        String          url,
        BatchItemStatus status,
        String          artifactUrl,
        double          costUsd,
        long            durationMs,
        String          error
) {

    static JobOutcome pending(UUID jobId, String url) {
        return new JobOutcome(jobId, url, BatchItemStatus.PENDING, null, 0.0, 0, null);
    }

    JobOutcome running() {
        return new JobOutcome(jobId, url, BatchItemStatus.RUNNING, null, 0.0, 0, null);
    }

    JobOutcome cancelled() {
        return new JobOutcome(jobId, url, BatchItemStatus.CANCELLED, null, 0.0, 0, "Cancelled");
    }

    JobOutcome failed(String error, double costUsd, long durationMs) {
        return new JobOutcome(jobId, url, BatchItemStatus.FAILURE, null, costUsd, durationMs, error);
    }

    JobOutcome succeeded(String artifactUrl, double costUsd, long durationMs) {
        return new JobOutcome(jobId, url, BatchItemStatus.SUCCESS, artifactUrl, costUsd, durationMs, null);
    }
}
