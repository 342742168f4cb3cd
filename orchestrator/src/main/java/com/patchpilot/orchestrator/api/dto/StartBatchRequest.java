package com.patchpilot.orchestrator.api.dto;

import com.patchpilot.orchestrator.engine.ParallelWorkOptions;

import java.util.List;
import java.util.UUID;

/**
 * Request body for POST /batches.
 *
 * maxConcurrent and maxBudgetUsd fall back to the configured defaults when omitted.
 */
public record StartBatchRequest(List<UUID> jobIds, Integer maxConcurrent, Double maxBudgetUsd,
                                boolean skipConflictCheck) {

    public ParallelWorkOptions toOptions() {
        return new ParallelWorkOptions(jobIds, maxConcurrent, maxBudgetUsd, skipConflictCheck, null);
    }
}
