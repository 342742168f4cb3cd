package com.patchpilot.orchestrator.engine;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * @param jobIds            duplicates are dropped, order kept
 * @param maxConcurrent     null to use {@code patchpilot.parallel.max-concurrent-agents}
 * @param maxBudgetUsd      total for the batch, split evenly across jobs; null for no batch cap
 * @param skipConflictCheck skip the pre-flight overlap report
 * @param onProgress        receives a fresh snapshot whenever a job changes status
 */
public record ParallelWorkOptions(
        List<UUID>            jobIds,
        Integer               maxConcurrent,
        Double                maxBudgetUsd,
        boolean               skipConflictCheck,
        Consumer<BatchStatus> onProgress
) {

    public ParallelWorkOptions {
        jobIds     = jobIds == null ? List.of() : List.copyOf(new LinkedHashSet<>(jobIds));
        onProgress = onProgress == null ? s -> {} : onProgress;
    }

    public static ParallelWorkOptions of(List<UUID> jobIds) {
        return new ParallelWorkOptions(jobIds, null, null, false, null);
    }
}
