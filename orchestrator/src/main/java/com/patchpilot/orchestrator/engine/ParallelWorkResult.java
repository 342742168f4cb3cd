package com.patchpilot.orchestrator.engine;

import com.patchpilot.orchestrator.conflict.PreflightConflictReport;

import java.util.List;
import java.util.UUID;

/**
 * @param success   every job succeeded; none failed or was cancelled
 * @param conflicts pre-flight overlap report; null when the check was skipped
 */
public record ParallelWorkResult(
        UUID                    batchId,
        boolean                 success,
        List<JobOutcome>        results,
        BatchSummary            summary,
        PreflightConflictReport conflicts
) {}
