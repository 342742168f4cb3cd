package com.patchpilot.orchestrator.worker;

import com.patchpilot.orchestrator.model.Job;

/**
 * Executes one queued job end to end and reports what it cost.
 *
 * Implementations never throw for a failed job; the failure is reported in
 * the result. Only interruption propagates.
 */
public interface Worker {

    /**
     * @param budgetUsd upper bound on AI spend for this job
     */
    WorkerResult execute(Job job, double budgetUsd) throws InterruptedException;
}
