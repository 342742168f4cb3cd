package com.patchpilot.orchestrator.queue;

import java.util.List;

/**
 * Discovery/selection collaborator: where new work comes from.
 *
 * Implementations may return issues that are already tracked; the queue
 * filters those out by URL.
 */
public interface CandidateSource {

    String name();

    /**
     * @param limit upper bound on how many candidates the caller can still take
     * @throws RuntimeException if the source is unreachable; the queue records
     *         the error and moves on to the next source
     */
    List<CandidateIssue> findCandidates(int limit) throws InterruptedException;
}
