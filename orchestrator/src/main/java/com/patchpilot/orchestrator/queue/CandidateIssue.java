package com.patchpilot.orchestrator.queue;

import java.util.List;

/** An issue offered for ingestion by a {@link CandidateSource}. */
public record CandidateIssue(
        String       url,
        String       projectId,
        String       title,
        String       body,
        List<String> labels
) {}
