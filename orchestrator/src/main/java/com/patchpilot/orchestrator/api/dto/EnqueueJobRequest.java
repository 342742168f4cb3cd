package com.patchpilot.orchestrator.api.dto;

import com.patchpilot.orchestrator.queue.CandidateIssue;

import java.util.List;

/**
 * Request body for POST /jobs.
 *
 * Required: url, projectId ("owner/repo").
 * Optional: title, body, labels. The body is what the conflict detector
 *   scans for file paths, so paste the issue text when you have it.
 */
public record EnqueueJobRequest(String url, String projectId, String title, String body, List<String> labels) {

    public EnqueueJobRequest {
        labels = labels == null ? List.of() : labels;
        title  = title == null ? "" : title;
        body   = body == null ? "" : body;
    }

    public CandidateIssue toCandidate() {
        return new CandidateIssue(url, projectId, title, body, labels);
    }
}
