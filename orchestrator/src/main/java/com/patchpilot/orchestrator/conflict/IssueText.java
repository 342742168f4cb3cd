package com.patchpilot.orchestrator.conflict;

import com.patchpilot.orchestrator.model.Job;

/** The parts of an issue conflict detection reads. */
public record IssueText(String url, String title, String body) {

    public static IssueText of(Job job) {
        return new IssueText(job.getUrl(), job.getTitle(), job.getBody());
    }
}
