package com.patchpilot.orchestrator.worker;

import com.patchpilot.orchestrator.model.Job;

/** Prompt text handed to the AI agent when it starts on an issue. */
final class IssuePrompts {

    private IssuePrompts() {}

    static String forIssue(Job job) {
        String labels = job.getLabels().isEmpty() ? "none" : String.join(", ", job.getLabels());
        return WORK_PROMPT
                .replace("{{URL}}", job.getUrl())
                .replace("{{TITLE}}", job.getTitle())
                .replace("{{LABELS}}", labels)
                .replace("{{BODY}}", job.getBody() == null || job.getBody().isBlank()
                        ? "(no description)" : job.getBody());
    }

    static String pullRequestBody(Job job, String summary) {
        return """
                Resolves %s

                ## Summary
                %s

                ---
                Opened automatically by PatchPilot.
                """.formatted(job.getUrl(), summary);
    }

    private static final String WORK_PROMPT = """
            You are working on a GitHub issue in the repository checked out in the current directory.

            Issue: {{URL}}
            Title: {{TITLE}}
            Labels: {{LABELS}}

            {{BODY}}

            YOUR TASK:
            1. Read the relevant code before changing anything.
            2. Make the smallest change that resolves the issue.
            3. Add or update tests that cover the change.
            4. Run the project's tests and fix anything you broke.

            Do NOT commit or push; that is done for you afterwards.
            Do NOT make unrelated refactors, formatting changes or dependency upgrades.

            When you are done, end with a line starting with "Summary:" describing what you changed.
            """;
}
