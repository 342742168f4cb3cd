package com.patchpilot.orchestrator.conflict;

import java.util.List;

/**
 * Pairwise overlaps within a batch. Each pair is listed once, under the
 * issue that comes first in the input.
 */
public record PreflightConflictReport(boolean hasConflicts, List<ConflictingIssue> conflictingIssues) {

    public record ConflictingIssue(String issueUrl, List<String> predictedFiles, List<Overlap> overlapWith) {}

    public record Overlap(String issueUrl, List<String> sharedFiles) {}
}
