package com.patchpilot.orchestrator.ci;

public record CheckRun(
        String      id,
        String      name,
        CheckStatus status,
        String      conclusion,
        String      detailsUrl,
        String      outputSummary
) {

    static CheckRun missing(String name) {
        return new CheckRun(null, name, CheckStatus.PENDING, null, null, null);
    }
}
