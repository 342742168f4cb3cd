package com.patchpilot.orchestrator.github;

import com.patchpilot.orchestrator.OrchestratorException;

/**
 * GitHub answered with a non-retryable error (4xx other than throttling),
 * or its response could not be parsed.
 */
public class GitHubException extends OrchestratorException {

    private final int statusCode;

    public GitHubException(String message, int statusCode) {
        super("GITHUB", message);
        this.statusCode = statusCode;
    }

    public GitHubException(String message, Throwable cause) {
        super("GITHUB", message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or -1 when the failure was not an HTTP response. */
    public int statusCode() { return statusCode; }
}
