package com.patchpilot.orchestrator.ci;

/**
 * A pull request produced for a job.
 *
 * @param projectId "owner/repo"
 */
public record ArtifactRef(String projectId, int number, String url) {

    /** Parses {@code https://github.com/owner/repo/pull/123}. */
    public static ArtifactRef parse(String url) {
        String[] parts = url.replaceFirst("^https?://[^/]+/", "").split("/");
        if (parts.length < 4 || !"pull".equals(parts[2])) {
            throw new IllegalArgumentException("Not a pull request URL: " + url);
        }
        return new ArtifactRef(parts[0] + "/" + parts[1], Integer.parseInt(parts[3]), url);
    }
}
