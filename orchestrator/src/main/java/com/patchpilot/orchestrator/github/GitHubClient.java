package com.patchpilot.orchestrator.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.patchpilot.orchestrator.ci.ArtifactRef;
import com.patchpilot.orchestrator.ci.CheckRun;
import com.patchpilot.orchestrator.ci.CheckStatus;
import com.patchpilot.orchestrator.ci.CiStatusSource;
import com.patchpilot.orchestrator.config.PatchPilotProperties;
import com.patchpilot.orchestrator.resilience.CircuitBreakerRegistry;
import com.patchpilot.orchestrator.resilience.GuardedCalls;
import com.patchpilot.orchestrator.resilience.RateLimitedException;
import com.patchpilot.orchestrator.resilience.TransientException;
import com.patchpilot.orchestrator.worker.ArtifactPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Thin client for the parts of the GitHub REST API the engine needs:
 * check runs and job logs (as the {@link CiStatusSource}), pull request
 * creation (as the {@link ArtifactPublisher}), and open issue listing.
 *
 * Uses java.net.http.HttpClient directly. Every request runs through
 * {@link GuardedCalls}, so 5xx answers, I/O errors and throttling are
 * retried (pull request creation excepted, see {@link #provablyNotCreated}),
 * and repeated failures open the operation's circuit.
 */
@Component
public class GitHubClient implements CiStatusSource, ArtifactPublisher {

    private static final Logger log = LoggerFactory.getLogger(GitHubClient.class);

    private static final String   API_VERSION = "2022-11-28";
    private static final Duration TIMEOUT     = Duration.ofSeconds(30);

    // -------------------------------------------------------------------------
    // Wire records (snake_case to match the API)
    // -------------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PullRequestJson(long number, String html_url, Head head) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Head(String sha, String ref) {}
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CheckRunsJson(int total_count, List<CheckRunJson> check_runs) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CheckRunJson(long id, String name, String status, String conclusion, String details_url, Output output) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Output(String title, String summary) {}
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RepositoryJson(String full_name, String default_branch) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IssueJson(long number, String html_url, String title, String body, List<LabelJson> labels,
                     Map<String, Object> pull_request) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record LabelJson(String name) {}
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private final HttpClient   http;
    private final ObjectMapper json;
    private final GuardedCalls guarded;
    private final Clock        clock;
    private final String       baseUrl;
    private final String       token;
    private final Duration     ciTimeout;

    public GitHubClient(PatchPilotProperties props, ObjectMapper objectMapper, GuardedCalls guarded, Clock clock) {
        this.baseUrl   = stripTrailingSlash(props.github().apiBaseUrl());
        this.token     = props.github().token();
        this.ciTimeout = Duration.ofMillis(props.watchdog().ciTimeoutMs());
        this.json      = objectMapper;
        this.guarded   = guarded;
        this.clock     = clock;
        this.http      = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NEVER)   // log downloads redirect to storage that rejects our token
                .build();
    }

    // -------------------------------------------------------------------------
    // CiStatusSource
    // -------------------------------------------------------------------------

    @Override
    public List<CheckRun> getChecks(ArtifactRef artifact) throws InterruptedException {
        return guarded.call(CircuitBreakerRegistry.CI_STATUS, () -> {
            PullRequestJson pr = read(get(ciRequest(repoPath(artifact.projectId()) + "/pulls/" + artifact.number()),
                    "get pull request " + artifact.url()), PullRequestJson.class);
            CheckRunsJson runs = read(get(ciRequest(repoPath(artifact.projectId()) + "/commits/" + pr.head().sha()
                    + "/check-runs?per_page=100"), "list check runs for " + artifact.url()), CheckRunsJson.class);
            if (runs.check_runs() == null) {
                return List.of();
            }
            return runs.check_runs().stream().map(GitHubClient::toCheckRun).toList();
        });
    }

    /** Actions job log for a check run; empty when the check is not an Actions job or the log expired. */
    @Override
    public Optional<String> getCheckLog(ArtifactRef artifact, CheckRun check) throws InterruptedException {
        if (check.id() == null) {
            return Optional.empty();
        }
        return guarded.call(CircuitBreakerRegistry.CI_STATUS, () -> {
            HttpResponse<String> resp = send(ciRequest(repoPath(artifact.projectId())
                    + "/actions/jobs/" + check.id() + "/logs").GET().build(), "get log for " + check.name());
            if (resp.statusCode() == 404 || resp.statusCode() == 410) {
                return Optional.<String>empty();
            }
            if (resp.statusCode() == 302) {
                String location = resp.headers().firstValue("location")
                        .orElseThrow(() -> new GitHubException("Log redirect without location", 302));
                HttpResponse<String> download = send(HttpRequest.newBuilder(URI.create(location))
                        .timeout(ciTimeout).GET().build(), "download log for " + check.name());
                return Optional.of(checked(download, "download log for " + check.name()));
            }
            return Optional.of(checked(resp, "get log for " + check.name()));
        });
    }

    // -------------------------------------------------------------------------
    // ArtifactPublisher
    // -------------------------------------------------------------------------

    /** Opens a PR from {@code branch} against the repository's default branch. */
    @Override
    public ArtifactRef publish(String projectId, String branch, String title, String body) throws InterruptedException {
        String base = defaultBranch(projectId);
        return guarded.call(CircuitBreakerRegistry.PR_CREATE, GitHubClient::provablyNotCreated, () -> {
            log.info("Creating pull request on {} from {} into {}", projectId, branch, base);
            String payload = toJson(Map.of("title", title, "head", branch, "base", base, "body", body));
            HttpResponse<String> resp = send(request(repoPath(projectId) + "/pulls")
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(payload))
                    .build(), "create pull request on " + projectId);
            PullRequestJson pr = read(checked(resp, "create pull request on " + projectId), PullRequestJson.class);
            log.info("Created pull request {}", pr.html_url());
            return new ArtifactRef(projectId, (int) pr.number(), pr.html_url());
        });
    }

    /**
     * Retry filter for pull request creation. A POST that timed out or got a
     * 5xx may still have created the PR, so only throttling and failures to
     * connect are repeated.
     */
    static boolean provablyNotCreated(RuntimeException e) {
        if (e instanceof RateLimitedException) {
            return true;
        }
        Throwable cause = e.getCause();
        return cause instanceof ConnectException || cause instanceof HttpConnectTimeoutException;
    }

    public String defaultBranch(String projectId) throws InterruptedException {
        return guarded.call(CircuitBreakerRegistry.PR_CREATE, () ->
                read(get(request(repoPath(projectId)), "get repository " + projectId), RepositoryJson.class).default_branch());
    }

    // -------------------------------------------------------------------------
    // Issues
    // -------------------------------------------------------------------------

    /** Open issues (pull requests excluded), oldest first, optionally restricted to one label. */
    public List<IssueJson> listOpenIssues(String projectId, String label, int limit) throws InterruptedException {
        int perPage = Math.max(1, Math.min(limit, 100));
        StringBuilder path = new StringBuilder(repoPath(projectId))
                .append("/issues?state=open&sort=created&direction=asc&per_page=").append(perPage);
        if (label != null && !label.isBlank()) {
            path.append("&labels=").append(URLEncoder.encode(label, StandardCharsets.UTF_8));
        }
        return guarded.call(CircuitBreakerRegistry.ISSUE_LIST, () -> {
            IssueJson[] issues = read(get(request(path.toString()), "list issues for " + projectId), IssueJson[].class);
            return Arrays.stream(issues)
                    .filter(i -> i.pull_request() == null)
                    .toList();
        });
    }

    // -------------------------------------------------------------------------
    // Private helpers
    // -------------------------------------------------------------------------

    static CheckRun toCheckRun(CheckRunJson run) {
        return new CheckRun(
                String.valueOf(run.id()),
                run.name(),
                CheckStatus.fromGitHub(run.status(), run.conclusion()),
                run.conclusion(),
                run.details_url(),
                run.output() == null ? null : run.output().summary());
    }

    private String get(HttpRequest.Builder request, String opName) throws InterruptedException {
        return checked(send(request.GET().build(), opName), opName);
    }

    /** CI status and log reads, bounded by {@code watchdog.ci-timeout-ms}. */
    HttpRequest.Builder ciRequest(String path) {
        return request(path, ciTimeout);
    }

    private HttpRequest.Builder request(String path) {
        return request(path, TIMEOUT);
    }

    private HttpRequest.Builder request(String path, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", API_VERSION);
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder;
    }

    private HttpResponse<String> send(HttpRequest request, String opName) throws InterruptedException {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransientException(opName + " failed: " + e.getMessage(), e);
        }
    }

    /** Returns the body of a 2xx response; otherwise throws the exception matching the status. */
    String checked(HttpResponse<String> resp, String opName) {
        int status = resp.statusCode();
        if (status >= 200 && status < 300) {
            return resp.body();
        }
        if (status == 429 || (status == 403 && isRateLimited(resp))) {
            throw new RateLimitedException(opName + " throttled by GitHub (HTTP " + status + ")", retryAfter(resp));
        }
        if (status >= 500) {
            throw new TransientException(opName + " failed: HTTP " + status);
        }
        throw new GitHubException(opName + " failed: HTTP " + status + ": " + resp.body(), status);
    }

    private static boolean isRateLimited(HttpResponse<String> resp) {
        return resp.headers().firstValue("retry-after").isPresent()
                || resp.headers().firstValue("x-ratelimit-remaining").map("0"::equals).orElse(false);
    }

    /** Retry-After seconds, else time until x-ratelimit-reset; null when GitHub gave no hint. */
    private Duration retryAfter(HttpResponse<String> resp) {
        Optional<String> retryAfter = resp.headers().firstValue("retry-after");
        if (retryAfter.isPresent()) {
            return Duration.ofSeconds(parseLong(retryAfter.get()));
        }
        return resp.headers().firstValue("x-ratelimit-reset")
                .map(reset -> Duration.between(clock.instant(), Instant.ofEpochSecond(parseLong(reset))))
                .filter(d -> !d.isNegative())
                .orElse(null);
    }

    private static long parseLong(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Unparseable rate limit header '{}'", value);
            return 0L;
        }
    }

    private <T> T read(String body, Class<T> type) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new GitHubException("Failed to parse GitHub response as " + type.getSimpleName(), e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new GitHubException("JSON serialization failed", e);
        }
    }

    private static String repoPath(String projectId) {
        if (projectId == null || !projectId.contains("/")) {
            throw new IllegalArgumentException("Project id must look like owner/repo, got '" + projectId + "'");
        }
        return "/repos/" + projectId;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
