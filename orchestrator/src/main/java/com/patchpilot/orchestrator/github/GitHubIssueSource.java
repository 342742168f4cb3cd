package com.patchpilot.orchestrator.github;

import com.patchpilot.orchestrator.config.PatchPilotProperties;
import com.patchpilot.orchestrator.queue.CandidateIssue;
import com.patchpilot.orchestrator.queue.CandidateSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Offers open issues from the watched repositories. With labels configured,
 * an issue qualifies if it carries any one of them.
 */
@Component
public class GitHubIssueSource implements CandidateSource {

    private static final Logger log = LoggerFactory.getLogger(GitHubIssueSource.class);

    private final GitHubClient github;
    private final List<String> repositories;
    private final List<String> labels;

    public GitHubIssueSource(GitHubClient github, PatchPilotProperties props) {
        this.github       = github;
        this.repositories = props.github().repositories();
        this.labels       = props.github().labels();
    }

    @Override
    public String name() {
        return "github";
    }

    @Override
    public List<CandidateIssue> findCandidates(int limit) throws InterruptedException {
        Map<String, CandidateIssue> found = new LinkedHashMap<>();
        List<String> filters = labels.isEmpty() ? Collections.singletonList(null) : labels;
        scan:
        for (String repo : repositories) {
            for (String label : filters) {
                if (found.size() >= limit) {
                    break scan;
                }
                for (GitHubClient.IssueJson issue : github.listOpenIssues(repo, label, limit)) {
                    found.putIfAbsent(issue.html_url(), toCandidate(repo, issue));
                }
            }
        }
        log.debug("Found {} candidate issue(s) across {} repositories", found.size(), repositories.size());
        return new ArrayList<>(found.values()).subList(0, Math.min(limit, found.size()));
    }

    static CandidateIssue toCandidate(String repo, GitHubClient.IssueJson issue) {
        List<String> names = issue.labels() == null
                ? List.of()
                : issue.labels().stream().map(GitHubClient.IssueJson.LabelJson::name).toList();
        return new CandidateIssue(issue.html_url(), repo, issue.title(),
                issue.body() == null ? "" : issue.body(), names);
    }
}
