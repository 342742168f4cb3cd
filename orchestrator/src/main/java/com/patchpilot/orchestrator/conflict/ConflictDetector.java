package com.patchpilot.orchestrator.conflict;

import com.patchpilot.orchestrator.model.Job;
import com.patchpilot.orchestrator.model.JobState;
import com.patchpilot.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Soft pre-flight detection of jobs likely to edit the same files.
 *
 * Two paths overlap when they are equal, one is a directory prefix of the
 * other, or they sit in the same directory. Results are warnings for the
 * operator and a skip signal for the queue picker, never a hard block.
 */
@Service
public class ConflictDetector {

    private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

    private final PathExtractor extractor;
    private final JobRepository jobRepo;

    public ConflictDetector(PathExtractor extractor, JobRepository jobRepo) {
        this.extractor = extractor;
        this.jobRepo   = jobRepo;
    }

    public List<String> analyzeJobScope(IssueText issue) {
        List<String> paths = new ArrayList<>(extractor.extract(issue.title(), issue.body()));
        log.debug("Scope of {}: {} path(s)", issue.url(), paths.size());
        return paths;
    }

    // ------------------------------------------------------------------
    // Batch analysis
    // ------------------------------------------------------------------

    public PreflightConflictReport detectPreflightConflicts(List<IssueText> issues) {
        List<List<String>> scopes = issues.stream().map(this::analyzeJobScope).toList();
        List<PreflightConflictReport.ConflictingIssue> conflicting = new ArrayList<>();

        for (int i = 0; i < issues.size(); i++) {
            List<PreflightConflictReport.Overlap> overlaps = new ArrayList<>();
            for (int j = i + 1; j < issues.size(); j++) {
                List<String> shared = overlapping(scopes.get(i), scopes.get(j));
                if (!shared.isEmpty()) {
                    overlaps.add(new PreflightConflictReport.Overlap(issues.get(j).url(), shared));
                }
            }
            if (!overlaps.isEmpty()) {
                conflicting.add(new PreflightConflictReport.ConflictingIssue(
                        issues.get(i).url(), scopes.get(i), overlaps));
            }
        }

        if (!conflicting.isEmpty()) {
            log.warn("Pre-flight conflict detection found {} potential conflict(s)", conflicting.size());
        }
        return new PreflightConflictReport(!conflicting.isEmpty(), conflicting);
    }

    /** Symmetric map: issue URL to the URLs of every other issue it overlaps with. */
    public Map<String, List<String>> analyzeAll(List<IssueText> issues) {
        List<List<String>> scopes = issues.stream().map(this::analyzeJobScope).toList();
        Map<String, List<String>> conflicts = new LinkedHashMap<>();
        for (int i = 0; i < issues.size(); i++) {
            for (int j = i + 1; j < issues.size(); j++) {
                if (!overlapping(scopes.get(i), scopes.get(j)).isEmpty()) {
                    String a = issues.get(i).url();
                    String b = issues.get(j).url();
                    conflicts.computeIfAbsent(a, k -> new ArrayList<>()).add(b);
                    conflicts.computeIfAbsent(b, k -> new ArrayList<>()).add(a);
                }
            }
        }
        return conflicts;
    }

    // ------------------------------------------------------------------
    // Against running work
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public ConflictCheck checkAgainstInProgress(IssueText candidate) {
        List<Job> running = jobRepo.findByState(JobState.IN_PROGRESS);
        if (running.isEmpty()) {
            return ConflictCheck.clear();
        }

        List<String> candidateFiles = analyzeJobScope(candidate);
        List<String> conflicts = new ArrayList<>();
        Set<String> files = new LinkedHashSet<>();
        for (Job job : running) {
            if (job.getUrl().equals(candidate.url())) {
                continue;
            }
            List<String> shared = overlapping(candidateFiles, analyzeJobScope(IssueText.of(job)));
            if (!shared.isEmpty()) {
                conflicts.add(job.getUrl());
                files.addAll(shared);
            }
        }

        if (!conflicts.isEmpty()) {
            log.warn("{} conflicts with {} in-progress job(s): {}",
                    candidate.url(), conflicts.size(), String.join(", ", conflicts));
        }
        return new ConflictCheck(conflicts.isEmpty(), conflicts, new ArrayList<>(files));
    }

    // ------------------------------------------------------------------
    // Path comparison
    // ------------------------------------------------------------------

    /** Paths of {@code a} that overlap any path of {@code b}. */
    static List<String> overlapping(List<String> a, List<String> b) {
        List<String> shared = new ArrayList<>();
        for (String fileA : a) {
            for (String fileB : b) {
                if (filesOverlap(fileA, fileB)) {
                    shared.add(fileA);
                    break;
                }
            }
        }
        return shared;
    }

    static boolean filesOverlap(String fileA, String fileB) {
        String a = normalize(fileA);
        String b = normalize(fileB);
        if (a.equals(b)) {
            return true;
        }
        if (a.startsWith(b + "/") || b.startsWith(a + "/")) {
            return true;
        }
        String dirA = parent(a);
        String dirB = parent(b);
        return !dirA.isEmpty() && dirA.equals(dirB);
    }

    /** Lower-case, forward slashes, no leading "./", no repeated or trailing slash. */
    public static String normalize(String path) {
        String p = path.toLowerCase().replace('\\', '/');
        if (p.startsWith("./")) {
            p = p.substring(2);
        }
        p = p.replaceAll("/+", "/");
        if (p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }

    private static String parent(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }
}
