package com.patchpilot.orchestrator.ci;

import com.patchpilot.orchestrator.ai.AiInvoker;
import com.patchpilot.orchestrator.ai.AiQuery;
import com.patchpilot.orchestrator.ai.AiResult;
import com.patchpilot.orchestrator.workspace.RepoLockProvider;
import com.patchpilot.orchestrator.workspace.WorkspaceException;
import com.patchpilot.orchestrator.workspace.WorkspaceOperations;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Waits for CI on a freshly opened PR and, when it fails, asks the AI to
 * repair the branch and tries again, up to {@code maxIterations} rounds.
 *
 * Iterations for one PR are strictly sequential. Every repair (switch to the
 * PR branch, AI edit, commit, push) runs under one hold of the repository
 * lock, since other jobs share the working copy between repairs.
 *
 * A repair that produces nothing gets one short self-heal re-poll before
 * the handler gives up, so a flaky check that goes green on its own still
 * counts as success.
 */
@Service
public class CiCheckHandler {

    private static final Logger log = LoggerFactory.getLogger(CiCheckHandler.class);

    private final CiCheckPoller       poller;
    private final CiStatusSource      ciSource;
    private final AiInvoker           ai;
    private final WorkspaceOperations git;
    private final RepoLockProvider    repoLocks;
    private final Clock               clock;
    private final MeterRegistry       meterRegistry;

    public CiCheckHandler(CiCheckPoller poller,
                          CiStatusSource ciSource,
                          AiInvoker ai,
                          WorkspaceOperations git,
                          RepoLockProvider repoLocks,
                          Clock clock,
                          MeterRegistry meterRegistry) {
        this.poller        = poller;
        this.ciSource      = ciSource;
        this.ai            = ai;
        this.git           = git;
        this.repoLocks     = repoLocks;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
    }

    public CiHandlerResult handleChecks(ArtifactRef artifact,
                                        Path workingCopy,
                                        String branch,
                                        CiHandlerOptions options) throws InterruptedException {
        Instant start = clock.instant();
        List<CiIteration> iterations = new ArrayList<>();
        double fixCost = 0.0;
        String aiSessionId = options.resumeSessionId();

        if (!options.waitForChecks()) {
            log.info("CI check waiting disabled for {}, skipping", artifact.url());
            return new CiHandlerResult(CiFinalStatus.SKIPPED, List.of(), 0, List.of(),
                    "CI check waiting was disabled", 0.0, aiSessionId);
        }

        int max = options.maxIterations();
        log.info("Handling CI checks for {}#{} (max iterations {}, auto-fix {})",
                artifact.projectId(), artifact.number(), max, options.autoFix());

        for (int attempt = 1; attempt <= max; attempt++) {
            Instant iterationStart = clock.instant();
            int current = attempt;
            progress(options, CiHandlerProgress.Phase.WAITING, attempt, "Waiting for CI checks to complete", null);

            CiPollResult checks = poller.waitForChecks(artifact, options.pollOptions(p -> progress(options,
                    CiHandlerProgress.Phase.WAITING, current,
                    "Waiting for CI: %d/%d completed".formatted(p.counts().completed(), p.counts().total()),
                    p.counts())));

            switch (checks.status()) {
                case NO_CHECKS -> {
                    countIteration(CiPollStatus.NO_CHECKS.name());
                    return finish(CiFinalStatus.NO_CHECKS, List.of(), start, List.of(),
                            "No CI checks are configured for this repository", fixCost, aiSessionId, options, attempt);
                }
                case SUCCESS -> {
                    iterations.add(CiIteration.withoutFix(attempt, checks, millisSince(iterationStart)));
                    countIteration("success");
                    return finish(CiFinalStatus.SUCCESS, iterations, start, checks.checks(),
                            "All %d CI checks passed".formatted(checks.checks().size()),
                            fixCost, aiSessionId, options, attempt);
                }
                case TIMEOUT -> {
                    iterations.add(CiIteration.withoutFix(attempt, checks, millisSince(iterationStart)));
                    countIteration("timeout");
                    return finish(CiFinalStatus.TIMEOUT, iterations, start, checks.checks(),
                            "CI checks timed out after %d ms".formatted(options.timeout().toMillis()),
                            fixCost, aiSessionId, options, attempt);
                }
                case FAILURE -> {
                    String failedNames = checks.failedChecks().stream()
                            .map(CheckRun::name)
                            .collect(Collectors.joining(", "));
                    log.warn("{} CI check(s) failed on {}: {}", checks.failedChecks().size(), artifact.url(), failedNames);

                    if (!options.autoFix()) {
                        iterations.add(CiIteration.withoutFix(attempt, checks, millisSince(iterationStart)));
                        countIteration("failure");
                        return finish(CiFinalStatus.FAILURE, iterations, start, checks.checks(),
                                "CI checks failed: " + failedNames + ". Auto-fix is disabled.",
                                fixCost, aiSessionId, options, attempt);
                    }

                    progress(options, CiHandlerProgress.Phase.ANALYZING, attempt, "Analyzing CI failures", null);
                    FixOutcome fix = attemptFix(artifact, workingCopy, branch, checks.failedChecks(),
                            options, aiSessionId, attempt);
                    fixCost += fix.costUsd();
                    if (fix.aiSessionId() != null) {
                        aiSessionId = fix.aiSessionId();
                    }

                    if (fix.success()) {
                        log.info("Fix applied and pushed as {}: {}", fix.commitSha(), fix.summary());
                        iterations.add(new CiIteration(attempt, checks, true, fix.commitSha(), fix.summary(),
                                millisSince(iterationStart)));
                        countIteration("fixed");
                        continue;
                    }

                    log.warn("Could not fix CI failures on {}: {}", artifact.url(), fix.error());
                    log.info("Re-checking CI status in case the checks recovered on their own");
                    CiPollResult recheck = poller.waitForChecks(artifact, options.selfHealPollOptions());
                    if (recheck.status() == CiPollStatus.SUCCESS) {
                        log.info("CI checks passing after self-heal re-poll");
                        iterations.add(CiIteration.withoutFix(attempt, recheck, millisSince(iterationStart)));
                        countIteration("self_healed");
                        return finish(CiFinalStatus.SUCCESS, iterations, start, recheck.checks(),
                                "All %d CI checks passed (after recheck)".formatted(recheck.checks().size()),
                                fixCost, aiSessionId, options, attempt);
                    }

                    iterations.add(CiIteration.withoutFix(attempt, checks, millisSince(iterationStart)));
                    countIteration("failure");
                    return finish(CiFinalStatus.FAILURE, iterations, start, recheck.checks(),
                            "CI checks failed and could not be fixed: " + fix.error(),
                            fixCost, aiSessionId, options, attempt);
                }
            }
        }

        log.warn("Max CI fix iterations ({}) reached for {}", max, artifact.url());
        List<CheckRun> lastChecks = iterations.isEmpty()
                ? List.of()
                : iterations.get(iterations.size() - 1).checkResult().checks();
        return finish(CiFinalStatus.MAX_ITERATIONS, iterations, start, lastChecks,
                "Maximum fix iterations (%d) reached without success".formatted(max),
                fixCost, aiSessionId, options, max);
    }

    private FixOutcome attemptFix(ArtifactRef artifact,
                                  Path workingCopy,
                                  String branch,
                                  List<CheckRun> failed,
                                  CiHandlerOptions options,
                                  String resumeSessionId,
                                  int attempt) throws InterruptedException {
        String prompt = buildFixPrompt(collectFailureLogs(artifact, failed));
        AiQuery query = new AiQuery(workingCopy, null, options.maxTurnsPerFix(), options.maxBudgetPerFixUsd(),
                resumeSessionId, options.fixTimeout());

        if (resumeSessionId != null) {
            log.info("Resuming AI session {} to fix CI failures", resumeSessionId);
        } else {
            log.info("Invoking AI to fix CI failures");
        }

        try {
            return repoLocks.withLock(workingCopy, () -> {
                git.switchBranch(workingCopy, branch);
                progress(options, CiHandlerProgress.Phase.FIXING, attempt, "Asking the AI to fix CI failures", null);
                AiResult result = ai.query(prompt, query);
                if (!result.success()) {
                    String error = result.error() == null ? "AI query failed" : result.error();
                    return FixOutcome.failed(error, result.costUsd(), result.sessionId());
                }
                try {
                    return commitAndPush(workingCopy, branch, options, attempt, result);
                } catch (RuntimeException e) {
                    // cost and session stay with the attempt
                    log.warn("CI fix attempt {} could not be pushed: {}", attempt, e.getMessage());
                    return FixOutcome.failed(e.getMessage(), result.costUsd(), result.sessionId());
                }
            });
        } catch (RuntimeException e) {
            log.warn("CI fix attempt {} failed: {}", attempt, e.getMessage());
            return FixOutcome.failed(e.getMessage(), 0.0, null);
        }
    }

    private FixOutcome commitAndPush(Path workingCopy,
                                     String branch,
                                     CiHandlerOptions options,
                                     int attempt,
                                     AiResult result) throws InterruptedException {
        if (!git.hasUncommittedChanges(workingCopy)) {
            return FixOutcome.failed("AI did not make any changes", result.costUsd(), result.sessionId());
        }
        progress(options, CiHandlerProgress.Phase.PUSHING, attempt, "Pushing CI fix", null);
        String summary = FailureLogParser.extractFixSummary(result.output());
        git.commitAll(workingCopy, "fix: address CI failures\n\n" + summary + "\n\nAuto-fixed by PatchPilot");
        try {
            git.push(workingCopy, branch, options.pushRemote(), false);
        } catch (WorkspaceException e) {
            log.warn("Push failed ({}), retrying with --no-verify", e.getMessage());
            git.push(workingCopy, branch, options.pushRemote(), true);
        }
        String sha = git.headSha(workingCopy);
        return new FixOutcome(true, summary, sha, null, result.costUsd(), result.sessionId());
    }

    List<FailureLog> collectFailureLogs(ArtifactRef artifact, List<CheckRun> failed) throws InterruptedException {
        List<FailureLog> logs = new ArrayList<>();
        for (CheckRun check : failed) {
            Optional<String> raw;
            try {
                raw = ciSource.getCheckLog(artifact, check);
            } catch (RuntimeException e) {
                log.debug("No log available for check {}: {}", check.name(), e.getMessage());
                raw = Optional.empty();
            }
            logs.add(new FailureLog(
                    check.name(),
                    check.status(),
                    check.conclusion(),
                    check.outputSummary(),
                    raw.map(FailureLogParser::truncate).orElse(null),
                    raw.map(FailureLogParser::parseErrors).orElse(List.of())));
        }
        return logs;
    }

    static String buildFixPrompt(List<FailureLog> failures) {
        StringBuilder prompt = new StringBuilder("""
                ## CI Checks Failed - Fix Required

                The following CI checks have failed and need to be fixed:

                """);
        for (FailureLog f : failures) {
            prompt.append("### ").append(f.checkName()).append('\n')
                  .append("**Status:** ").append(f.status().name().toLowerCase())
                  .append(" (").append(f.conclusion() == null ? "no conclusion" : f.conclusion()).append(")\n\n");
            if (f.summary() != null && !f.summary().isBlank()) {
                prompt.append("**Summary:**\n").append(f.summary()).append("\n\n");
            }
            if (!f.errors().isEmpty()) {
                prompt.append("**Errors Found:**\n```\n").append(String.join("\n", f.errors())).append("\n```\n\n");
            }
            if (f.log() != null) {
                prompt.append("**Log Output:**\n```\n").append(f.log()).append("\n```\n\n");
            }
        }
        prompt.append("""
                ## Your Task

                1. Analyze the CI failures above
                2. Identify the root cause of each failure
                3. Make the necessary code changes to fix the failures
                4. Focus on fixing the actual errors, not suppressing them

                After making changes, provide a brief summary of what you fixed.

                IMPORTANT: Only make changes that directly address the CI failures. Do not make unrelated improvements.
                """);
        return prompt.toString();
    }

    private CiHandlerResult finish(CiFinalStatus status,
                                   List<CiIteration> iterations,
                                   Instant start,
                                   List<CheckRun> finalChecks,
                                   String summary,
                                   double fixCost,
                                   String aiSessionId,
                                   CiHandlerOptions options,
                                   int attempt) {
        progress(options, CiHandlerProgress.Phase.COMPLETE, attempt, summary, null);
        log.info("CI handling finished with {}: {}", status, summary);
        return new CiHandlerResult(status, List.copyOf(iterations), millisSince(start), finalChecks,
                summary, fixCost, aiSessionId);
    }

    private void progress(CiHandlerOptions options, CiHandlerProgress.Phase phase, int attempt,
                          String message, CheckCounts counts) {
        options.onProgress().accept(new CiHandlerProgress(phase, attempt, options.maxIterations(), message, counts));
    }

    private void countIteration(String outcome) {
        meterRegistry.counter("patchpilot.ci.iterations", "outcome", outcome.toLowerCase()).increment();
    }

    private long millisSince(Instant start) {
        return Duration.between(start, clock.instant()).toMillis();
    }

    record FailureLog(String checkName, CheckStatus status, String conclusion, String summary,
                      String log, List<String> errors) {}

    private record FixOutcome(boolean success, String summary, String commitSha, String error,
                              double costUsd, String aiSessionId) {

        static FixOutcome failed(String error, double costUsd, String aiSessionId) {
            return new FixOutcome(false, null, null, error, costUsd, aiSessionId);
        }
    }
}
