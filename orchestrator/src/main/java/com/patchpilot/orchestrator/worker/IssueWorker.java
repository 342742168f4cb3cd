package com.patchpilot.orchestrator.worker;

import com.patchpilot.orchestrator.OrchestratorException;
import com.patchpilot.orchestrator.admission.BudgetManager;
import com.patchpilot.orchestrator.admission.UsageCounters;
import com.patchpilot.orchestrator.ai.AiFailureException;
import com.patchpilot.orchestrator.ai.AiInvoker;
import com.patchpilot.orchestrator.ai.AiQuery;
import com.patchpilot.orchestrator.ai.AiResult;
import com.patchpilot.orchestrator.ci.ArtifactRef;
import com.patchpilot.orchestrator.ci.CiCheckHandler;
import com.patchpilot.orchestrator.ci.CiHandlerOptions;
import com.patchpilot.orchestrator.ci.CiHandlerResult;
import com.patchpilot.orchestrator.ci.FailureLogParser;
import com.patchpilot.orchestrator.config.PatchPilotProperties;
import com.patchpilot.orchestrator.lifecycle.JobStateMachine;
import com.patchpilot.orchestrator.lifecycle.SessionService;
import com.patchpilot.orchestrator.model.Job;
import com.patchpilot.orchestrator.model.JobState;
import com.patchpilot.orchestrator.model.Session;
import com.patchpilot.orchestrator.model.WorkRecord;
import com.patchpilot.orchestrator.repository.JobRepository;
import com.patchpilot.orchestrator.workspace.RepoLockProvider;
import com.patchpilot.orchestrator.workspace.WorkspaceOperations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;

/**
 * The default {@link Worker}: one GitHub issue to one pull request.
 *
 * <pre>
 *   QUEUED -> IN_PROGRESS     open a session, check out the job branch
 *                             AI edits the working copy (resuming the previous AI session, if any)
 *          -> ABANDONED       AI failed or made no change
 *          -> PR_CREATED      commit, push, open the pull request
 *          -> AWAITING_FEEDBACK  after the CI repair loop, whatever its verdict
 * </pre>
 *
 * Checkout, edit, commit and push happen under one hold of the repository
 * lock for the project's working copy, which every job of the project shares.
 * All AI spend is recorded against the budget whether or not the job succeeds.
 * A job whose pickup is refused by the state machine is left untouched.
 */
@Component
public class IssueWorker implements Worker {

    private static final Logger log = LoggerFactory.getLogger(IssueWorker.class);

    private final JobStateMachine      stateMachine;
    private final JobRepository        jobRepo;
    private final SessionService       sessions;
    private final AiInvoker            ai;
    private final WorkspaceOperations  git;
    private final RepoLockProvider     repoLocks;
    private final ArtifactPublisher    publisher;
    private final CiCheckHandler       ciHandler;
    private final BudgetManager        budget;
    private final UsageCounters        counters;
    private final PatchPilotProperties props;

    public IssueWorker(JobStateMachine stateMachine,
                       JobRepository jobRepo,
                       SessionService sessions,
                       AiInvoker ai,
                       WorkspaceOperations git,
                       RepoLockProvider repoLocks,
                       ArtifactPublisher publisher,
                       CiCheckHandler ciHandler,
                       BudgetManager budget,
                       UsageCounters counters,
                       PatchPilotProperties props) {
        this.stateMachine = stateMachine;
        this.jobRepo      = jobRepo;
        this.sessions     = sessions;
        this.ai           = ai;
        this.git          = git;
        this.repoLocks    = repoLocks;
        this.publisher    = publisher;
        this.ciHandler    = ciHandler;
        this.budget       = budget;
        this.counters     = counters;
        this.props        = props;
    }

    @Override
    public WorkerResult execute(Job job, double budgetUsd) throws InterruptedException {
        UUID jobId = job.getId();
        MDC.put("jobId", jobId.toString());
        Session session = null;
        double cost = 0.0;
        int turns = 0;
        boolean claimed = false;
        try {
            stateMachine.transition(jobId, JobState.IN_PROGRESS, "picked up by worker");
            claimed = true;
            session = sessions.open(jobId);
            MDC.put("sessionId", session.getId().toString());

            Path repo = workingCopy(job.getProjectId());
            String branch = branchName(job);
            WorkRecord record = sessions.attachWorkRecord(jobId, repo.toString(), branch);
            String resume = record.getAiSessionId();
            log.info("Working on {} in {} on branch {} (budget ${})", job.getUrl(), repo, branch, budgetUsd);

            AiQuery query = new AiQuery(repo, props.ai().model(), props.ai().maxTurns(), budgetUsd, resume,
                    Duration.ofMillis(props.watchdog().aiTimeoutMs()));
            AgentRun run = repoLocks.withLock(repo, () -> {
                git.checkoutBranch(repo, branch);
                AiResult aiResult = ai.query(IssuePrompts.forIssue(job), query);
                if (!aiResult.success()) {
                    return new AgentRun(aiResult, false, null, null);
                }
                String fixSummary = FailureLogParser.extractFixSummary(aiResult.output());
                try {
                    if (!git.hasUncommittedChanges(repo)) {
                        return new AgentRun(aiResult, false, fixSummary, null);
                    }
                    git.commitAll(repo, "fix: " + job.getTitle() + "\n\n" + fixSummary + "\n\nResolves " + job.getUrl());
                    git.push(repo, branch, props.ci().pushRemote(), false);
                    return new AgentRun(aiResult, true, fixSummary, null);
                } catch (RuntimeException e) {
                    return new AgentRun(aiResult, false, fixSummary, e);
                }
            });
            AiResult result = run.result();
            cost += result.costUsd();
            turns += result.turns();
            session = sessions.recordActivity(session.getId(), result.turns(), result.costUsd(), result.sessionId());
            sessions.recordAttempt(jobId, session, result.costUsd());
            budget.recordSpend(job.getProjectId(), jobId, result.costUsd());

            if (!result.success()) {
                throw new AiFailureException(result.error() == null ? "AI run failed" : result.error(), result.costUsd());
            }

            if (run.gitFailure() != null) {
                throw run.gitFailure();
            }
            if (!run.pushed()) {
                throw new AiFailureException("AI did not make any changes", result.costUsd());
            }
            String summary = run.summary();

            ArtifactRef pr = publisher.publish(job.getProjectId(), branch, job.getTitle(),
                    IssuePrompts.pullRequestBody(job, summary));
            counters.recordPrCreated(job.getProjectId(), jobId);
            sessions.recordArtifact(jobId, pr.url());
            linkArtifact(jobId, pr.url());
            stateMachine.transition(jobId, JobState.PR_CREATED, pr.url(), session.getId());

            CiHandlerResult ci = ciHandler.handleChecks(pr, repo, branch,
                    CiHandlerOptions.from(props).withResumeSessionId(session.getAiSessionId()));
            if (ci.totalFixCostUsd() > 0) {
                cost += ci.totalFixCostUsd();
                sessions.recordActivity(session.getId(), 0, ci.totalFixCostUsd(), ci.aiSessionId());
                sessions.addCost(jobId, ci.totalFixCostUsd());
                budget.recordSpend(job.getProjectId(), jobId, ci.totalFixCostUsd());
            }
            stateMachine.transition(jobId, JobState.AWAITING_FEEDBACK,
                    "CI " + ci.finalStatus().name().toLowerCase() + ": " + ci.summary(), session.getId());
            sessions.complete(session.getId());

            log.info("Job {} produced {} (cost ${}, CI {})", jobId, pr.url(), cost, ci.finalStatus());
            return WorkerResult.succeeded(pr, cost, turns);

        } catch (RuntimeException e) {
            if (!claimed) {
                log.warn("Job {} was not picked up: {}", jobId, e.getMessage());
                return WorkerResult.failed(e.getMessage(), 0.0, 0);
            }
            if (e instanceof OrchestratorException) {
                log.error("Job {} failed: {}", jobId, e.getMessage());
            } else {
                log.error("Job {} failed unexpectedly", jobId, e);
            }
            abandon(job, session, e);
            return WorkerResult.failed(e.getMessage(), cost, turns);
        } catch (InterruptedException e) {
            if (session != null) {
                sessions.fail(session.getId(), "Interrupted", true);
            }
            throw e;
        } finally {
            MDC.remove("sessionId");
            MDC.remove("jobId");
        }
    }

    /** What happened under the repository lock; {@code gitFailure} is set when commit or push threw. */
    private record AgentRun(AiResult result, boolean pushed, String summary, RuntimeException gitFailure) {
    }

    private void abandon(Job job, Session session, RuntimeException cause) {
        // AI failures can be picked up again from the saved AI session
        boolean resumable = cause instanceof AiFailureException;
        if (session != null) {
            sessions.fail(session.getId(), cause.getMessage(), resumable);
        }
        JobState current = jobRepo.findById(job.getId()).map(Job::getState).orElse(null);
        if (current != null && JobStateMachine.canTransition(current, JobState.ABANDONED)) {
            stateMachine.transition(job.getId(), JobState.ABANDONED, cause.getMessage(),
                    session == null ? null : session.getId());
        }
    }

    private void linkArtifact(UUID jobId, String url) {
        jobRepo.findById(jobId).ifPresent(j -> {
            j.setLinkedArtifactUrl(url);
            jobRepo.save(j);
        });
    }

    Path workingCopy(String projectId) {
        return Path.of(props.workspace().root()).resolve(projectId).toAbsolutePath().normalize();
    }

    /** {@code patchpilot/issue-<number>}, falling back to the job id for non-numeric URLs. */
    static String branchName(Job job) {
        String url = job.getUrl();
        String tail = url.substring(url.lastIndexOf('/') + 1);
        return tail.matches("\\d+") ? "patchpilot/issue-" + tail : "patchpilot/job-" + job.getId();
    }
}
