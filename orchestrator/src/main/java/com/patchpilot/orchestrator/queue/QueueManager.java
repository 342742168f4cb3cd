package com.patchpilot.orchestrator.queue;

import com.patchpilot.orchestrator.admission.RateLimitStatus;
import com.patchpilot.orchestrator.admission.RateLimiter;
import com.patchpilot.orchestrator.config.PatchPilotProperties;
import com.patchpilot.orchestrator.conflict.ConflictCheck;
import com.patchpilot.orchestrator.conflict.ConflictDetector;
import com.patchpilot.orchestrator.conflict.IssueText;
import com.patchpilot.orchestrator.lifecycle.JobStateMachine;
import com.patchpilot.orchestrator.model.Job;
import com.patchpilot.orchestrator.model.JobState;
import com.patchpilot.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The backlog: jobs in QUEUED state, oldest {@code queuedAt} first.
 *
 * Ingestion is deduplicated by issue URL against every job ever stored,
 * whatever its state, so a merged or abandoned issue is never picked up again.
 */
@Service
public class QueueManager {

    private static final Logger log = LoggerFactory.getLogger(QueueManager.class);

    private final JobRepository                jobRepo;
    private final JobStateMachine              stateMachine;
    private final RateLimiter                  rateLimiter;
    private final ConflictDetector             conflictDetector;
    private final List<CandidateSource>        sources;
    private final PatchPilotProperties.Queue   queue;
    private final boolean                      conflictChecks;

    public QueueManager(JobRepository jobRepo,
                        JobStateMachine stateMachine,
                        RateLimiter rateLimiter,
                        ConflictDetector conflictDetector,
                        List<CandidateSource> sources,
                        PatchPilotProperties props) {
        this.jobRepo          = jobRepo;
        this.stateMachine     = stateMachine;
        this.rateLimiter      = rateLimiter;
        this.conflictDetector = conflictDetector;
        this.sources          = sources;
        this.queue            = props.queue();
        this.conflictChecks   = props.parallel().enableConflictDetection();
    }

    // ------------------------------------------------------------------
    // Status
    // ------------------------------------------------------------------

    public QueueStatus getQueueStatus() {
        int size = (int) jobRepo.countByState(JobState.QUEUED);
        return new QueueStatus(size, size < queue.minQueueSize(), queue.minQueueSize(), queue.targetQueueSize());
    }

    public boolean needsReplenishment() {
        return jobRepo.countByState(JobState.QUEUED) < queue.minQueueSize();
    }

    public List<Job> getQueuedJobs() {
        return jobRepo.findByStateOrderByQueuedAtAsc(JobState.QUEUED);
    }

    // ------------------------------------------------------------------
    // Ingestion
    // ------------------------------------------------------------------

    /**
     * Add one candidate to the backlog.
     *
     * @return the new job, or empty if an issue with this URL is already stored
     */
    public Optional<Job> enqueue(CandidateIssue candidate) {
        if (jobRepo.existsByUrl(candidate.url())) {
            log.debug("Issue already tracked, skipping: {}", candidate.url());
            return Optional.empty();
        }
        Job job;
        try {
            job = jobRepo.save(new Job(candidate.url(), candidate.projectId(),
                    candidate.title(), candidate.body(), candidate.labels()));
        } catch (DataIntegrityViolationException e) {
            // Lost a race with another ingester on the unique url column.
            log.debug("Issue inserted concurrently, skipping: {}", candidate.url());
            return Optional.empty();
        }
        Job queued = stateMachine.transition(job.getId(), JobState.QUEUED, "Added to queue");
        log.debug("Queued {}", candidate.url());
        return Optional.of(queued);
    }

    /**
     * Pull candidates from every source until the backlog reaches
     * targetQueueSize. A failing source is recorded and skipped.
     */
    public ReplenishmentResult replenish() throws InterruptedException {
        int current = (int) jobRepo.countByState(JobState.QUEUED);
        int toAdd = queue.targetQueueSize() - current;
        if (toAdd <= 0) {
            log.debug("Queue at or above target size ({}), nothing to replenish", current);
            return ReplenishmentResult.nothing();
        }
        log.info("Replenishing queue: need {} issue(s) to reach target of {}", toAdd, queue.targetQueueSize());

        int added = 0;
        List<ReplenishmentResult.SourceCount> counts = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (CandidateSource source : sources) {
            if (added >= toAdd) {
                break;
            }
            int fromSource = 0;
            try {
                for (CandidateIssue candidate : source.findCandidates(toAdd - added)) {
                    if (added >= toAdd) {
                        break;
                    }
                    if (enqueue(candidate).isPresent()) {
                        added++;
                        fromSource++;
                    }
                }
            } catch (RuntimeException e) {
                String msg = "Failed to fetch candidates from " + source.name() + ": " + e.getMessage();
                log.warn(msg, e);
                errors.add(msg);
            }
            if (fromSource > 0) {
                counts.add(new ReplenishmentResult.SourceCount(source.name(), fromSource));
            }
        }

        log.info("Queue replenishment complete: added {} issue(s)", added);
        return new ReplenishmentResult(added, counts, errors);
    }

    // ------------------------------------------------------------------
    // Selection
    // ------------------------------------------------------------------

    /**
     * Up to {@code count} backlog jobs, oldest first, skipping any whose project
     * is rate limited or whose files overlap work in progress.
     */
    public List<Job> getNextIssues(int count) {
        List<Job> selected = new ArrayList<>();
        for (Job job : jobRepo.findByStateOrderByQueuedAtAsc(JobState.QUEUED)) {
            if (selected.size() >= count) {
                break;
            }
            RateLimitStatus rate = rateLimiter.canCreatePR(job.getProjectId());
            if (!rate.allowed()) {
                log.debug("Skipping {}: rate limited - {}", job.getUrl(), rate.reason());
                continue;
            }
            if (conflictChecks) {
                ConflictCheck check = conflictDetector.checkAgainstInProgress(IssueText.of(job));
                if (!check.safe()) {
                    log.debug("Skipping {}: conflicts with {}", job.getUrl(), check.conflicts());
                    continue;
                }
            }
            selected.add(job);
        }
        return selected;
    }

    /**
     * The oldest admissible job, or null when none qualifies right now.
     * Null does not mean the backlog is empty; check {@link #getQueueStatus()}.
     */
    public Job getNextIssue() {
        List<Job> next = getNextIssues(1);
        return next.isEmpty() ? null : next.get(0);
    }

    // ------------------------------------------------------------------
    // Operator actions
    // ------------------------------------------------------------------

    /** Abandons a queued job. False if the URL is unknown or not queued. */
    public boolean removeFromQueue(String url) {
        Optional<Job> job = queuedByUrl(url);
        job.ifPresent(j -> stateMachine.transition(j.getId(), JobState.ABANDONED, "Removed from queue"));
        return job.isPresent();
    }

    /** Moves a queued job ahead of everything else in the backlog. */
    public boolean prioritize(String url) {
        Optional<Job> found = queuedByUrl(url);
        if (found.isEmpty()) {
            return false;
        }
        Job job = found.get();
        Instant front = jobRepo.findByStateOrderByQueuedAtAsc(JobState.QUEUED).stream()
                .map(Job::getQueuedAt)
                .filter(at -> at != null)
                .findFirst()
                .orElse(job.getQueuedAt());
        job.setQueuedAt(front.minusMillis(1));
        jobRepo.save(job);
        log.info("Prioritized {}", url);
        return true;
    }

    /** Abandons every queued job. */
    public int clearQueue(String reason) {
        List<Job> queued = jobRepo.findByStateOrderByQueuedAtAsc(JobState.QUEUED);
        for (Job job : queued) {
            stateMachine.transition(job.getId(), JobState.ABANDONED, reason);
        }
        log.info("Cleared {} job(s) from queue: {}", queued.size(), reason);
        return queued.size();
    }

    private Optional<Job> queuedByUrl(String url) {
        Optional<Job> job = jobRepo.findByUrl(url);
        if (job.isEmpty()) {
            log.warn("Issue not found: {}", url);
            return Optional.empty();
        }
        if (job.get().getState() != JobState.QUEUED) {
            log.warn("Issue is not in queue (state: {}): {}", job.get().getState(), url);
            return Optional.empty();
        }
        return job;
    }
}
