package com.patchpilot.orchestrator.lifecycle;

import com.patchpilot.orchestrator.model.Job;
import com.patchpilot.orchestrator.model.JobState;
import com.patchpilot.orchestrator.model.JobTransition;
import com.patchpilot.orchestrator.repository.JobRepository;
import com.patchpilot.orchestrator.repository.JobTransitionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static com.patchpilot.orchestrator.model.JobState.*;

/**
 * The only writer of {@link Job#getState()}.
 *
 * <pre>
 *   DISCOVERED  → QUEUED | ABANDONED
 *   QUEUED      → IN_PROGRESS | ABANDONED
 *   IN_PROGRESS → PR_CREATED | ABANDONED
 *   PR_CREATED  → AWAITING_FEEDBACK | MERGED | CLOSED
 *   AWAITING_FEEDBACK ⇄ ITERATING, both → MERGED | CLOSED
 * </pre>
 *
 * Once a PR exists the job can no longer be abandoned: it has to be closed,
 * which an operator does explicitly. Terminal states have no outgoing edges.
 *
 * Each transition updates the job row and appends a job_transitions row in
 * one transaction; the job's {@code @Version} column rejects a concurrent writer.
 */
@Service
public class JobStateMachine {

    private static final Logger log = LoggerFactory.getLogger(JobStateMachine.class);

    private static final Map<JobState, Set<JobState>> ALLOWED = new EnumMap<>(JobState.class);

    static {
        ALLOWED.put(DISCOVERED,        EnumSet.of(QUEUED, ABANDONED));
        ALLOWED.put(QUEUED,            EnumSet.of(IN_PROGRESS, ABANDONED));
        ALLOWED.put(IN_PROGRESS,       EnumSet.of(PR_CREATED, ABANDONED));
        ALLOWED.put(PR_CREATED,        EnumSet.of(AWAITING_FEEDBACK, MERGED, CLOSED));
        ALLOWED.put(AWAITING_FEEDBACK, EnumSet.of(ITERATING, MERGED, CLOSED));
        ALLOWED.put(ITERATING,         EnumSet.of(AWAITING_FEEDBACK, MERGED, CLOSED));
        ALLOWED.put(MERGED,            EnumSet.noneOf(JobState.class));
        ALLOWED.put(CLOSED,            EnumSet.noneOf(JobState.class));
        ALLOWED.put(ABANDONED,         EnumSet.noneOf(JobState.class));
    }

    private final JobRepository           jobRepo;
    private final JobTransitionRepository transitionRepo;
    private final Clock                   clock;

    public JobStateMachine(JobRepository jobRepo, JobTransitionRepository transitionRepo, Clock clock) {
        this.jobRepo        = jobRepo;
        this.transitionRepo = transitionRepo;
        this.clock          = clock;
    }

    public static boolean canTransition(JobState from, JobState to) {
        return ALLOWED.get(from).contains(to);
    }

    public static Set<JobState> allowedTargets(JobState from) {
        return EnumSet.copyOf(ALLOWED.get(from));
    }

    /**
     * Move a job along one edge.
     *
     * Entering QUEUED stamps {@code queuedAt}; entering ABANDONED or CLOSED
     * records the reason on the job.
     *
     * @throws JobNotFoundException        if the job does not exist
     * @throws InvalidTransitionException  if the edge is not allowed
     */
    @Transactional
    public Job transition(UUID jobId, JobState target, String reason, UUID sessionId) {
        Job job = jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        JobState from = job.getState();
        if (!canTransition(from, target)) {
            throw new InvalidTransitionException(jobId, from, target);
        }

        job.setState(target);
        if (target == QUEUED) {
            job.setQueuedAt(clock.instant());
        }
        if (target == ABANDONED || target == CLOSED) {
            job.setLastReason(reason);
        }
        Job saved = jobRepo.save(job);
        transitionRepo.save(new JobTransition(jobId, from, target, reason, sessionId, clock.instant()));

        log.info("Job {} {} -> {}{}", jobId, from, target, reason == null ? "" : " (" + reason + ")");
        return saved;
    }

    @Transactional
    public Job transition(UUID jobId, JobState target, String reason) {
        return transition(jobId, target, reason, null);
    }

    @Transactional(readOnly = true)
    public List<JobTransition> history(UUID jobId) {
        if (!jobRepo.existsById(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        return transitionRepo.findByJobIdOrderByCreatedAtAsc(jobId);
    }
}
