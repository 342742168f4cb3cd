package com.patchpilot.orchestrator.engine;

import com.patchpilot.orchestrator.admission.AdmissionDeniedException;
import com.patchpilot.orchestrator.admission.BudgetCheck;
import com.patchpilot.orchestrator.admission.BudgetManager;
import com.patchpilot.orchestrator.admission.RateLimitStatus;
import com.patchpilot.orchestrator.admission.RateLimiter;
import com.patchpilot.orchestrator.config.PatchPilotProperties;
import com.patchpilot.orchestrator.conflict.ConflictDetector;
import com.patchpilot.orchestrator.conflict.IssueText;
import com.patchpilot.orchestrator.conflict.PreflightConflictReport;
import com.patchpilot.orchestrator.lifecycle.InvalidTransitionException;
import com.patchpilot.orchestrator.lifecycle.JobNotFoundException;
import com.patchpilot.orchestrator.model.BatchItem;
import com.patchpilot.orchestrator.model.BatchItemStatus;
import com.patchpilot.orchestrator.model.Job;
import com.patchpilot.orchestrator.model.JobState;
import com.patchpilot.orchestrator.model.ParallelBatch;
import com.patchpilot.orchestrator.repository.BatchItemRepository;
import com.patchpilot.orchestrator.repository.JobRepository;
import com.patchpilot.orchestrator.repository.ParallelBatchRepository;
import com.patchpilot.orchestrator.resilience.BoundedSemaphore;
import com.patchpilot.orchestrator.worker.Worker;
import com.patchpilot.orchestrator.worker.WorkerResult;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs a batch of queued jobs concurrently, at most {@code maxConcurrent} at a time.
 *
 * Each job checks for cancellation twice: before it queues for a permit and
 * again once it holds one, so a job cancelled while waiting never occupies a
 * slot. Cancellation is cooperative; a job already handed to the worker runs
 * to completion.
 *
 * One job's failure never fails the batch: every outcome, including an
 * exception from the worker, becomes a {@link JobOutcome}.
 */
@Service
public class ParallelOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ParallelOrchestrator.class);

    private final JobRepository           jobRepo;
    private final ParallelBatchRepository batchRepo;
    private final BatchItemRepository     itemRepo;
    private final Worker                  worker;
    private final ConflictDetector        conflictDetector;
    private final BudgetManager           budget;
    private final RateLimiter             rateLimiter;
    private final PatchPilotProperties    props;
    private final ExecutorService         executor;
    private final Clock                   clock;
    private final MeterRegistry           meterRegistry;

    private final Map<UUID, BatchRun> running = new ConcurrentHashMap<>();

    public ParallelOrchestrator(JobRepository jobRepo,
                                ParallelBatchRepository batchRepo,
                                BatchItemRepository itemRepo,
                                Worker worker,
                                ConflictDetector conflictDetector,
                                BudgetManager budget,
                                RateLimiter rateLimiter,
                                PatchPilotProperties props,
                                @Qualifier("batchExecutor") ExecutorService executor,
                                Clock clock,
                                MeterRegistry meterRegistry) {
        this.jobRepo          = jobRepo;
        this.batchRepo        = batchRepo;
        this.itemRepo         = itemRepo;
        this.worker           = worker;
        this.conflictDetector = conflictDetector;
        this.budget           = budget;
        this.rateLimiter      = rateLimiter;
        this.props            = props;
        this.executor         = executor;
        this.clock            = clock;
        this.meterRegistry    = meterRegistry;
    }

    /**
     * Blocks until every job in the batch has finished or been cancelled.
     *
     * @throws JobNotFoundException      if any job id is unknown
     * @throws IllegalArgumentException  if the job list is empty
     * @throws InvalidTransitionException if any job is not QUEUED
     * @throws IllegalStateException     if any job already belongs to a running batch
     * @throws AdmissionDeniedException  if the daily PR cap or a spend limit is already reached
     */
    public ParallelWorkResult processJobs(ParallelWorkOptions options) throws InterruptedException {
        return execute(prepare(options));
    }

    /**
     * Starts the batch in the background and returns its id for {@link #status(UUID)}.
     *
     * @throws JobNotFoundException      if any job id is unknown
     * @throws IllegalArgumentException  if the job list is empty
     * @throws InvalidTransitionException if any job is not QUEUED
     * @throws IllegalStateException     if any job already belongs to a running batch
     * @throws AdmissionDeniedException  if the daily PR cap or a spend limit is already reached
     */
    public UUID submit(ParallelWorkOptions options) {
        BatchRun run = prepare(options);
        executor.submit(() -> {
            try {
                return execute(run);
            } catch (RuntimeException e) {
                log.error("Batch {} aborted: {}", run.batchId(), e.getMessage(), e);
                throw e;
            }
        });
        return run.batchId();
    }

    private synchronized BatchRun prepare(ParallelWorkOptions options) {
        if (options.jobIds().isEmpty()) {
            throw new IllegalArgumentException("A batch needs at least one job");
        }
        List<Job> jobs = options.jobIds().stream()
                .map(id -> jobRepo.findById(id).orElseThrow(() -> new JobNotFoundException(id)))
                .toList();
        for (Job job : jobs) {
            if (job.getState() != JobState.QUEUED) {
                throw new InvalidTransitionException(job.getId(), job.getState(), JobState.IN_PROGRESS);
            }
            if (running.values().stream().anyMatch(r -> r.outcomes.containsKey(job.getId()))) {
                throw new IllegalStateException("Job " + job.getId() + " is already part of a running batch");
            }
        }
        RateLimitStatus rate = rateLimiter.canCreateAnyPR();
        if (!rate.allowed()) {
            throw new AdmissionDeniedException(AdmissionDeniedException.Gate.RATE, rate.reason());
        }
        BudgetCheck spend = budget.canProceed();
        if (!spend.allowed()) {
            throw new AdmissionDeniedException(AdmissionDeniedException.Gate.BUDGET, spend.reason());
        }
        int maxConcurrent = options.maxConcurrent() != null
                ? options.maxConcurrent()
                : props.parallel().maxConcurrentAgents();
        BoundedSemaphore slots = new BoundedSemaphore(maxConcurrent);

        ParallelBatch batch = batchRepo.save(new ParallelBatch(maxConcurrent, jobs.size(), clock.instant()));
        BatchRun run = new BatchRun(batch, options, jobs, slots);
        for (Job job : jobs) {
            run.items.put(job.getId(), itemRepo.save(new BatchItem(batch.getId(), job.getId())));
            run.outcomes.put(job.getId(), JobOutcome.pending(job.getId(), job.getUrl()));
        }
        running.put(batch.getId(), run);
        log.info("Created batch {}: {} jobs, {} concurrent", batch.getId(), jobs.size(), maxConcurrent);
        return run;
    }

    private ParallelWorkResult execute(BatchRun run) throws InterruptedException {
        Instant start = clock.instant();
        MDC.put("batchId", run.batchId().toString());
        try {
            run.options.onProgress().accept(run.status(false));

            PreflightConflictReport conflicts = null;
            if (!run.options.skipConflictCheck() && props.parallel().enableConflictDetection()) {
                conflicts = preflight(run.jobs);
            }

            double perJobBudget = perJobBudget(run.options.maxBudgetUsd(), run.jobs.size());
            Map<String, String> mdc = MDC.getCopyOfContextMap();
            List<Future<JobOutcome>> futures = new ArrayList<>();
            for (Job job : run.jobs) {
                futures.add(executor.submit(() -> {
                    if (mdc != null) {
                        MDC.setContextMap(mdc);
                    }
                    try {
                        return runOne(run, job, perJobBudget);
                    } finally {
                        MDC.clear();
                    }
                }));
            }

            List<JobOutcome> results = new ArrayList<>();
            try {
                for (int i = 0; i < futures.size(); i++) {
                    results.add(await(futures.get(i), run, run.jobs.get(i)));
                }
            } catch (InterruptedException e) {
                run.cancelAll = true;
                futures.forEach(f -> f.cancel(true));
                throw e;
            }

            return finish(run, results, start, conflicts);
        } finally {
            running.remove(run.batchId());
            MDC.remove("batchId");
        }
    }

    /** Cancels one job in whichever running batch holds it. No effect once the job has started. */
    public boolean cancel(UUID jobId) {
        for (BatchRun run : running.values()) {
            if (run.outcomes.containsKey(jobId)) {
                run.cancelledJobs.add(jobId);
                log.info("Cancellation requested for job {} in batch {}", jobId, run.batchId());
                return true;
            }
        }
        return false;
    }

    public boolean cancelAll(UUID batchId) {
        BatchRun run = running.get(batchId);
        if (run == null) {
            return false;
        }
        run.cancelAll = true;
        log.info("Cancellation requested for all jobs in batch {}", batchId);
        return true;
    }

    /** Cancels every running batch. */
    public int cancelAll() {
        running.values().forEach(run -> run.cancelAll = true);
        log.info("Cancellation requested for {} running batch(es)", running.size());
        return running.size();
    }

    /** Live status for a running batch, otherwise what was persisted. */
    public Optional<BatchStatus> status(UUID batchId) {
        BatchRun run = running.get(batchId);
        if (run != null) {
            return Optional.of(run.status(false));
        }
        return batchRepo.findById(batchId).map(batch -> {
            List<JobOutcome> jobs = itemRepo.findByBatchId(batchId).stream()
                    .map(item -> new JobOutcome(item.getJobId(),
                            jobRepo.findById(item.getJobId()).map(Job::getUrl).orElse(null),
                            item.getStatus(), item.getArtifactUrl(), item.getCostUsd(),
                            item.getDurationMs(), item.getError()))
                    .toList();
            return BatchStatus.of(batchId, jobs, batch.isFinished());
        });
    }

    public List<ParallelBatch> recentBatches() {
        return batchRepo.findTop20ByOrderByStartedAtDesc();
    }

    // ------------------------------------------------------------------
    // Per job
    // ------------------------------------------------------------------

    private JobOutcome runOne(BatchRun run, Job job, double budgetUsd) throws InterruptedException {
        if (run.isCancelled(job.getId())) {
            return update(run, run.outcomes.get(job.getId()).cancelled());
        }

        run.slots.acquire();
        try {
            if (run.isCancelled(job.getId())) {
                return update(run, run.outcomes.get(job.getId()).cancelled());
            }
            JobOutcome current = update(run, run.outcomes.get(job.getId()).running());

            Instant started = clock.instant();
            try {
                WorkerResult result = worker.execute(job, budgetUsd);
                long durationMs = Duration.between(started, clock.instant()).toMillis();
                return update(run, result.success()
                        ? current.succeeded(result.artifact() == null ? null : result.artifact().url(),
                                result.costUsd(), durationMs)
                        : current.failed(result.error(), result.costUsd(), durationMs));
            } catch (RuntimeException e) {
                log.error("Job {} failed in batch {}: {}", job.getId(), run.batchId(), e.getMessage(), e);
                return update(run, current.failed(e.getMessage(), 0.0,
                        Duration.between(started, clock.instant()).toMillis()));
            }
        } finally {
            run.slots.release();
        }
    }

    private JobOutcome await(Future<JobOutcome> future, BatchRun run, Job job) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Job {} aborted in batch {}: {}", job.getId(), run.batchId(), cause.getMessage());
            return update(run, run.outcomes.get(job.getId()).failed(cause.getMessage(), 0.0, 0));
        }
    }

    private JobOutcome update(BatchRun run, JobOutcome outcome) {
        BatchStatus status;
        synchronized (run) {
            run.outcomes.put(outcome.jobId(), outcome);
            BatchItem item = run.items.get(outcome.jobId());
            if (outcome.status().isFinished()) {
                item.finish(outcome.status(), outcome.costUsd(), outcome.durationMs(),
                        outcome.artifactUrl(), outcome.error());
            } else {
                item.setStatus(outcome.status());
            }
            run.items.put(outcome.jobId(), itemRepo.save(item));

            status = run.status(false);
            run.batch.setCounts(status.pending(), status.inProgress(), status.completed(),
                    status.failed(), status.cancelled());
            run.batch.setTotalCostUsd(status.totalCostUsd());
            run.batch = batchRepo.save(run.batch);
        }
        if (outcome.status().isFinished()) {
            meterRegistry.counter("patchpilot.batch.jobs", "outcome", outcome.status().name().toLowerCase()).increment();
        }
        run.options.onProgress().accept(status);
        return outcome;
    }

    // ------------------------------------------------------------------
    // Batch level
    // ------------------------------------------------------------------

    private PreflightConflictReport preflight(List<Job> jobs) {
        log.info("Running pre-flight conflict detection");
        PreflightConflictReport report = conflictDetector.detectPreflightConflicts(
                jobs.stream().map(IssueText::of).toList());
        if (report.hasConflicts()) {
            log.warn("Pre-flight conflict detection found {} potential conflict(s)", report.conflictingIssues().size());
            for (PreflightConflictReport.ConflictingIssue conflict : report.conflictingIssues()) {
                for (PreflightConflictReport.Overlap overlap : conflict.overlapWith()) {
                    log.warn("  {} may conflict with {} (shared: {})", conflict.issueUrl(),
                            overlap.issueUrl(), String.join(", ", overlap.sharedFiles()));
                }
            }
        } else {
            log.info("No conflicts detected, proceeding with parallel processing");
        }
        return report;
    }

    double perJobBudget(Double batchBudgetUsd, int jobCount) {
        double perJob = budget.getEffectivePerJobBudget();
        if (batchBudgetUsd == null) {
            return perJob;
        }
        return Math.min(batchBudgetUsd / jobCount, perJob);
    }

    private ParallelWorkResult finish(BatchRun run,
                                      List<JobOutcome> results,
                                      Instant start,
                                      PreflightConflictReport conflicts) {
        int successful = 0, failed = 0, cancelled = 0;
        double cost = 0.0;
        for (JobOutcome r : results) {
            cost += r.costUsd();
            switch (r.status()) {
                case SUCCESS   -> successful++;
                case CANCELLED -> cancelled++;
                default        -> failed++;
            }
        }
        long durationMs = Duration.between(start, clock.instant()).toMillis();

        synchronized (run) {
            run.batch.setFinishedAt(clock.instant());
            run.batch.setTotalCostUsd(cost);
            run.batch = batchRepo.save(run.batch);
        }
        run.options.onProgress().accept(run.status(true));

        log.info("Batch {} complete: {} successful, {} failed, {} cancelled, cost ${}, {} ms",
                run.batchId(), successful, failed, cancelled, "%.4f".formatted(cost), durationMs);
        return new ParallelWorkResult(run.batchId(), failed == 0 && cancelled == 0, List.copyOf(results),
                new BatchSummary(results.size(), successful, failed, cancelled, cost, durationMs), conflicts);
    }

    /** Mutable state of one running batch. */
    private static final class BatchRun {

        final UUID                       id;
        final ParallelWorkOptions        options;
        final List<Job>                  jobs;
        final BoundedSemaphore           slots;
        final Map<UUID, BatchItem>       items         = new LinkedHashMap<>();
        final Map<UUID, JobOutcome>      outcomes      = new ConcurrentHashMap<>();
        final Set<UUID>                  cancelledJobs = ConcurrentHashMap.newKeySet();
        final List<UUID>                 order         = new ArrayList<>();
        volatile boolean                 cancelAll;
        ParallelBatch                    batch;

        BatchRun(ParallelBatch batch, ParallelWorkOptions options, List<Job> jobs, BoundedSemaphore slots) {
            this.id      = batch.getId();
            this.batch   = batch;
            this.options = options;
            this.jobs    = jobs;
            this.slots   = slots;
            order.addAll(options.jobIds());
        }

        UUID batchId() {
            return id;
        }

        boolean isCancelled(UUID jobId) {
            return cancelAll || cancelledJobs.contains(jobId);
        }

        BatchStatus status(boolean finished) {
            List<JobOutcome> current = order.stream().map(outcomes::get).filter(o -> o != null).toList();
            return BatchStatus.of(id, current, finished);
        }
    }
}
