package com.patchpilot.orchestrator.engine;

import com.patchpilot.orchestrator.admission.BudgetCheck;
import com.patchpilot.orchestrator.admission.BudgetManager;
import com.patchpilot.orchestrator.admission.RateLimitStatus;
import com.patchpilot.orchestrator.admission.RateLimiter;
import com.patchpilot.orchestrator.config.PatchPilotProperties;
import com.patchpilot.orchestrator.lifecycle.JobStateMachine;
import com.patchpilot.orchestrator.model.Job;
import com.patchpilot.orchestrator.model.JobState;
import com.patchpilot.orchestrator.queue.QueueManager;
import com.patchpilot.orchestrator.queue.ReplenishmentResult;
import com.patchpilot.orchestrator.resilience.Sleeper;
import com.patchpilot.orchestrator.worker.Worker;
import com.patchpilot.orchestrator.worker.WorkerResult;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Works through the queue one job at a time until a limit is hit.
 *
 * Each iteration:
 * <ol>
 *   <li>check limits: iterations, duration, run budget, daily PR cap, daily/monthly budget</li>
 *   <li>replenish the backlog if it is low</li>
 *   <li>take the next admissible job (rate limit and conflict checks)</li>
 *   <li>hand it to the {@link Worker}, add its cost to the run total</li>
 *   <li>cool down</li>
 * </ol>
 *
 * {@link #requestStop()} is honoured at the top of the loop, so the current
 * job always finishes. While paused the loop idles instead of taking jobs.
 * A job failure is counted and the loop moves on; anything else that
 * escapes the loop ends the run with {@link StopReason#ERROR}.
 */
@Service
public class AutonomousRunner {

    private static final Logger log = LoggerFactory.getLogger(AutonomousRunner.class);

    private final QueueManager         queue;
    private final RateLimiter          rateLimiter;
    private final BudgetManager        budget;
    private final JobStateMachine      stateMachine;
    private final Worker               worker;
    private final PatchPilotProperties props;
    private final ExecutorService      executor;
    private final Clock                clock;
    private final Sleeper              sleeper;
    private final MeterRegistry        meterRegistry;

    private final List<RunnerListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean        active    = new AtomicBoolean(false);

    private volatile boolean      stopRequested;
    private volatile boolean      paused;
    private volatile RunnerState  state = RunnerState.STOPPED;
    private volatile int          iteration;
    private volatile Instant      startedAt;
    private volatile int          succeeded;
    private volatile int          failed;
    private volatile double       totalCostUsd;
    private volatile String       currentJobUrl;
    private volatile int          queueSize;
    private volatile RunnerResult lastResult;

    public AutonomousRunner(QueueManager queue,
                            RateLimiter rateLimiter,
                            BudgetManager budget,
                            JobStateMachine stateMachine,
                            Worker worker,
                            PatchPilotProperties props,
                            @Qualifier("runnerExecutor") ExecutorService executor,
                            Clock clock,
                            Sleeper sleeper,
                            MeterRegistry meterRegistry) {
        this.queue         = queue;
        this.rateLimiter   = rateLimiter;
        this.budget        = budget;
        this.stateMachine  = stateMachine;
        this.worker        = worker;
        this.props         = props;
        this.executor      = executor;
        this.clock         = clock;
        this.sleeper       = sleeper;
        this.meterRegistry = meterRegistry;
    }

    public void addListener(RunnerListener listener)    { listeners.add(listener); }
    public void removeListener(RunnerListener listener) { listeners.remove(listener); }

    /**
     * Runs the loop on the runner thread and returns immediately.
     *
     * @throws IllegalStateException if a run is already active
     */
    public Future<RunnerResult> start(RunnerOptions options) {
        claim();
        return executor.submit(() -> loop(options));
    }

    /**
     * Runs the loop on the calling thread until it stops.
     *
     * @throws IllegalStateException if a run is already active
     */
    public RunnerResult run(RunnerOptions options) {
        claim();
        return loop(options);
    }

    public void requestStop() {
        if (!active.get()) {
            return;
        }
        log.info("Stop requested, finishing current job");
        stopRequested = true;
        state = RunnerState.STOPPING;
        publishStatus();
    }

    public void pause() {
        if (state == RunnerState.RUNNING) {
            paused = true;
            state = RunnerState.PAUSED;
            log.info("Autonomous mode paused");
            publishStatus();
        }
    }

    public void resume() {
        if (state == RunnerState.PAUSED) {
            paused = false;
            state = RunnerState.RUNNING;
            log.info("Autonomous mode resumed");
            publishStatus();
        }
    }

    public RunnerStatus getStatus() {
        return new RunnerStatus(state, iteration, startedAt, succeeded, failed,
                totalCostUsd, currentJobUrl, queueSize);
    }

    public boolean isActive() {
        return active.get();
    }

    /** Result of the most recent finished run. */
    public Optional<RunnerResult> lastResult() {
        return Optional.ofNullable(lastResult);
    }

    // ------------------------------------------------------------------
    // Loop
    // ------------------------------------------------------------------

    private void claim() {
        if (!active.compareAndSet(false, true)) {
            throw new IllegalStateException("Autonomous runner is already active");
        }
        stopRequested = false;
        paused        = false;
        iteration     = 0;
        succeeded     = 0;
        failed        = 0;
        totalCostUsd  = 0.0;
        currentJobUrl = null;
        startedAt     = clock.instant();
        state         = RunnerState.RUNNING;
    }

    private RunnerResult loop(RunnerOptions options) {
        List<ProcessedJob> processed = new ArrayList<>();
        int iterations = 0;
        StopReason reason = StopReason.COMPLETED;

        log.info("Starting autonomous mode (maxIterations={}, maxDuration={}, maxBudget={}, dryRun={})",
                options.maxIterations(), options.maxDuration(), options.maxBudgetUsd(), options.dryRun());
        publishStatus();

        try {
            while (true) {
                if (stopRequested) {
                    reason = StopReason.MANUAL_STOP;
                    break;
                }
                if (paused) {
                    sleeper.sleep(props.runner().pauseIdle());
                    continue;
                }

                StopReason limit = checkLimits(options, iterations);
                if (limit != null) {
                    reason = limit;
                    break;
                }

                if (options.autoReplenish() && queue.needsReplenishment()) {
                    log.info("Queue low, replenishing");
                    ReplenishmentResult replenished = queue.replenish();
                    fire(l -> l.onQueueReplenished(replenished.added()));
                    if (replenished.added() == 0 && queue.getQueueStatus().size() == 0) {
                        log.info("Queue empty and replenishment found no issues");
                        reason = StopReason.EMPTY_QUEUE;
                        break;
                    }
                }

                Job job = queue.getNextIssue();
                if (job == null) {
                    if (queue.getQueueStatus().size() == 0) {
                        reason = StopReason.EMPTY_QUEUE;
                        break;
                    }
                    log.debug("No admissible job right now, backing off");
                    sleeper.sleep(props.runner().noCandidateBackoff());
                    continue;
                }

                iteration++;
                currentJobUrl = job.getUrl();
                publishStatus();
                fire(l -> l.onJobStart(job.getUrl()));

                ProcessedJob outcome = options.dryRun() ? simulate(job) : process(job, options);
                processed.add(outcome);
                if (outcome.success()) {
                    succeeded++;
                    fire(l -> l.onJobComplete(outcome.url(), outcome.artifactUrl()));
                } else {
                    failed++;
                    fire(l -> l.onJobFailed(outcome.url(), outcome.error()));
                }

                iterations++;
                currentJobUrl = null;
                queueSize = queue.getQueueStatus().size();
                publishStatus();

                if (!stopRequested && !options.cooldown().isZero()) {
                    log.debug("Cooling down for {} ms", options.cooldown().toMillis());
                    sleeper.sleep(options.cooldown());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Autonomous run interrupted");
            reason = StopReason.MANUAL_STOP;
        } catch (RuntimeException e) {
            log.error("Autonomous run error: {}", e.getMessage(), e);
            reason = StopReason.ERROR;
        }

        long durationMs = Duration.between(startedAt, clock.instant()).toMillis();
        RunnerResult result = new RunnerResult(iterations, durationMs, List.copyOf(processed), totalCostUsd, reason);
        lastResult = result;
        state = RunnerState.STOPPED;
        currentJobUrl = null;
        active.set(false);
        publishStatus();

        log.info("Autonomous mode finished: {} iterations, {} succeeded, {} failed, cost ${}, reason {}",
                iterations, succeeded, failed, "%.4f".formatted(totalCostUsd), reason);
        return result;
    }

    StopReason checkLimits(RunnerOptions options, int iterations) {
        if (options.maxIterations() != null && iterations >= options.maxIterations()) {
            log.info("Max iterations reached ({})", options.maxIterations());
            return StopReason.MAX_ITERATIONS;
        }
        if (options.maxDuration() != null
                && Duration.between(startedAt, clock.instant()).compareTo(options.maxDuration()) >= 0) {
            log.info("Max duration reached ({})", options.maxDuration());
            return StopReason.MAX_DURATION;
        }
        if (options.maxBudgetUsd() != null && totalCostUsd >= options.maxBudgetUsd()) {
            log.info("Max budget reached (${})", options.maxBudgetUsd());
            return StopReason.MAX_BUDGET;
        }
        RateLimitStatus rate = rateLimiter.canCreateAnyPR();
        if (!rate.allowed()) {
            log.info("Daily rate limit reached: {}", rate.reason());
            return StopReason.RATE_LIMITED;
        }
        BudgetCheck spend = budget.canProceed();
        if (!spend.allowed()) {
            log.info("Budget limit exceeded: {}", spend.reason());
            return StopReason.BUDGET_EXCEEDED;
        }
        return null;
    }

    private ProcessedJob process(Job job, RunnerOptions options) throws InterruptedException {
        double jobBudget = budget.getEffectivePerJobBudget();
        if (options.maxBudgetUsd() != null) {
            jobBudget = Math.min(jobBudget, options.maxBudgetUsd() - totalCostUsd);
        }
        try {
            WorkerResult result = worker.execute(job, jobBudget);
            totalCostUsd += result.costUsd();
            meterRegistry.counter("patchpilot.runner.jobs", "outcome", result.success() ? "success" : "failure")
                    .increment();
            return new ProcessedJob(job.getUrl(), result.success(),
                    result.artifact() == null ? null : result.artifact().url(), result.error());
        } catch (RuntimeException e) {
            log.error("Failed to process {}: {}", job.getUrl(), e.getMessage(), e);
            meterRegistry.counter("patchpilot.runner.jobs", "outcome", "failure").increment();
            return new ProcessedJob(job.getUrl(), false, null, e.getMessage());
        }
    }

    private ProcessedJob simulate(Job job) {
        log.info("[DRY RUN] Would process: {}", job.getUrl());
        stateMachine.transition(job.getId(), JobState.ABANDONED, "Dry run - simulated processing");
        return new ProcessedJob(job.getUrl(), true, null, null);
    }

    private void publishStatus() {
        RunnerStatus status = getStatus();
        fire(l -> l.onStatusChanged(status));
    }

    private void fire(Consumer<RunnerListener> event) {
        for (RunnerListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Runner listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
