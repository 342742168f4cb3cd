package com.patchpilot.orchestrator.engine;

import com.patchpilot.orchestrator.admission.AdmissionDeniedException;
import com.patchpilot.orchestrator.admission.BudgetCheck;
import com.patchpilot.orchestrator.admission.BudgetManager;
import com.patchpilot.orchestrator.admission.RateLimitStatus;
import com.patchpilot.orchestrator.admission.RateLimiter;
import com.patchpilot.orchestrator.ci.ArtifactRef;
import com.patchpilot.orchestrator.conflict.ConflictDetector;
import com.patchpilot.orchestrator.conflict.HeuristicPathExtractor;
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
import com.patchpilot.orchestrator.support.MutableClock;
import com.patchpilot.orchestrator.support.TestEntities;
import com.patchpilot.orchestrator.support.TestProperties;
import com.patchpilot.orchestrator.worker.Worker;
import com.patchpilot.orchestrator.worker.WorkerResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ParallelOrchestratorTest {

    @Mock JobRepository           jobRepo;
    @Mock ParallelBatchRepository batchRepo;
    @Mock BatchItemRepository     itemRepo;
    @Mock BudgetManager           budget;
    @Mock RateLimiter             rateLimiter;

    ExecutorService     executor      = Executors.newCachedThreadPool();
    ExecutorService     caller        = Executors.newSingleThreadExecutor();
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    Map<UUID, Job>      known         = new HashMap<>();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        caller.shutdownNow();
    }

    ParallelOrchestrator orchestrator(Worker worker) {
        return new ParallelOrchestrator(jobRepo, batchRepo, itemRepo, worker,
                new ConflictDetector(new HeuristicPathExtractor(), jobRepo), budget, rateLimiter,
                TestProperties.defaults(), executor, MutableClock.at("2026-03-01T10:00:00Z"), meterRegistry);
    }

    List<UUID> given(Job... jobs) {
        List<UUID> ids = new ArrayList<>();
        for (Job job : jobs) {
            known.put(job.getId(), job);
            ids.add(job.getId());
        }
        when(jobRepo.findById(any())).thenAnswer(inv -> Optional.ofNullable(known.get(inv.<UUID>getArgument(0))));
        return ids;
    }

    void admits() {
        when(rateLimiter.canCreateAnyPR()).thenReturn(
                new RateLimitStatus(true, null, 0, Map.of(), 10, 3, null));
        when(budget.canProceed()).thenReturn(new BudgetCheck(true, null, 0, 50, 0, 500, 50, 500));
        when(budget.getEffectivePerJobBudget()).thenReturn(5.0);
        when(batchRepo.save(any())).thenAnswer(inv -> {
            ParallelBatch batch = inv.getArgument(0);
            return batch.getId() == null ? TestEntities.withId(batch) : batch;
        });
        when(itemRepo.save(any(BatchItem.class))).then(returnsFirstArg());
    }

    static WorkerResult opened(Job job, double cost) {
        String pr = job.getUrl().replace("/issues/", "/pull/");
        return WorkerResult.succeeded(ArtifactRef.parse(pr), cost, 3);
    }

    @Test
    void runsEveryJobAndSumsTheCost() throws Exception {
        List<UUID> ids = given(TestEntities.job(1, JobState.QUEUED), TestEntities.job(2, JobState.QUEUED),
                TestEntities.job(3, JobState.QUEUED));
        admits();
        List<BatchStatus> progress = new CopyOnWriteArrayList<>();

        ParallelWorkResult result = orchestrator((job, budgetUsd) -> opened(job, 1.25))
                .processJobs(new ParallelWorkOptions(ids, null, null, false, progress::add));

        assertThat(result.success()).isTrue();
        assertThat(result.summary().successful()).isEqualTo(3);
        assertThat(result.summary().totalCostUsd()).isEqualTo(3.75);
        assertThat(result.results()).extracting(JobOutcome::jobId).containsExactlyElementsOf(ids);
        assertThat(result.results()).extracting(JobOutcome::artifactUrl)
                .containsExactly("https://github.com/acme/api/pull/1", "https://github.com/acme/api/pull/2",
                        "https://github.com/acme/api/pull/3");
        assertThat(progress.get(progress.size() - 1).finished()).isTrue();
        assertThat(progress.get(progress.size() - 1).completed()).isEqualTo(3);
        assertThat(meterRegistry.counter("patchpilot.batch.jobs", "outcome", "success").count()).isEqualTo(3.0);
    }

    @Test
    void neverRunsMoreThanMaxConcurrentAtOnce() throws Exception {
        Job[] jobs = new Job[8];
        for (int i = 0; i < jobs.length; i++) {
            jobs[i] = TestEntities.job(i + 1, JobState.QUEUED);
        }
        List<UUID> ids = given(jobs);
        admits();
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak   = new AtomicInteger();

        ParallelWorkResult result = orchestrator((job, budgetUsd) -> {
            peak.accumulateAndGet(active.incrementAndGet(), Math::max);
            Thread.sleep(20);
            active.decrementAndGet();
            return opened(job, 0.5);
        }).processJobs(new ParallelWorkOptions(ids, 2, null, true, null));

        assertThat(result.summary().successful()).isEqualTo(8);
        assertThat(peak.get()).isBetween(1, 2);
    }

    @Test
    void oneFailingJobDoesNotFailTheOthers() throws Exception {
        Job broken = TestEntities.job(2, JobState.QUEUED);
        List<UUID> ids = given(TestEntities.job(1, JobState.QUEUED), broken, TestEntities.job(3, JobState.QUEUED));
        admits();

        ParallelWorkResult result = orchestrator((job, budgetUsd) -> {
            if (job == broken) {
                throw new IllegalStateException("working copy is corrupt");
            }
            return job.getUrl().endsWith("/3")
                    ? WorkerResult.failed("AI did not make any changes", 0.4, 2)
                    : opened(job, 1.0);
        }).processJobs(ParallelWorkOptions.of(ids));

        assertThat(result.success()).isFalse();
        assertThat(result.results()).extracting(JobOutcome::status)
                .containsExactly(BatchItemStatus.SUCCESS, BatchItemStatus.FAILURE, BatchItemStatus.FAILURE);
        assertThat(result.results().get(1).error()).isEqualTo("working copy is corrupt");
        assertThat(result.summary().failed()).isEqualTo(2);
        assertThat(result.summary().totalCostUsd()).isEqualTo(1.4);
    }

    @Test
    void cancelledJobWaitingForASlotNeverReachesTheWorker() throws Exception {
        List<UUID> ids = given(TestEntities.job(1, JobState.QUEUED), TestEntities.job(2, JobState.QUEUED));
        admits();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<UUID> first = new AtomicReference<>();
        List<UUID> executed = Collections.synchronizedList(new ArrayList<>());
        ParallelOrchestrator orchestrator = orchestrator((job, budgetUsd) -> {
            executed.add(job.getId());
            first.compareAndSet(null, job.getId());
            started.countDown();
            release.await();
            return opened(job, 1.0);
        });

        Future<ParallelWorkResult> pending = caller.submit(
                () -> orchestrator.processJobs(new ParallelWorkOptions(ids, 1, null, true, null)));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        UUID other = ids.get(0).equals(first.get()) ? ids.get(1) : ids.get(0);
        assertThat(orchestrator.cancel(other)).isTrue();
        release.countDown();
        ParallelWorkResult result = pending.get(5, TimeUnit.SECONDS);

        assertThat(executed).containsExactly(first.get());
        assertThat(result.summary().successful()).isEqualTo(1);
        assertThat(result.summary().cancelled()).isEqualTo(1);
        assertThat(result.success()).isFalse();
        assertThat(orchestrator.cancel(other)).isFalse();
    }

    @Test
    void cancelAllStopsEverythingNotYetStarted() throws Exception {
        List<UUID> ids = given(TestEntities.job(1, JobState.QUEUED), TestEntities.job(2, JobState.QUEUED),
                TestEntities.job(3, JobState.QUEUED));
        admits();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ParallelOrchestrator orchestrator = orchestrator((job, budgetUsd) -> {
            started.countDown();
            release.await();
            return opened(job, 1.0);
        });

        Future<ParallelWorkResult> pending = caller.submit(
                () -> orchestrator.processJobs(new ParallelWorkOptions(ids, 1, null, true, null)));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(orchestrator.cancelAll()).isEqualTo(1);
        release.countDown();
        ParallelWorkResult result = pending.get(5, TimeUnit.SECONDS);

        assertThat(result.summary().successful()).isEqualTo(1);
        assertThat(result.summary().cancelled()).isEqualTo(2);
    }

    @Test
    void splitsTheBatchBudgetButNeverAboveThePerJobLimit() throws Exception {
        List<UUID> ids = given(TestEntities.job(1, JobState.QUEUED), TestEntities.job(2, JobState.QUEUED),
                TestEntities.job(3, JobState.QUEUED));
        admits();
        List<Double> budgets = new CopyOnWriteArrayList<>();

        orchestrator((job, budgetUsd) -> {
            budgets.add(budgetUsd);
            return opened(job, 0.0);
        }).processJobs(new ParallelWorkOptions(ids, null, 6.0, true, null));

        assertThat(budgets).containsOnly(2.0);

        ParallelOrchestrator plain = orchestrator((job, budgetUsd) -> opened(job, 0.0));
        assertThat(plain.perJobBudget(null, 3)).isEqualTo(5.0);
        assertThat(plain.perJobBudget(60.0, 3)).isEqualTo(5.0);
    }

    @Test
    void reportsOverlappingJobsBeforeStarting() throws Exception {
        List<UUID> ids = given(
                TestEntities.job("https://github.com/acme/api/issues/1", "acme/api", "Login crash",
                        "Crash in src/auth.ts when the token is empty", JobState.QUEUED),
                TestEntities.job("https://github.com/acme/api/issues/2", "acme/api", "Refactor auth",
                        "Split src/auth.ts into smaller modules", JobState.QUEUED));
        admits();

        ParallelWorkResult result = orchestrator((job, budgetUsd) -> opened(job, 0.0))
                .processJobs(ParallelWorkOptions.of(ids));

        assertThat(result.conflicts()).isNotNull();
        assertThat(result.conflicts().hasConflicts()).isTrue();
        assertThat(result.conflicts().conflictingIssues().get(0).overlapWith().get(0).sharedFiles())
                .containsExactly("src/auth.ts");
    }

    @Test
    void refusesJobsThatAreNoLongerQueued() {
        List<UUID> ids = given(TestEntities.job(1, JobState.QUEUED), TestEntities.job(2, JobState.IN_PROGRESS));
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> orchestrator((job, b) -> {
            calls.incrementAndGet();
            return opened(job, 0.0);
        }).processJobs(ParallelWorkOptions.of(ids)))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessageContaining("IN_PROGRESS");
        assertThat(calls).hasValue(0);
        verify(batchRepo, never()).save(any());
    }

    @Test
    void refusesAJobThatAnotherRunningBatchAlreadyHolds() throws Exception {
        List<UUID> ids = given(TestEntities.job(1, JobState.QUEUED));
        admits();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ParallelOrchestrator orchestrator = orchestrator((job, budgetUsd) -> {
            started.countDown();
            release.await();
            return opened(job, 1.0);
        });

        Future<ParallelWorkResult> pending = caller.submit(
                () -> orchestrator.processJobs(ParallelWorkOptions.of(ids)));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> orchestrator.processJobs(ParallelWorkOptions.of(ids)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already part of a running batch");
        release.countDown();
        assertThat(pending.get(5, TimeUnit.SECONDS).summary().successful()).isEqualTo(1);
    }

    @Test
    void refusesTheBatchWhenTheDailyCapIsReached() {
        List<UUID> ids = given(TestEntities.job(1, JobState.QUEUED));
        when(rateLimiter.canCreateAnyPR()).thenReturn(new RateLimitStatus(false,
                "Daily PR limit reached (10/10)", 10, Map.of(), 10, 3, null));

        assertThatThrownBy(() -> orchestrator((job, b) -> opened(job, 0.0)).submit(ParallelWorkOptions.of(ids)))
                .isInstanceOf(AdmissionDeniedException.class)
                .extracting(e -> ((AdmissionDeniedException) e).getGate())
                .isEqualTo(AdmissionDeniedException.Gate.RATE);
        verify(batchRepo, never()).save(any());
    }

    @Test
    void refusesTheBatchWhenTheBudgetIsSpent() {
        List<UUID> ids = given(TestEntities.job(1, JobState.QUEUED));
        when(rateLimiter.canCreateAnyPR()).thenReturn(new RateLimitStatus(true, null, 0, Map.of(), 10, 3, null));
        when(budget.canProceed()).thenReturn(new BudgetCheck(false, "Daily budget exhausted", 50, 50, 50, 500, 0, 450));

        assertThatThrownBy(() -> orchestrator((job, b) -> opened(job, 0.0)).processJobs(ParallelWorkOptions.of(ids)))
                .isInstanceOf(AdmissionDeniedException.class)
                .hasMessageContaining("Daily budget exhausted");
    }

    @Test
    void rejectsEmptyAndUnknownJobLists() {
        ParallelOrchestrator orchestrator = orchestrator((job, b) -> opened(job, 0.0));

        assertThatThrownBy(() -> orchestrator.processJobs(ParallelWorkOptions.of(List.of())))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> orchestrator.processJobs(ParallelWorkOptions.of(List.of(UUID.randomUUID()))))
                .isInstanceOf(JobNotFoundException.class);
        assertThat(orchestrator.status(UUID.randomUUID())).isEmpty();
    }
}
