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
import com.patchpilot.orchestrator.support.TestEntities;
import com.patchpilot.orchestrator.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QueueManagerTest {

    @Mock JobRepository    jobRepo;
    @Mock JobStateMachine  stateMachine;
    @Mock RateLimiter      rateLimiter;
    @Mock ConflictDetector conflictDetector;
    @Mock CandidateSource  github;
    @Mock CandidateSource  backup;

    QueueManager queue;

    static final RateLimitStatus ALLOWED = new RateLimitStatus(true, null, 0, Map.of(), 10, 3, null);
    static final RateLimitStatus DENIED  = new RateLimitStatus(false, "Project PR limit reached", 3,
            Map.of("acme/web", 3L), 10, 3, Instant.parse("2026-03-02T00:00:00Z"));

    @BeforeEach
    void setUp() {
        queue = new QueueManager(jobRepo, stateMachine, rateLimiter, conflictDetector, List.of(github, backup),
                TestProperties.with(new PatchPilotProperties.Queue(5, 20)));
    }

    private static CandidateIssue candidate(int n) {
        return new CandidateIssue("https://github.com/acme/api/issues/" + n, "acme/api", "Issue " + n, "", List.of());
    }

    private void savesAssignIds() {
        when(jobRepo.save(any(Job.class))).thenAnswer(inv -> TestEntities.withId(inv.getArgument(0)));
        when(stateMachine.transition(any(), eq(JobState.QUEUED), anyString()))
                .thenAnswer(inv -> TestEntities.job(1, JobState.QUEUED));
    }

    // ------------------------------------------------------------------
    // Status
    // ------------------------------------------------------------------

    @Test
    void needsReplenishmentBelowMinimum() {
        when(jobRepo.countByState(JobState.QUEUED)).thenReturn(4L);

        QueueStatus status = queue.getQueueStatus();

        assertThat(status.needsReplenishment()).isTrue();
        assertThat(status.size()).isEqualTo(4);
        assertThat(queue.needsReplenishment()).isTrue();
    }

    // ------------------------------------------------------------------
    // Ingestion
    // ------------------------------------------------------------------

    @Test
    void enqueue_knownUrlIsNeverIngestedAgain() {
        when(jobRepo.existsByUrl(candidate(1).url())).thenReturn(true);

        Optional<Job> result = queue.enqueue(candidate(1));

        assertThat(result).isEmpty();
        verify(jobRepo, never()).save(any());
        verifyNoInteractions(stateMachine);
    }

    @Test
    void enqueue_newUrlIsStoredThenQueued() {
        savesAssignIds();

        assertThat(queue.enqueue(candidate(2))).isPresent();
        verify(stateMachine).transition(any(), eq(JobState.QUEUED), eq("Added to queue"));
    }

    @Test
    void replenish_fillsUpToTargetSkippingDuplicates() throws Exception {
        savesAssignIds();
        when(jobRepo.countByState(JobState.QUEUED)).thenReturn(18L);
        when(github.name()).thenReturn("github");
        when(github.findCandidates(2)).thenReturn(List.of(candidate(1), candidate(2), candidate(3), candidate(4)));
        String known = candidate(1).url();
        when(jobRepo.existsByUrl(anyString())).thenAnswer(inv -> known.equals(inv.getArgument(0)));

        ReplenishmentResult result = queue.replenish();

        assertThat(result.added()).isEqualTo(2);
        assertThat(result.sources()).containsExactly(new ReplenishmentResult.SourceCount("github", 2));
        verify(jobRepo, never()).existsByUrl(candidate(4).url());
        verifyNoInteractions(backup);
    }

    @Test
    void replenish_failingSourceIsRecordedAndTheNextOneIsUsed() throws Exception {
        savesAssignIds();
        when(jobRepo.countByState(JobState.QUEUED)).thenReturn(19L);
        when(github.name()).thenReturn("github");
        when(github.findCandidates(1)).thenThrow(new IllegalStateException("GitHub down"));
        when(backup.name()).thenReturn("backup");
        when(backup.findCandidates(1)).thenReturn(List.of(candidate(9)));

        ReplenishmentResult result = queue.replenish();

        assertThat(result.added()).isEqualTo(1);
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0)).contains("github", "GitHub down");
        assertThat(result.sources()).extracting(ReplenishmentResult.SourceCount::source).containsExactly("backup");
    }

    @Test
    void replenish_atTargetDoesNothing() throws Exception {
        when(jobRepo.countByState(JobState.QUEUED)).thenReturn(20L);

        assertThat(queue.replenish()).isEqualTo(ReplenishmentResult.nothing());
        verifyNoInteractions(github, backup);
    }

    // ------------------------------------------------------------------
    // Selection
    // ------------------------------------------------------------------

    @Test
    void getNextIssue_skipsRateLimitedAndConflictingJobs() {
        Job limited     = TestEntities.job("https://github.com/acme/web/issues/1", "acme/web", "t", "", JobState.QUEUED);
        Job conflicting = TestEntities.job(2, JobState.QUEUED);
        Job eligible    = TestEntities.job(3, JobState.QUEUED);
        when(jobRepo.findByStateOrderByQueuedAtAsc(JobState.QUEUED)).thenReturn(List.of(limited, conflicting, eligible));
        when(rateLimiter.canCreatePR("acme/web")).thenReturn(DENIED);
        when(rateLimiter.canCreatePR("acme/api")).thenReturn(ALLOWED);
        when(conflictDetector.checkAgainstInProgress(IssueText.of(conflicting)))
                .thenReturn(new ConflictCheck(false, List.of("https://github.com/acme/api/issues/99"), List.of("src/a.ts")));
        when(conflictDetector.checkAgainstInProgress(IssueText.of(eligible))).thenReturn(ConflictCheck.clear());

        assertThat(queue.getNextIssue()).isSameAs(eligible);
    }

    @Test
    void getNextIssue_nullWhenNothingQualifies() {
        Job limited = TestEntities.job("https://github.com/acme/web/issues/1", "acme/web", "t", "", JobState.QUEUED);
        when(jobRepo.findByStateOrderByQueuedAtAsc(JobState.QUEUED)).thenReturn(List.of(limited));
        when(rateLimiter.canCreatePR("acme/web")).thenReturn(DENIED);

        assertThat(queue.getNextIssue()).isNull();
    }

    // ------------------------------------------------------------------
    // Operator actions
    // ------------------------------------------------------------------

    @Test
    void prioritize_movesAheadOfTheOldestEntry() {
        Job oldest = TestEntities.job(1, JobState.QUEUED);
        oldest.setQueuedAt(Instant.parse("2026-03-01T08:00:00Z"));
        Job target = TestEntities.job(2, JobState.QUEUED);
        target.setQueuedAt(Instant.parse("2026-03-01T09:00:00Z"));
        when(jobRepo.findByUrl(target.getUrl())).thenReturn(Optional.of(target));
        when(jobRepo.findByStateOrderByQueuedAtAsc(JobState.QUEUED)).thenReturn(List.of(oldest, target));

        assertThat(queue.prioritize(target.getUrl())).isTrue();
        assertThat(target.getQueuedAt()).isBefore(oldest.getQueuedAt());
        verify(jobRepo).save(target);
    }

    @Test
    void removeFromQueue_onlyForQueuedJobs() {
        Job running = TestEntities.job(5, JobState.IN_PROGRESS);
        when(jobRepo.findByUrl(running.getUrl())).thenReturn(Optional.of(running));

        assertThat(queue.removeFromQueue(running.getUrl())).isFalse();
        verifyNoInteractions(stateMachine);
    }

    @Test
    void clearQueue_abandonsEverything() {
        Job a = TestEntities.job(1, JobState.QUEUED);
        Job b = TestEntities.job(2, JobState.QUEUED);
        when(jobRepo.findByStateOrderByQueuedAtAsc(JobState.QUEUED)).thenReturn(List.of(a, b));

        assertThat(queue.clearQueue("maintenance")).isEqualTo(2);
        verify(stateMachine).transition(a.getId(), JobState.ABANDONED, "maintenance");
        verify(stateMachine).transition(b.getId(), JobState.ABANDONED, "maintenance");
    }
}
