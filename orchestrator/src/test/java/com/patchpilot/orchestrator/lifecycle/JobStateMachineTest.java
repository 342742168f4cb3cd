package com.patchpilot.orchestrator.lifecycle;

import com.patchpilot.orchestrator.model.Job;
import com.patchpilot.orchestrator.model.JobState;
import com.patchpilot.orchestrator.model.JobTransition;
import com.patchpilot.orchestrator.repository.JobRepository;
import com.patchpilot.orchestrator.repository.JobTransitionRepository;
import com.patchpilot.orchestrator.support.MutableClock;
import com.patchpilot.orchestrator.support.TestEntities;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static com.patchpilot.orchestrator.model.JobState.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobStateMachineTest {

    @Mock JobRepository           jobRepo;
    @Mock JobTransitionRepository transitionRepo;

    MutableClock    clock = MutableClock.at("2026-03-01T10:00:00Z");
    JobStateMachine machine;

    @BeforeEach
    void setUp() {
        machine = new JobStateMachine(jobRepo, transitionRepo, clock);
    }

    private Job stored(JobState state) {
        Job job = TestEntities.job(7, state);
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));
        return job;
    }

    // ------------------------------------------------------------------
    // Edge table
    // ------------------------------------------------------------------

    @Test
    void happyPathEdgesAreAllowed() {
        assertThat(JobStateMachine.canTransition(DISCOVERED, QUEUED)).isTrue();
        assertThat(JobStateMachine.canTransition(QUEUED, IN_PROGRESS)).isTrue();
        assertThat(JobStateMachine.canTransition(IN_PROGRESS, PR_CREATED)).isTrue();
        assertThat(JobStateMachine.canTransition(PR_CREATED, AWAITING_FEEDBACK)).isTrue();
        assertThat(JobStateMachine.canTransition(AWAITING_FEEDBACK, ITERATING)).isTrue();
        assertThat(JobStateMachine.canTransition(ITERATING, AWAITING_FEEDBACK)).isTrue();
        assertThat(JobStateMachine.canTransition(AWAITING_FEEDBACK, MERGED)).isTrue();
    }

    @Test
    void abandonIsOnlyPossibleBeforeAPullRequestExists() {
        assertThat(JobStateMachine.canTransition(IN_PROGRESS, ABANDONED)).isTrue();
        assertThat(JobStateMachine.canTransition(PR_CREATED, ABANDONED)).isFalse();
        assertThat(JobStateMachine.canTransition(AWAITING_FEEDBACK, ABANDONED)).isFalse();
        assertThat(JobStateMachine.canTransition(ITERATING, ABANDONED)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = JobState.class, names = {"MERGED", "CLOSED", "ABANDONED"})
    void terminalStatesHaveNoOutgoingEdges(JobState terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        assertThat(JobStateMachine.allowedTargets(terminal)).isEmpty();
    }

    // ------------------------------------------------------------------
    // transition()
    // ------------------------------------------------------------------

    @Test
    void transition_updatesJobAndAppendsAudit() {
        Job job = stored(IN_PROGRESS);
        UUID sessionId = UUID.randomUUID();
        when(jobRepo.save(job)).thenReturn(job);

        Job result = machine.transition(job.getId(), PR_CREATED, "PR opened", sessionId);

        assertThat(result.getState()).isEqualTo(PR_CREATED);
        ArgumentCaptor<JobTransition> audit = ArgumentCaptor.forClass(JobTransition.class);
        verify(transitionRepo).save(audit.capture());
        assertThat(audit.getValue().getFromState()).isEqualTo(IN_PROGRESS);
        assertThat(audit.getValue().getToState()).isEqualTo(PR_CREATED);
        assertThat(audit.getValue().getSessionId()).isEqualTo(sessionId);
        assertThat(audit.getValue().getCreatedAt()).isEqualTo(Instant.parse("2026-03-01T10:00:00Z"));
    }

    @Test
    void transition_toQueuedStampsQueuedAt() {
        Job job = stored(DISCOVERED);
        when(jobRepo.save(job)).thenReturn(job);

        machine.transition(job.getId(), QUEUED, "Added to queue");

        assertThat(job.getQueuedAt()).isEqualTo(clock.instant());
    }

    @Test
    void transition_toAbandonedKeepsTheReason() {
        Job job = stored(QUEUED);
        when(jobRepo.save(job)).thenReturn(job);

        machine.transition(job.getId(), ABANDONED, "Removed from queue");

        assertThat(job.getLastReason()).isEqualTo("Removed from queue");
    }

    @Test
    void transition_fromTerminalStateIsRejectedAndNothingIsWritten() {
        Job job = stored(MERGED);

        assertThatThrownBy(() -> machine.transition(job.getId(), AWAITING_FEEDBACK, "reopen"))
                .isInstanceOf(InvalidTransitionException.class)
                .satisfies(e -> {
                    InvalidTransitionException ite = (InvalidTransitionException) e;
                    assertThat(ite.getFrom()).isEqualTo(MERGED);
                    assertThat(ite.getTo()).isEqualTo(AWAITING_FEEDBACK);
                });
        assertThat(job.getState()).isEqualTo(MERGED);
        verify(jobRepo, never()).save(any());
        verifyNoInteractions(transitionRepo);
    }

    @Test
    void transition_afterPrCreatedCannotAbandon() {
        Job job = stored(PR_CREATED);

        assertThatThrownBy(() -> machine.transition(job.getId(), ABANDONED, "give up"))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void transition_unknownJob() {
        UUID id = UUID.randomUUID();
        when(jobRepo.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> machine.transition(id, QUEUED, null))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void history_unknownJob() {
        UUID id = UUID.randomUUID();
        when(jobRepo.existsById(id)).thenReturn(false);

        assertThatThrownBy(() -> machine.history(id)).isInstanceOf(JobNotFoundException.class);
    }
}
