package com.patchpilot.orchestrator.ci;

import com.patchpilot.orchestrator.ai.AiInvoker;
import com.patchpilot.orchestrator.ai.AiQuery;
import com.patchpilot.orchestrator.ai.AiResult;
import com.patchpilot.orchestrator.support.MutableClock;
import com.patchpilot.orchestrator.support.TestProperties;
import com.patchpilot.orchestrator.workspace.InProcessRepoLocks;
import com.patchpilot.orchestrator.workspace.WorkspaceException;
import com.patchpilot.orchestrator.workspace.WorkspaceOperations;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CiCheckHandlerTest {

    static final ArtifactRef PR     = ArtifactRef.parse("https://github.com/acme/api/pull/12");
    static final Path        REPO   = Path.of("/tmp/patchpilot/acme/api");
    static final String      BRANCH = "patchpilot/issue-7";

    @Mock CiCheckPoller       poller;
    @Mock CiStatusSource      ciSource;
    @Mock AiInvoker           ai;
    @Mock WorkspaceOperations git;

    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    InProcessRepoLocks  locks         = new InProcessRepoLocks();
    CiCheckHandler      handler;

    @BeforeEach
    void setUp() {
        handler = new CiCheckHandler(poller, ciSource, ai, git, locks,
                MutableClock.at("2026-03-01T10:00:00Z"), meterRegistry);
    }

    static CheckRun check(String name, CheckStatus status) {
        return new CheckRun(name + "-id", name, status, status == CheckStatus.FAILURE ? "failure" : null,
                null, null);
    }

    static CiPollResult poll(CiPollStatus status, CheckRun... checks) {
        List<CheckRun> list = List.of(checks);
        long failed = list.stream().filter(c -> c.status() == CheckStatus.FAILURE).count();
        long passed = list.stream().filter(c -> c.status() == CheckStatus.SUCCESS).count();
        return new CiPollResult(status, list, new CheckCounts(0, (int) passed, (int) failed, 0, 0), 1_000, 1);
    }

    static CiPollResult failing() {
        return poll(CiPollStatus.FAILURE, check("build", CheckStatus.FAILURE), check("lint", CheckStatus.SUCCESS));
    }

    static CiPollResult passing() {
        return poll(CiPollStatus.SUCCESS, check("build", CheckStatus.SUCCESS), check("lint", CheckStatus.SUCCESS));
    }

    static AiResult fixed(String sessionId) {
        return new AiResult(true, "Summary: added the missing null check", 0.5, 4, sessionId, null);
    }

    static CiHandlerOptions options(boolean autoFix, int maxIterations) {
        return new CiHandlerOptions(maxIterations, true, autoFix, Duration.ofMinutes(30), Duration.ofSeconds(30),
                Duration.ofSeconds(30), Duration.ofMinutes(5), Duration.ofSeconds(15), Duration.ofMinutes(1),
                20, 2.0, Duration.ofMinutes(10), "origin", List.of(), null, null);
    }

    @Test
    void fixesTwiceThenPasses() throws Exception {
        when(poller.waitForChecks(eq(PR), any())).thenReturn(failing(), failing(), passing());
        when(ai.query(anyString(), any())).thenReturn(fixed("ai-1"), fixed("ai-1"));
        when(git.hasUncommittedChanges(REPO)).thenReturn(true);
        when(git.headSha(REPO)).thenReturn("abc123", "def456");

        CiHandlerResult result = handler.handleChecks(PR, REPO, BRANCH, options(true, 3));

        assertThat(result.finalStatus()).isEqualTo(CiFinalStatus.SUCCESS);
        assertThat(result.iterations()).hasSize(3);
        assertThat(result.fixesApplied()).isEqualTo(2);
        assertThat(result.iterations()).extracting(CiIteration::fixCommit).containsExactly("abc123", "def456", null);
        assertThat(result.iterations().get(0).fixSummary()).isEqualTo("added the missing null check");
        assertThat(result.totalFixCostUsd()).isEqualTo(1.0);
        assertThat(result.aiSessionId()).isEqualTo("ai-1");
        verify(git, times(2)).push(REPO, BRANCH, "origin", false);
        assertThat(meterRegistry.counter("patchpilot.ci.iterations", "outcome", "fixed").count()).isEqualTo(2.0);
    }

    @Test
    void stopsAtMaxIterationsWhenEveryRoundStillFails() throws Exception {
        when(poller.waitForChecks(eq(PR), any())).thenReturn(failing());
        when(ai.query(anyString(), any())).thenReturn(fixed("ai-1"));
        when(git.hasUncommittedChanges(REPO)).thenReturn(true);
        when(git.headSha(REPO)).thenReturn("abc123");

        CiHandlerResult result = handler.handleChecks(PR, REPO, BRANCH, options(true, 3));

        assertThat(result.finalStatus()).isEqualTo(CiFinalStatus.MAX_ITERATIONS);
        assertThat(result.iterations()).hasSize(3);
        assertThat(result.iterations()).allMatch(CiIteration::fixApplied);
        assertThat(result.finalChecks()).extracting(CheckRun::name).containsExactly("build", "lint");
        verify(ai, times(3)).query(anyString(), any());
    }

    @Test
    void reportsFailureWithoutCallingTheAiWhenAutoFixIsOff() throws Exception {
        when(poller.waitForChecks(eq(PR), any())).thenReturn(failing());

        CiHandlerResult result = handler.handleChecks(PR, REPO, BRANCH, options(false, 3));

        assertThat(result.finalStatus()).isEqualTo(CiFinalStatus.FAILURE);
        assertThat(result.summary()).contains("build").contains("Auto-fix is disabled");
        assertThat(result.iterations()).hasSize(1);
        verifyNoInteractions(ai, git);
    }

    @Test
    void emptyRepairStillSucceedsWhenChecksRecoverOnTheirOwn() throws Exception {
        when(poller.waitForChecks(eq(PR), any())).thenReturn(failing(), passing());
        when(ai.query(anyString(), any())).thenReturn(fixed("ai-1"));
        when(git.hasUncommittedChanges(REPO)).thenReturn(false);

        CiHandlerResult result = handler.handleChecks(PR, REPO, BRANCH, options(true, 3));

        assertThat(result.finalStatus()).isEqualTo(CiFinalStatus.SUCCESS);
        assertThat(result.summary()).contains("after recheck");
        assertThat(result.fixesApplied()).isZero();
        verify(git, never()).commitAll(any(), anyString());
        verify(git, never()).push(any(), anyString(), anyString(), anyBoolean());
    }

    @Test
    void failedAiRunEndsInFailureWhenTheRecheckStillFails() throws Exception {
        when(poller.waitForChecks(eq(PR), any())).thenReturn(failing(), failing());
        when(ai.query(anyString(), any())).thenReturn(
                new AiResult(false, "", 0.25, 2, "ai-9", "context window exhausted"));

        CiHandlerResult result = handler.handleChecks(PR, REPO, BRANCH, options(true, 3));

        assertThat(result.finalStatus()).isEqualTo(CiFinalStatus.FAILURE);
        assertThat(result.summary()).contains("context window exhausted");
        assertThat(result.totalFixCostUsd()).isEqualTo(0.25);
        assertThat(result.aiSessionId()).isEqualTo("ai-9");
        verify(poller, times(2)).waitForChecks(eq(PR), any());
        verify(git).switchBranch(REPO, BRANCH);
        verifyNoMoreInteractions(git);
    }

    @Test
    void repairRunsOnThePullRequestBranchWhileHoldingTheRepositoryLock() throws Exception {
        when(poller.waitForChecks(eq(PR), any())).thenReturn(failing(), passing());
        when(ai.query(anyString(), any())).thenAnswer(inv -> {
            assertThat(locks.isLocked(REPO)).isTrue();
            return fixed("ai-1");
        });
        when(git.hasUncommittedChanges(REPO)).thenReturn(true);
        when(git.headSha(REPO)).thenReturn("abc123");

        handler.handleChecks(PR, REPO, BRANCH, options(true, 3));

        InOrder order = inOrder(git, ai);
        order.verify(git).switchBranch(REPO, BRANCH);
        order.verify(ai).query(anyString(), any());
        order.verify(git).commitAll(eq(REPO), anyString());
        order.verify(git).push(REPO, BRANCH, "origin", false);
        assertThat(locks.isLocked(REPO)).isFalse();
    }

    @Test
    void pushFailureStillReportsTheAiCostAndSession() throws Exception {
        when(poller.waitForChecks(eq(PR), any())).thenReturn(failing(), failing());
        when(ai.query(anyString(), any())).thenReturn(fixed("ai-1"));
        when(git.hasUncommittedChanges(REPO)).thenReturn(true);
        doThrow(new WorkspaceException("remote rejected"))
                .when(git).push(any(), anyString(), anyString(), anyBoolean());

        CiHandlerResult result = handler.handleChecks(PR, REPO, BRANCH, options(true, 3));

        assertThat(result.finalStatus()).isEqualTo(CiFinalStatus.FAILURE);
        assertThat(result.summary()).contains("remote rejected");
        assertThat(result.totalFixCostUsd()).isEqualTo(0.5);
        assertThat(result.aiSessionId()).isEqualTo("ai-1");
        assertThat(result.fixesApplied()).isZero();
        verify(git, never()).headSha(any());
    }

    @Test
    void retriesPushWithoutVerificationWhenHooksReject() throws Exception {
        when(poller.waitForChecks(eq(PR), any())).thenReturn(failing(), passing());
        when(ai.query(anyString(), any())).thenReturn(fixed("ai-1"));
        when(git.hasUncommittedChanges(REPO)).thenReturn(true);
        when(git.headSha(REPO)).thenReturn("abc123");
        doThrow(new WorkspaceException("pre-push hook failed"))
                .doNothing()
                .when(git).push(any(), anyString(), anyString(), anyBoolean());

        CiHandlerResult result = handler.handleChecks(PR, REPO, BRANCH, options(true, 3));

        assertThat(result.finalStatus()).isEqualTo(CiFinalStatus.SUCCESS);
        assertThat(result.fixesApplied()).isEqualTo(1);
        verify(git).push(REPO, BRANCH, "origin", false);
        verify(git).push(REPO, BRANCH, "origin", true);
    }

    @Test
    void skipsEverythingWhenWaitingIsDisabled() throws Exception {
        CiHandlerOptions base = CiHandlerOptions.from(TestProperties.defaults());
        CiHandlerOptions noWait = new CiHandlerOptions(base.maxIterations(), false, base.autoFix(), base.timeout(),
                base.pollInterval(), base.initialDelay(), base.selfHealTimeout(), base.selfHealPollInterval(),
                base.selfHealInitialDelay(), base.maxTurnsPerFix(), base.maxBudgetPerFixUsd(), base.fixTimeout(),
                base.pushRemote(), base.requiredChecks(), null, null);

        CiHandlerResult result = handler.handleChecks(PR, REPO, BRANCH, noWait);

        assertThat(result.finalStatus()).isEqualTo(CiFinalStatus.SKIPPED);
        verifyNoInteractions(poller, ai, git);
    }

    @Test
    void noChecksConfigured() throws Exception {
        when(poller.waitForChecks(eq(PR), any())).thenReturn(poll(CiPollStatus.NO_CHECKS));

        CiHandlerResult result = handler.handleChecks(PR, REPO, BRANCH, options(true, 3));

        assertThat(result.finalStatus()).isEqualTo(CiFinalStatus.NO_CHECKS);
        assertThat(result.iterations()).isEmpty();
    }

    @Test
    void resumesTheGivenAiSessionAndReportsTheNewOne() throws Exception {
        when(poller.waitForChecks(eq(PR), any())).thenReturn(failing(), passing());
        when(ai.query(anyString(), any())).thenReturn(fixed("ai-2"));
        when(git.hasUncommittedChanges(REPO)).thenReturn(true);
        when(git.headSha(REPO)).thenReturn("abc123");
        List<CiHandlerProgress> progress = new ArrayList<>();

        CiHandlerResult result = handler.handleChecks(PR, REPO, BRANCH,
                options(true, 3).withResumeSessionId("ai-1").withOnProgress(progress::add));

        ArgumentCaptor<AiQuery> query = ArgumentCaptor.forClass(AiQuery.class);
        verify(ai).query(anyString(), query.capture());
        assertThat(query.getValue().resumeSessionId()).isEqualTo("ai-1");
        assertThat(query.getValue().cwd()).isEqualTo(REPO);
        assertThat(query.getValue().maxBudgetUsd()).isEqualTo(2.0);
        assertThat(result.aiSessionId()).isEqualTo("ai-2");
        assertThat(progress).extracting(CiHandlerProgress::phase)
                .contains(CiHandlerProgress.Phase.ANALYZING, CiHandlerProgress.Phase.FIXING,
                        CiHandlerProgress.Phase.PUSHING, CiHandlerProgress.Phase.COMPLETE);
    }

    @Test
    void fixPromptCarriesFailureDetailsAndParsedErrors() throws Exception {
        CheckRun build = new CheckRun("1", "build", CheckStatus.FAILURE, "failure", null, "2 tests failed");
        when(ciSource.getCheckLog(PR, build)).thenReturn(Optional.of("""
                > jest
                FAIL src/auth.test.ts
                Error: expected 200 but got 401
                """));

        String prompt = CiCheckHandler.buildFixPrompt(handler.collectFailureLogs(PR, List.of(build)));

        assertThat(prompt)
                .contains("### build")
                .contains("**Status:** failure (failure)")
                .contains("**Summary:**\n2 tests failed")
                .contains("**Errors Found:**")
                .contains("Error: expected 200 but got 401")
                .contains("**Log Output:**")
                .contains("Do not make unrelated improvements");
    }

    @Test
    void missingLogStillProducesAPromptSection() throws Exception {
        CheckRun lint = new CheckRun("2", "lint", CheckStatus.FAILURE, null, null, null);
        when(ciSource.getCheckLog(PR, lint)).thenThrow(new IllegalStateException("logs expired"));

        String prompt = CiCheckHandler.buildFixPrompt(handler.collectFailureLogs(PR, List.of(lint)));

        assertThat(prompt).contains("### lint").contains("(no conclusion)").doesNotContain("**Log Output:**");
    }
}
