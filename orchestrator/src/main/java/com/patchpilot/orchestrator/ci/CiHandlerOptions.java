package com.patchpilot.orchestrator.ci;

import com.patchpilot.orchestrator.config.PatchPilotProperties;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Per-PR settings for {@link CiCheckHandler}. Start from {@link #from} and
 * override with the {@code with*} copies.
 */
public record CiHandlerOptions(
        int                         maxIterations,
        boolean                     waitForChecks,
        boolean                     autoFix,
        Duration                    timeout,
        Duration                    pollInterval,
        Duration                    initialDelay,
        Duration                    selfHealTimeout,
        Duration                    selfHealPollInterval,
        Duration                    selfHealInitialDelay,
        int                         maxTurnsPerFix,
        double                      maxBudgetPerFixUsd,
        Duration                    fixTimeout,
        String                      pushRemote,
        List<String>                requiredChecks,
        String                      resumeSessionId,
        Consumer<CiHandlerProgress> onProgress
) {

    public CiHandlerOptions {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        pushRemote     = pushRemote == null || pushRemote.isBlank() ? "origin" : pushRemote;
        requiredChecks = requiredChecks == null ? List.of() : List.copyOf(requiredChecks);
        onProgress     = onProgress == null ? p -> {} : onProgress;
    }

    public static CiHandlerOptions from(PatchPilotProperties props) {
        PatchPilotProperties.Ci ci = props.ci();
        return new CiHandlerOptions(
                ci.maxFixIterations(),
                true,
                ci.autoFix(),
                Duration.ofMillis(ci.timeoutMs()),
                Duration.ofMillis(ci.pollIntervalMs()),
                Duration.ofMillis(ci.initialDelayMs()),
                Duration.ofMillis(ci.selfHealTimeoutMs()),
                Duration.ofMillis(ci.selfHealPollIntervalMs()),
                Duration.ofMillis(ci.selfHealInitialDelayMs()),
                ci.maxTurnsPerFix(),
                ci.maxBudgetPerFixUsd(),
                Duration.ofMillis(props.watchdog().aiTimeoutMs()),
                ci.pushRemote(),
                ci.requiredChecks(),
                null,
                null);
    }

    public CiHandlerOptions withResumeSessionId(String sessionId) {
        return new CiHandlerOptions(maxIterations, waitForChecks, autoFix, timeout, pollInterval, initialDelay,
                selfHealTimeout, selfHealPollInterval, selfHealInitialDelay, maxTurnsPerFix, maxBudgetPerFixUsd,
                fixTimeout, pushRemote, requiredChecks, sessionId, onProgress);
    }

    public CiHandlerOptions withOnProgress(Consumer<CiHandlerProgress> listener) {
        return new CiHandlerOptions(maxIterations, waitForChecks, autoFix, timeout, pollInterval, initialDelay,
                selfHealTimeout, selfHealPollInterval, selfHealInitialDelay, maxTurnsPerFix, maxBudgetPerFixUsd,
                fixTimeout, pushRemote, requiredChecks, resumeSessionId, listener);
    }

    CiPollOptions pollOptions(Consumer<CiPollProgress> listener) {
        return new CiPollOptions(timeout, pollInterval, initialDelay, requiredChecks, listener);
    }

    CiPollOptions selfHealPollOptions() {
        return new CiPollOptions(selfHealTimeout, selfHealPollInterval, selfHealInitialDelay, requiredChecks, null);
    }
}
