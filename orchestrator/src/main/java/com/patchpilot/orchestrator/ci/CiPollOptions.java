package com.patchpilot.orchestrator.ci;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * @param requiredChecks names to wait for; empty means every check on the commit
 * @param onProgress     called after every successful poll
 */
public record CiPollOptions(
        Duration                  timeout,
        Duration                  pollInterval,
        Duration                  initialDelay,
        List<String>              requiredChecks,
        Consumer<CiPollProgress>  onProgress
) {

    public CiPollOptions {
        requiredChecks = requiredChecks == null ? List.of() : List.copyOf(requiredChecks);
        onProgress     = onProgress == null ? p -> {} : onProgress;
    }
}
