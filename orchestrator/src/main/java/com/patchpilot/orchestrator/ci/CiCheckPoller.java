package com.patchpilot.orchestrator.ci;

import com.patchpilot.orchestrator.resilience.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Polls CI for a PR until a verdict.
 *
 * <ul>
 *   <li>{@code NO_CHECKS}: the commit has no check runs at all.</li>
 *   <li>{@code FAILURE}: as soon as any relevant check has failed, even if others are still running.</li>
 *   <li>{@code SUCCESS}: nothing relevant is pending; cancelled and skipped checks do not block.</li>
 *   <li>{@code TIMEOUT}: still pending when the timeout elapses; carries the last snapshot.</li>
 * </ul>
 *
 * A required check that has not been registered yet counts as pending.
 * A failed poll is logged and retried at the next interval.
 */
@Component
public class CiCheckPoller {

    private static final Logger log = LoggerFactory.getLogger(CiCheckPoller.class);

    private final CiStatusSource source;
    private final Clock          clock;
    private final Sleeper        sleeper;

    public CiCheckPoller(CiStatusSource source, Clock clock, Sleeper sleeper) {
        this.source  = source;
        this.clock   = clock;
        this.sleeper = sleeper;
    }

    public CiPollResult waitForChecks(ArtifactRef artifact, CiPollOptions options) throws InterruptedException {
        Instant start = clock.instant();
        int pollCount = 0;
        List<CheckRun> last = List.of();

        log.info("Waiting for CI checks on {}#{}", artifact.projectId(), artifact.number());
        if (options.initialDelay().toMillis() > 0) {
            log.info("Waiting {} ms for CI checks to register", options.initialDelay().toMillis());
            sleeper.sleep(options.initialDelay());
        }

        while (elapsedMs(start) < options.timeout().toMillis()) {
            pollCount++;
            List<CheckRun> checks;
            try {
                checks = source.getChecks(artifact);
            } catch (RuntimeException e) {
                log.warn("Error polling CI status for {}: {}", artifact.url(), e.getMessage());
                sleeper.sleep(options.pollInterval());
                continue;
            }

            if (checks.isEmpty()) {
                log.info("No CI checks configured for {}", artifact.projectId());
                return new CiPollResult(CiPollStatus.NO_CHECKS, List.of(), CheckCounts.of(List.of()),
                        elapsedMs(start), pollCount);
            }

            last = relevant(checks, options.requiredChecks());
            CheckCounts counts = CheckCounts.of(last);
            List<String> pendingNames = last.stream()
                    .filter(c -> c.status() == CheckStatus.PENDING)
                    .map(CheckRun::name)
                    .toList();
            options.onProgress().accept(new CiPollProgress(elapsedMs(start), pollCount, counts, pendingNames));
            log.debug("CI status: {}/{} completed, {} passed, {} failed, {} pending",
                    counts.completed(), counts.total(), counts.passed(), counts.failed(), counts.pending());

            if (counts.failed() > 0) {
                log.info("CI checks failed: {}", last.stream()
                        .filter(c -> c.status() == CheckStatus.FAILURE)
                        .map(CheckRun::name)
                        .collect(Collectors.joining(", ")));
                return new CiPollResult(CiPollStatus.FAILURE, last, counts, elapsedMs(start), pollCount);
            }
            if (counts.pending() == 0) {
                log.info("CI checks passed ({} passed, {} cancelled, {} skipped)",
                        counts.passed(), counts.cancelled(), counts.skipped());
                return new CiPollResult(CiPollStatus.SUCCESS, last, counts, elapsedMs(start), pollCount);
            }

            log.info("Waiting for {} check(s): {}", pendingNames.size(), String.join(", ", pendingNames));
            sleeper.sleep(options.pollInterval());
        }

        log.warn("CI check polling timed out after {} ms ({} polls)", options.timeout().toMillis(), pollCount);
        return new CiPollResult(CiPollStatus.TIMEOUT, last, CheckCounts.of(last), elapsedMs(start), pollCount);
    }

    /** Checks restricted to the required names, with placeholders for required ones not yet reported. */
    static List<CheckRun> relevant(List<CheckRun> checks, List<String> required) {
        if (required.isEmpty()) {
            return checks;
        }
        Map<String, CheckRun> byName = checks.stream()
                .collect(Collectors.toMap(CheckRun::name, Function.identity(), (a, b) -> b));
        List<CheckRun> relevant = new ArrayList<>();
        for (String name : required) {
            relevant.add(byName.getOrDefault(name, CheckRun.missing(name)));
        }
        return relevant;
    }

    private long elapsedMs(Instant start) {
        return Duration.between(start, clock.instant()).toMillis();
    }
}
