package com.patchpilot.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * Every tunable the engine reads, bound from the {@code patchpilot.*} tree
 * in application.yml.
 *
 * Durations are plain millisecond longs so the yml stays readable and the
 * names match the operator-facing documentation.
 */
@ConfigurationProperties(prefix = "patchpilot")
public record PatchPilotProperties(
        Parallel     parallel,
        QualityGates qualityGates,
        Budget       budget,
        Ci           ci,
        Breaker      circuitBreaker,
        Retry        retry,
        Watchdog     watchdog,
        Queue        queue,
        Runner       runner,
        Ai           ai,
        Workspace    workspace,
        GitHub       github,
        Usage        usage
) {

    public record Parallel(int maxConcurrentAgents, boolean enableConflictDetection) {}

    public record QualityGates(int maxPrsPerDay, int maxPrsPerProjectPerDay) {}

    public record Budget(double dailyLimitUsd, double monthlyLimitUsd, double perJobLimitUsd) {}

    public record Ci(
            long         timeoutMs,
            long         pollIntervalMs,
            long         initialDelayMs,
            int          maxFixIterations,
            boolean      autoFix,
            int          maxTurnsPerFix,
            double       maxBudgetPerFixUsd,
            long         selfHealTimeoutMs,
            long         selfHealPollIntervalMs,
            long         selfHealInitialDelayMs,
            String       pushRemote,
            List<String> requiredChecks
    ) {
        public List<String> requiredChecks() {
            return requiredChecks == null ? List.of() : requiredChecks;
        }
    }

    public record Breaker(int failureThreshold, int successThreshold, long openDurationMs) {}

    public record Retry(int maxRetries, long baseDelayMs, long maxDelayMs, boolean jitter) {}

    public record Watchdog(long aiTimeoutMs, long ciTimeoutMs) {}

    public record Queue(int minQueueSize, int targetQueueSize) {}

    public record Runner(long cooldownMs, long pauseIdleMs, long noCandidateBackoffMs, long sessionStallMs) {
        public Duration cooldown()           { return Duration.ofMillis(cooldownMs); }
        public Duration pauseIdle()          { return Duration.ofMillis(pauseIdleMs); }
        public Duration noCandidateBackoff() { return Duration.ofMillis(noCandidateBackoffMs); }
    }

    public record Ai(String cliPath, String model, int maxTurns) {}

    public record Workspace(String root) {}

    public record GitHub(String apiBaseUrl, String token, List<String> repositories, List<String> labels) {
        public List<String> repositories() { return repositories == null ? List.of() : repositories; }
        public List<String> labels()       { return labels == null ? List.of() : labels; }
    }

    public record Usage(String zone) {
        public ZoneId zoneId() {
            return zone == null || zone.isBlank() ? ZoneId.of("UTC") : ZoneId.of(zone);
        }
    }
}
