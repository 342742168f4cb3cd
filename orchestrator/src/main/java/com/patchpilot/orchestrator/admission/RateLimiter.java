package com.patchpilot.orchestrator.admission;

import com.patchpilot.orchestrator.config.PatchPilotProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Daily PR-creation limits, global and per project.
 *
 * Advisory: checked once at admission, not held across the job. Concurrent
 * admissions can overshoot a limit by up to maxConcurrentAgents - 1.
 */
@Service
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    public record RemainingCapacity(long dailyRemaining, Long projectRemaining) {}

    private final UsageCounters                     counters;
    private final PatchPilotProperties.QualityGates gates;

    public RateLimiter(UsageCounters counters, PatchPilotProperties props) {
        this.counters = counters;
        this.gates    = props.qualityGates();
    }

    public RateLimitStatus canCreatePR(String projectId) {
        long daily = counters.prsCreated(UsagePeriod.DAY);
        Map<String, Long> byProject = counters.prsCreatedByProject(UsagePeriod.DAY);
        long projectCount = byProject.getOrDefault(projectId, 0L);

        if (daily >= gates.maxPrsPerDay()) {
            log.debug("Rate limit: daily limit reached ({}/{})", daily, gates.maxPrsPerDay());
            return denied("Daily PR limit reached (%d/%d)".formatted(daily, gates.maxPrsPerDay()),
                    daily, byProject);
        }
        if (projectCount >= gates.maxPrsPerProjectPerDay()) {
            log.debug("Rate limit: project limit reached for {} ({}/{})",
                    projectId, projectCount, gates.maxPrsPerProjectPerDay());
            return denied("Project PR limit reached for %s (%d/%d)"
                            .formatted(projectId, projectCount, gates.maxPrsPerProjectPerDay()),
                    daily, byProject);
        }
        return new RateLimitStatus(true, null, daily, byProject,
                gates.maxPrsPerDay(), gates.maxPrsPerProjectPerDay(), null);
    }

    /** Global gate only, for the runner's per-iteration check. */
    public RateLimitStatus canCreateAnyPR() {
        long daily = counters.prsCreated(UsagePeriod.DAY);
        Map<String, Long> byProject = counters.prsCreatedByProject(UsagePeriod.DAY);
        if (daily >= gates.maxPrsPerDay()) {
            return denied("Daily PR limit reached (%d/%d)".formatted(daily, gates.maxPrsPerDay()),
                    daily, byProject);
        }
        return new RateLimitStatus(true, null, daily, byProject,
                gates.maxPrsPerDay(), gates.maxPrsPerProjectPerDay(), null);
    }

    /** @param projectId may be null, in which case only the daily figure is computed */
    public RemainingCapacity getRemainingCapacity(String projectId) {
        long daily = counters.prsCreated(UsagePeriod.DAY);
        long dailyRemaining = Math.max(0, gates.maxPrsPerDay() - daily);
        Long projectRemaining = null;
        if (projectId != null) {
            long projectCount = counters.prsCreated(UsagePeriod.DAY, projectId);
            projectRemaining = Math.max(0, gates.maxPrsPerProjectPerDay() - projectCount);
        }
        return new RemainingCapacity(dailyRemaining, projectRemaining);
    }

    private RateLimitStatus denied(String reason, long daily, Map<String, Long> byProject) {
        return new RateLimitStatus(false, reason, daily, byProject,
                gates.maxPrsPerDay(), gates.maxPrsPerProjectPerDay(),
                counters.window(UsagePeriod.DAY).end());
    }
}
