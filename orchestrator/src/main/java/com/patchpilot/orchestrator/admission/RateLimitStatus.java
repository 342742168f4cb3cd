package com.patchpilot.orchestrator.admission;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of a PR-creation rate check, with the counts and limits it was
 * decided on. {@code reason} and {@code nextAvailableAt} are null when allowed.
 */
public record RateLimitStatus(
        boolean           allowed,
        String            reason,
        long              dailyPrs,
        Map<String, Long> projectPrs,
        int               maxPrsPerDay,
        int               maxPrsPerProjectPerDay,
        Instant           nextAvailableAt
) {}
