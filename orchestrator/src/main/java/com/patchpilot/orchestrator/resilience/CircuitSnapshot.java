package com.patchpilot.orchestrator.resilience;

import java.time.Instant;

/** Point-in-time view of one breaker, safe to hand to callers and the API. */
public record CircuitSnapshot(
        String       operation,
        CircuitState state,
        int          consecutiveFailures,
        int          consecutiveSuccesses,
        Instant      reopenAt
) {}
