package com.patchpilot.orchestrator.resilience;

import java.time.Instant;
import java.util.Map;

/** What the watchdog knew about the supervised call when it fired or heartbeated. */
public record WatchdogContext(
        String              operation,
        Instant             startedAt,
        Instant             lastHeartbeat,
        Map<String, Object> metadata
) {}
