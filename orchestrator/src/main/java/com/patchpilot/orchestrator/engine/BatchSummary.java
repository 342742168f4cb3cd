package com.patchpilot.orchestrator.engine;

public record BatchSummary(
        int    total,
        int    successful,
        int    failed,
        int    cancelled,
        double totalCostUsd,
        long   totalDurationMs
) {}
