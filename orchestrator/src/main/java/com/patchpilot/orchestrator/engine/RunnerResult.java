package com.patchpilot.orchestrator.engine;

import java.util.List;

public record RunnerResult(
        int                iterations,
        long               durationMs,
        List<ProcessedJob> processed,
        double             totalCostUsd,
        StopReason         stopReason
) {}
