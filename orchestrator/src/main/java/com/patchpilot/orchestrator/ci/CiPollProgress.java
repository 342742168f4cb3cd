package com.patchpilot.orchestrator.ci;

import java.util.List;

public record CiPollProgress(long elapsedMs, int pollCount, CheckCounts counts, List<String> pendingCheckNames) {}
