package com.patchpilot.orchestrator.queue;

import java.util.List;

public record ReplenishmentResult(int added, List<SourceCount> sources, List<String> errors) {

    public record SourceCount(String source, int count) {}

    public static ReplenishmentResult nothing() {
        return new ReplenishmentResult(0, List.of(), List.of());
    }
}
