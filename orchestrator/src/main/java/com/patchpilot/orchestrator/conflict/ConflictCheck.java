package com.patchpilot.orchestrator.conflict;

import java.util.List;

/** A candidate checked against in-progress work; {@code safe} when nothing overlaps. */
public record ConflictCheck(boolean safe, List<String> conflicts, List<String> conflictingFiles) {

    public static ConflictCheck clear() {
        return new ConflictCheck(true, List.of(), List.of());
    }
}
