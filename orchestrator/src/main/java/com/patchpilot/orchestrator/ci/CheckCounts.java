package com.patchpilot.orchestrator.ci;

import java.util.List;

public record CheckCounts(int pending, int passed, int failed, int cancelled, int skipped) {

    public static CheckCounts of(List<CheckRun> checks) {
        int pending = 0, passed = 0, failed = 0, cancelled = 0, skipped = 0;
        for (CheckRun c : checks) {
            switch (c.status()) {
                case PENDING   -> pending++;
                case SUCCESS   -> passed++;
                case FAILURE   -> failed++;
                case CANCELLED -> cancelled++;
                case SKIPPED   -> skipped++;
            }
        }
        return new CheckCounts(pending, passed, failed, cancelled, skipped);
    }

    public int total()     { return pending + passed + failed + cancelled + skipped; }
    public int completed() { return total() - pending; }
}
