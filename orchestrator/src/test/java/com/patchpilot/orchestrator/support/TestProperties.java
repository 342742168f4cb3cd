package com.patchpilot.orchestrator.support;

import com.patchpilot.orchestrator.config.PatchPilotProperties;
import com.patchpilot.orchestrator.config.PatchPilotProperties.*;

import java.util.List;

/** application.yml defaults as a record tree, with one-section overrides. */
public final class TestProperties {

    private TestProperties() {}

    public static PatchPilotProperties defaults() {
        return new PatchPilotProperties(
                new Parallel(3, true),
                new QualityGates(10, 3),
                new Budget(50.0, 500.0, 5.0),
                new Ci(1_800_000, 30_000, 30_000, 3, true, 20, 2.0, 300_000, 15_000, 60_000, "origin", List.of()),
                new Breaker(5, 2, 60_000),
                new Retry(3, 1_000, 30_000, false),
                new Watchdog(600_000, 60_000),
                new Queue(5, 20),
                new Runner(5_000, 5_000, 60_000, 3_600_000),
                new Ai("claude", "", 50),
                new Workspace("/tmp/patchpilot"),
                new GitHub("https://api.github.com", "", List.of("acme/api"), List.of("bug")),
                new Usage("UTC"));
    }

    public static PatchPilotProperties with(Parallel parallel) {
        PatchPilotProperties p = defaults();
        return new PatchPilotProperties(parallel, p.qualityGates(), p.budget(), p.ci(), p.circuitBreaker(),
                p.retry(), p.watchdog(), p.queue(), p.runner(), p.ai(), p.workspace(), p.github(), p.usage());
    }

    public static PatchPilotProperties with(QualityGates gates) {
        PatchPilotProperties p = defaults();
        return new PatchPilotProperties(p.parallel(), gates, p.budget(), p.ci(), p.circuitBreaker(),
                p.retry(), p.watchdog(), p.queue(), p.runner(), p.ai(), p.workspace(), p.github(), p.usage());
    }

    public static PatchPilotProperties with(Budget budget) {
        PatchPilotProperties p = defaults();
        return new PatchPilotProperties(p.parallel(), p.qualityGates(), budget, p.ci(), p.circuitBreaker(),
                p.retry(), p.watchdog(), p.queue(), p.runner(), p.ai(), p.workspace(), p.github(), p.usage());
    }

    public static PatchPilotProperties with(Queue queue) {
        PatchPilotProperties p = defaults();
        return new PatchPilotProperties(p.parallel(), p.qualityGates(), p.budget(), p.ci(), p.circuitBreaker(),
                p.retry(), p.watchdog(), queue, p.runner(), p.ai(), p.workspace(), p.github(), p.usage());
    }

    public static PatchPilotProperties with(Usage usage) {
        PatchPilotProperties p = defaults();
        return new PatchPilotProperties(p.parallel(), p.qualityGates(), p.budget(), p.ci(), p.circuitBreaker(),
                p.retry(), p.watchdog(), p.queue(), p.runner(), p.ai(), p.workspace(), p.github(), usage);
    }
}
