package com.patchpilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One invocation of the parallel orchestrator. Counters are rewritten as
 * jobs change status; the per-job rows live in batch_items.
 *
 * DB table: parallel_batches
 */
@Entity
@Table(name = "parallel_batches")
public class ParallelBatch {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "max_concurrency", nullable = false)
    private int maxConcurrency;

    @Column(name = "job_count", nullable = false)
    private int jobCount;

    @Column(nullable = false) private int pending;
    @Column(name = "in_progress", nullable = false) private int inProgress;
    @Column(nullable = false) private int completed;
    @Column(nullable = false) private int failed;
    @Column(nullable = false) private int cancelled;

    @Column(name = "total_cost_usd", nullable = false)
    private double totalCostUsd = 0.0;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    protected ParallelBatch() {}

    public ParallelBatch(int maxConcurrency, int jobCount, Instant startedAt) {
        this.maxConcurrency = maxConcurrency;
        this.jobCount       = jobCount;
        this.pending        = jobCount;
        this.startedAt      = startedAt;
    }

    public UUID    getId()             { return id; }
    public int     getMaxConcurrency() { return maxConcurrency; }
    public int     getJobCount()       { return jobCount; }
    public int     getPending()        { return pending; }
    public int     getInProgress()     { return inProgress; }
    public int     getCompleted()      { return completed; }
    public int     getFailed()         { return failed; }
    public int     getCancelled()      { return cancelled; }
    public double  getTotalCostUsd()   { return totalCostUsd; }
    public Instant getStartedAt()      { return startedAt; }
    public Instant getFinishedAt()     { return finishedAt; }

    public boolean isFinished() { return finishedAt != null; }

    public void setCounts(int pending, int inProgress, int completed, int failed, int cancelled) {
        this.pending    = pending;
        this.inProgress = inProgress;
        this.completed  = completed;
        this.failed     = failed;
        this.cancelled  = cancelled;
    }

    public void setTotalCostUsd(double totalCostUsd) { this.totalCostUsd = totalCostUsd; }
    public void setFinishedAt(Instant finishedAt)    { this.finishedAt = finishedAt; }
}
