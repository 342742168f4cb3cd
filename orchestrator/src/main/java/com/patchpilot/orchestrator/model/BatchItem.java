package com.patchpilot.orchestrator.model;

import jakarta.persistence.*;
import java.util.UUID;

/**
 * DB table: batch_items
 */
@Entity
@Table(name = "batch_items")
public class BatchItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "batch_id", nullable = false)
    private UUID batchId;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BatchItemStatus status = BatchItemStatus.PENDING;

    @Column(name = "cost_usd", nullable = false)
    private double costUsd = 0.0;

    @Column(name = "duration_ms", nullable = false)
    private long durationMs = 0;

    @Column(name = "artifact_url")
    private String artifactUrl;

    @Column(columnDefinition = "TEXT")
    private String error;

    protected BatchItem() {}

    public BatchItem(UUID batchId, UUID jobId) {
        this.batchId = batchId;
        this.jobId   = jobId;
    }

    public UUID            getId()          { return id; }
    public UUID            getBatchId()     { return batchId; }
    public UUID            getJobId()       { return jobId; }
    public BatchItemStatus getStatus()      { return status; }
    public double          getCostUsd()     { return costUsd; }
    public long            getDurationMs()  { return durationMs; }
    public String          getArtifactUrl() { return artifactUrl; }
    public String          getError()       { return error; }

    public void setStatus(BatchItemStatus status) { this.status = status; }

    public void finish(BatchItemStatus status, double costUsd, long durationMs, String artifactUrl, String error) {
        this.status      = status;
        this.costUsd     = costUsd;
        this.durationMs  = durationMs;
        this.artifactUrl = artifactUrl;
        this.error       = error;
    }
}
