package com.patchpilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Everything needed to pick a job's work back up: where the code lives,
 * which branch, the last session, and what it has cost so far.
 *
 * DB table: work_records (one row per job)
 */
@Entity
@Table(name = "work_records")
public class WorkRecord {

    @Id
    @Column(name = "job_id")
    private UUID jobId;

    @Column(name = "session_id")
    private UUID sessionId;

    // AI conversation id of the most recent session, for --resume.
    @Column(name = "ai_session_id")
    private String aiSessionId;

    @Column(name = "branch_ref")
    private String branchRef;

    @Column(name = "workspace_ref")
    private String workspaceRef;

    @Column(nullable = false)
    private int attempts = 0;

    @Column(name = "total_cost_usd", nullable = false)
    private double totalCostUsd = 0.0;

    @Column(name = "artifact_url")
    private String artifactUrl;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected WorkRecord() {}

    public WorkRecord(UUID jobId, String workspaceRef, String branchRef) {
        this.jobId        = jobId;
        this.workspaceRef = workspaceRef;
        this.branchRef    = branchRef;
    }

    public UUID    getJobId()        { return jobId; }
    public UUID    getSessionId()    { return sessionId; }
    public String  getAiSessionId()  { return aiSessionId; }
    public String  getBranchRef()    { return branchRef; }
    public String  getWorkspaceRef() { return workspaceRef; }
    public int     getAttempts()     { return attempts; }
    public double  getTotalCostUsd() { return totalCostUsd; }
    public String  getArtifactUrl()  { return artifactUrl; }
    public Instant getUpdatedAt()    { return updatedAt; }

    public void setSessionId(UUID sessionId)        { this.sessionId = sessionId; }
    public void setAiSessionId(String aiSessionId)  { this.aiSessionId = aiSessionId; }
    public void setBranchRef(String branchRef)      { this.branchRef = branchRef; }
    public void setArtifactUrl(String artifactUrl)  { this.artifactUrl = artifactUrl; }

    public void recordAttempt(double costUsd) {
        this.attempts++;
        this.totalCostUsd += costUsd;
    }

    public void addCost(double costUsd) {
        this.totalCostUsd += costUsd;
    }
}
