package com.patchpilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One execution attempt of a Job by the worker: the initial fix, a resume,
 * or a CI repair run. At most one ACTIVE session exists per job.
 *
 * DB table: sessions
 */
@Entity
@Table(name = "sessions")
public class Session {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SessionStatus status = SessionStatus.ACTIVE;

    @Column(name = "turn_count", nullable = false)
    private int turnCount = 0;

    @Column(name = "cost_usd", nullable = false)
    private double costUsd = 0.0;

    // False once the AI side can no longer continue this conversation.
    @Column(nullable = false)
    private boolean resumable = true;

    // Conversation id reported by the AI CLI, used for --resume.
    @Column(name = "ai_session_id")
    private String aiSessionId;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "last_activity_at", nullable = false)
    private Instant lastActivityAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    protected Session() {}

    public Session(UUID jobId, Instant startedAt) {
        this.jobId          = jobId;
        this.startedAt      = startedAt;
        this.lastActivityAt = startedAt;
    }

    public UUID          getId()             { return id; }
    public UUID          getJobId()          { return jobId; }
    public SessionStatus getStatus()         { return status; }
    public int           getTurnCount()      { return turnCount; }
    public double        getCostUsd()        { return costUsd; }
    public boolean       isResumable()       { return resumable; }
    public String        getAiSessionId()    { return aiSessionId; }
    public String        getError()          { return error; }
    public Instant       getStartedAt()      { return startedAt; }
    public Instant       getLastActivityAt() { return lastActivityAt; }
    public Instant       getEndedAt()        { return endedAt; }

    public void setStatus(SessionStatus status)       { this.status = status; }
    public void setResumable(boolean resumable)       { this.resumable = resumable; }
    public void setAiSessionId(String aiSessionId)    { this.aiSessionId = aiSessionId; }
    public void setError(String error)                { this.error = error; }
    public void setLastActivityAt(Instant at)         { this.lastActivityAt = at; }
    public void setEndedAt(Instant endedAt)           { this.endedAt = endedAt; }

    public void addUsage(int turns, double costUsd) {
        this.turnCount += turns;
        this.costUsd   += costUsd;
    }
}
