package com.patchpilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit row, one per applied state change.
 *
 * DB table: job_transitions
 */
@Entity
@Table(name = "job_transitions")
public class JobTransition {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_state", nullable = false)
    private JobState fromState;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_state", nullable = false)
    private JobState toState;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(name = "session_id")
    private UUID sessionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected JobTransition() {}

    public JobTransition(UUID jobId, JobState fromState, JobState toState,
                         String reason, UUID sessionId, Instant createdAt) {
        this.jobId     = jobId;
        this.fromState = fromState;
        this.toState   = toState;
        this.reason    = reason;
        this.sessionId = sessionId;
        this.createdAt = createdAt;
    }

    public UUID     getId()        { return id; }
    public UUID     getJobId()     { return jobId; }
    public JobState getFromState() { return fromState; }
    public JobState getToState()   { return toState; }
    public String   getReason()    { return reason; }
    public UUID     getSessionId() { return sessionId; }
    public Instant  getCreatedAt() { return createdAt; }
}
