package com.patchpilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One countable event for admission control: a PR opened, or money spent.
 *
 * Counters are derived by summing rows inside a period window, so nothing
 * ever needs resetting at rollover and totals only grow within a period.
 *
 * DB table: usage_ledger
 */
@Entity
@Table(name = "usage_ledger")
public class UsageEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private UsageKind kind;

    @Column(name = "project_id")
    private String projectId;

    @Column(name = "job_id")
    private UUID jobId;

    @Column(name = "amount_usd", nullable = false)
    private double amountUsd;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    protected UsageEntry() {}

    public UsageEntry(UsageKind kind, String projectId, UUID jobId, double amountUsd, Instant occurredAt) {
        this.kind       = kind;
        this.projectId  = projectId;
        this.jobId      = jobId;
        this.amountUsd  = amountUsd;
        this.occurredAt = occurredAt;
    }

    public UUID      getId()         { return id; }
    public UsageKind getKind()       { return kind; }
    public String    getProjectId()  { return projectId; }
    public UUID      getJobId()      { return jobId; }
    public double    getAmountUsd()  { return amountUsd; }
    public Instant   getOccurredAt() { return occurredAt; }
}
