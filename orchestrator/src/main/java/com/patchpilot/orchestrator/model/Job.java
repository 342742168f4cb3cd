package com.patchpilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * One issue tracked from discovery to a terminal outcome.
 *
 * {@code state} is only written by JobStateMachine; everything else is
 * descriptive data captured at discovery time plus the linked PR once one exists.
 *
 * DB table: jobs
 */
@Entity
@Table(name = "jobs")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Issue URL. Unique across every state: it is the dedupe key for ingestion.
    @Column(nullable = false, unique = true)
    private String url;

    // "owner/repo" of the repository the issue belongs to.
    @Column(name = "project_id", nullable = false)
    private String projectId;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String body;

    // Comma-separated; labels never contain commas on the hosting side.
    @Column(columnDefinition = "TEXT")
    private String labels;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobState state = JobState.DISCOVERED;

    // Backlog order (oldest first). Null until the job is queued.
    @Column(name = "queued_at")
    private Instant queuedAt;

    @Column(name = "linked_artifact_url")
    private String linkedArtifactUrl;

    // Set when the job is abandoned or closed, for the operator.
    @Column(name = "last_reason", columnDefinition = "TEXT")
    private String lastReason;

    @Version
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(String url, String projectId, String title, String body, List<String> labels) {
        this.url       = url;
        this.projectId = projectId;
        this.title     = title;
        this.body      = body;
        setLabels(labels);
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID     getId()                { return id; }
    public String   getUrl()               { return url; }
    public String   getProjectId()         { return projectId; }
    public String   getTitle()             { return title; }
    public String   getBody()              { return body; }
    public JobState getState()             { return state; }
    public Instant  getQueuedAt()          { return queuedAt; }
    public String   getLinkedArtifactUrl() { return linkedArtifactUrl; }
    public String   getLastReason()        { return lastReason; }
    public long     getVersion()           { return version; }
    public Instant  getCreatedAt()         { return createdAt; }
    public Instant  getUpdatedAt()         { return updatedAt; }

    public List<String> getLabels() {
        if (labels == null || labels.isBlank()) {
            return List.of();
        }
        return Arrays.stream(labels.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    public void setLabels(List<String> labels) {
        this.labels = labels == null ? null : String.join(",", labels);
    }

    public void setState(JobState state)                { this.state = state; }
    public void setQueuedAt(Instant queuedAt)           { this.queuedAt = queuedAt; }
    public void setLinkedArtifactUrl(String url)        { this.linkedArtifactUrl = url; }
    public void setLastReason(String lastReason)        { this.lastReason = lastReason; }
}
