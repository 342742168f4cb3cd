package com.patchpilot.orchestrator.lifecycle;

import com.patchpilot.orchestrator.model.Session;
import com.patchpilot.orchestrator.model.SessionStatus;
import com.patchpilot.orchestrator.model.WorkRecord;
import com.patchpilot.orchestrator.repository.SessionRepository;
import com.patchpilot.orchestrator.repository.WorkRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Worker sessions and the per-job work record.
 *
 * A job has at most one ACTIVE session: {@link #open} refuses a second one.
 * Sessions that stop reporting activity are failed by {@link #recoverStalled},
 * which the session scheduler calls periodically.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final SessionRepository    sessionRepo;
    private final WorkRecordRepository workRecordRepo;
    private final Clock                clock;

    public SessionService(SessionRepository sessionRepo, WorkRecordRepository workRecordRepo, Clock clock) {
        this.sessionRepo    = sessionRepo;
        this.workRecordRepo = workRecordRepo;
        this.clock          = clock;
    }

    // ------------------------------------------------------------------
    // Sessions
    // ------------------------------------------------------------------

    /**
     * @throws IllegalStateException if the job already has an ACTIVE session
     */
    @Transactional
    public Session open(UUID jobId) {
        sessionRepo.findFirstByJobIdAndStatus(jobId, SessionStatus.ACTIVE).ifPresent(active -> {
            throw new IllegalStateException(
                    "Job " + jobId + " already has active session " + active.getId());
        });
        Session session = sessionRepo.save(new Session(jobId, clock.instant()));
        log.info("Opened session {} for job {}", session.getId(), jobId);
        return session;
    }

    /** Adds AI usage to the session and refreshes its activity timestamp. */
    @Transactional
    public Session recordActivity(UUID sessionId, int turns, double costUsd, String aiSessionId) {
        Session session = load(sessionId);
        session.addUsage(turns, costUsd);
        if (aiSessionId != null) {
            session.setAiSessionId(aiSessionId);
        }
        session.setLastActivityAt(clock.instant());
        return sessionRepo.save(session);
    }

    @Transactional
    public Session complete(UUID sessionId) {
        return close(sessionId, SessionStatus.COMPLETED, null, true);
    }

    @Transactional
    public Session fail(UUID sessionId, String error, boolean resumable) {
        return close(sessionId, SessionStatus.FAILED, error, resumable);
    }

    @Transactional(readOnly = true)
    public Optional<Session> activeFor(UUID jobId) {
        return sessionRepo.findFirstByJobIdAndStatus(jobId, SessionStatus.ACTIVE);
    }

    @Transactional(readOnly = true)
    public List<Session> sessionsFor(UUID jobId) {
        return sessionRepo.findByJobIdOrderByStartedAtAsc(jobId);
    }

    /**
     * Fail every ACTIVE session idle for longer than {@code threshold}.
     * The job itself is left where it is for the operator to inspect.
     *
     * @return number of sessions failed
     */
    @Transactional
    public int recoverStalled(Duration threshold) {
        Instant cutoff = clock.instant().minus(threshold);
        List<Session> stalled = sessionRepo.findByStatusAndLastActivityAtBefore(SessionStatus.ACTIVE, cutoff);
        for (Session session : stalled) {
            log.warn("Session {} (job {}) idle since {}, marking failed",
                    session.getId(), session.getJobId(), session.getLastActivityAt());
            session.setStatus(SessionStatus.FAILED);
            session.setResumable(false);
            session.setError("Stalled: no activity since " + session.getLastActivityAt());
            session.setEndedAt(clock.instant());
            sessionRepo.save(session);
        }
        return stalled.size();
    }

    // ------------------------------------------------------------------
    // Work records
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<WorkRecord> workRecord(UUID jobId) {
        return workRecordRepo.findById(jobId);
    }

    /** Creates the job's work record on first use, otherwise returns it unchanged. */
    @Transactional
    public WorkRecord attachWorkRecord(UUID jobId, String workspaceRef, String branchRef) {
        return workRecordRepo.findById(jobId)
                .orElseGet(() -> workRecordRepo.save(new WorkRecord(jobId, workspaceRef, branchRef)));
    }

    /** Counts one more attempt against the job and links it to the session that made it. */
    @Transactional
    public WorkRecord recordAttempt(UUID jobId, Session session, double costUsd) {
        WorkRecord record = workRecordRepo.findById(jobId)
                .orElseThrow(() -> new IllegalStateException("No work record for job " + jobId));
        record.recordAttempt(costUsd);
        record.setSessionId(session.getId());
        if (session.getAiSessionId() != null) {
            record.setAiSessionId(session.getAiSessionId());
        }
        return workRecordRepo.save(record);
    }

    @Transactional
    public WorkRecord recordArtifact(UUID jobId, String artifactUrl) {
        WorkRecord record = workRecordRepo.findById(jobId)
                .orElseThrow(() -> new IllegalStateException("No work record for job " + jobId));
        record.setArtifactUrl(artifactUrl);
        return workRecordRepo.save(record);
    }

    @Transactional
    public void addCost(UUID jobId, double costUsd) {
        workRecordRepo.findById(jobId).ifPresent(record -> {
            record.addCost(costUsd);
            workRecordRepo.save(record);
        });
    }

    // ------------------------------------------------------------------

    private Session load(UUID sessionId) {
        return sessionRepo.findById(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Session not found: " + sessionId));
    }

    private Session close(UUID sessionId, SessionStatus status, String error, boolean resumable) {
        Session session = load(sessionId);
        session.setStatus(status);
        session.setError(error);
        session.setResumable(resumable);
        session.setEndedAt(clock.instant());
        session.setLastActivityAt(clock.instant());
        log.info("Session {} (job {}) {}", sessionId, session.getJobId(), status);
        return sessionRepo.save(session);
    }
}
