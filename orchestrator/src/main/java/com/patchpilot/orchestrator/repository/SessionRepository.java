package com.patchpilot.orchestrator.repository;

import com.patchpilot.orchestrator.model.Session;
import com.patchpilot.orchestrator.model.SessionStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SessionRepository extends JpaRepository<Session, UUID> {

    Optional<Session> findFirstByJobIdAndStatus(UUID jobId, SessionStatus status);

    List<Session> findByJobIdOrderByStartedAtAsc(UUID jobId);

    /**
     * ACTIVE sessions with no activity since {@code cutoff}: the worker
     * driving them crashed or the process was restarted.
     */
    List<Session> findByStatusAndLastActivityAtBefore(SessionStatus status, Instant cutoff);
}
