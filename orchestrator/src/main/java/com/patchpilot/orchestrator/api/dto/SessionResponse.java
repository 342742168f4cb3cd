package com.patchpilot.orchestrator.api.dto;

import com.patchpilot.orchestrator.model.Session;
import com.patchpilot.orchestrator.model.SessionStatus;

import java.time.Instant;
import java.util.UUID;

public record SessionResponse(
        UUID          id,
        SessionStatus status,
        int           turnCount,
        double        costUsd,
        boolean       resumable,
        String        aiSessionId,
        String        error,
        Instant       startedAt,
        Instant       lastActivityAt,
        Instant       endedAt
) {
    public static SessionResponse from(Session s) {
        return new SessionResponse(
                s.getId(),
                s.getStatus(),
                s.getTurnCount(),
                s.getCostUsd(),
                s.isResumable(),
                s.getAiSessionId(),
                s.getError(),
                s.getStartedAt(),
                s.getLastActivityAt(),
                s.getEndedAt()
        );
    }
}
