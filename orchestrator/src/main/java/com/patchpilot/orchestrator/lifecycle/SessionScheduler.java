package com.patchpilot.orchestrator.lifecycle;

import com.patchpilot.orchestrator.config.PatchPilotProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodically fails sessions whose worker stopped reporting activity,
 * so a crashed run never leaves a job holding its single ACTIVE session.
 */
@Component
@EnableScheduling
public class SessionScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionScheduler.class);

    private final SessionService sessionService;
    private final Duration       stallThreshold;

    public SessionScheduler(SessionService sessionService, PatchPilotProperties props) {
        this.sessionService = sessionService;
        this.stallThreshold = Duration.ofMillis(props.runner().sessionStallMs());
    }

    @Scheduled(fixedDelay = 60_000, initialDelay = 30_000)
    public void recoverStalledSessions() {
        int recovered = sessionService.recoverStalled(stallThreshold);
        if (recovered > 0) {
            log.warn("Recovered {} stalled session(s)", recovered);
        }
    }
}
