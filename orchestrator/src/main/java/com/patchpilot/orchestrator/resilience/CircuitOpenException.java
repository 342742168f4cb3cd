package com.patchpilot.orchestrator.resilience;

import com.patchpilot.orchestrator.OrchestratorException;

import java.time.Duration;
import java.time.Instant;

/**
 * Thrown by {@link CircuitBreaker} when it rejects a call without invoking it.
 *
 * Never retried: the caller should wait at least {@link #getRemaining()}.
 */
public class CircuitOpenException extends OrchestratorException {

    private final String   operation;
    private final Instant  reopenAt;
    private final Duration remaining;

    public CircuitOpenException(String operation, Instant reopenAt, Duration remaining) {
        super("CIRCUIT_OPEN",
                "Circuit breaker open for %s, will allow calls again at %s (in %d ms)"
                        .formatted(operation, reopenAt, remaining.toMillis()));
        this.operation = operation;
        this.reopenAt  = reopenAt;
        this.remaining = remaining;
    }

    public String   getOperation() { return operation; }
    public Instant  getReopenAt()  { return reopenAt; }
    public Duration getRemaining() { return remaining; }
}
