package com.patchpilot.orchestrator.resilience;

/**
 * The {@link Watchdog} saw no heartbeat within its timeout and terminated the call.
 *
 * Retryable by default: a hung CLI process or stalled socket is usually a
 * one-off. Callers that know better (e.g. a half-applied repair) map it
 * to their own failure type.
 */
public class HungOperationException extends TransientException {

    private final String operation;
    private final long   timeoutMs;

    public HungOperationException(String operation, long timeoutMs) {
        this(operation, timeoutMs, null);
    }

    public HungOperationException(String operation, long timeoutMs, Throwable cause) {
        super("HUNG_OPERATION",
                "%s made no progress for %d ms and was terminated".formatted(operation, timeoutMs),
                cause);
        this.operation = operation;
        this.timeoutMs = timeoutMs;
    }

    public String getOperation() { return operation; }
    public long   getTimeoutMs() { return timeoutMs; }
}
