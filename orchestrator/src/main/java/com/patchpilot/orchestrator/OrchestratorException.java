package com.patchpilot.orchestrator;

/**
 * Root of the orchestrator's exception hierarchy.
 *
 * Unchecked so callers only catch it when they have a specific recovery
 * strategy. The {@code code} is a stable, log-friendly identifier
 * (e.g. "CIRCUIT_OPEN") that survives message rewording.
 */
public class OrchestratorException extends RuntimeException {

    private final String code;

    public OrchestratorException(String code, String message) {
        super(message);
        this.code = code;
    }

    public OrchestratorException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() { return code; }
}
