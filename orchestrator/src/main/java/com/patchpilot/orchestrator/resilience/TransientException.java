package com.patchpilot.orchestrator.resilience;

import com.patchpilot.orchestrator.OrchestratorException;

/**
 * A failure expected to go away on its own: network blips, timeouts,
 * throttling responses from a dependency.
 *
 * {@link RetryPolicy} treats this type (and its subclasses) as retryable.
 */
public class TransientException extends OrchestratorException {

    public TransientException(String message) {
        super("TRANSIENT", message);
    }

    public TransientException(String message, Throwable cause) {
        super("TRANSIENT", message, cause);
    }

    protected TransientException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
