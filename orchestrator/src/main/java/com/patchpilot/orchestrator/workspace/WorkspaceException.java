package com.patchpilot.orchestrator.workspace;

import com.patchpilot.orchestrator.OrchestratorException;

/** A git command in a working copy failed or could not be run. */
public class WorkspaceException extends OrchestratorException {

    public WorkspaceException(String message) {
        super("WORKSPACE", message);
    }

    public WorkspaceException(String message, Throwable cause) {
        super("WORKSPACE", message, cause);
    }
}
