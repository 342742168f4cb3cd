package com.patchpilot.orchestrator.admission;

import com.patchpilot.orchestrator.OrchestratorException;

/**
 * A rate or budget gate said no. Not a failure of the job: it stays in the
 * backlog and is tried again later.
 */
public class AdmissionDeniedException extends OrchestratorException {

    public enum Gate { RATE, BUDGET }

    private final Gate gate;

    public AdmissionDeniedException(Gate gate, String reason) {
        super("ADMISSION_DENIED", reason);
        this.gate = gate;
    }

    public Gate getGate() { return gate; }
}
