package com.patchpilot.orchestrator.ai;

/**
 * Runs a prompt against the AI code-change agent inside a working copy.
 *
 * Implementations never throw for an unsuccessful run; they report it in
 * the result so callers can account for the cost it still incurred.
 */
public interface AiInvoker {

    AiResult query(String prompt, AiQuery query) throws InterruptedException;
}
