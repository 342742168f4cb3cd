package com.patchpilot.orchestrator.workspace;

import java.nio.file.Path;

/**
 * The version-control steps the engine needs inside an existing working copy.
 * Cloning and working-copy isolation are someone else's job.
 *
 * All methods throw {@link WorkspaceException} on failure.
 */
public interface WorkspaceOperations {

    /** Creates or resets {@code branch} at the current HEAD and checks it out. */
    void checkoutBranch(Path repo, String branch) throws InterruptedException;

    /** Checks out an existing {@code branch} as it is, without moving it. */
    void switchBranch(Path repo, String branch) throws InterruptedException;

    boolean hasUncommittedChanges(Path repo) throws InterruptedException;

    /** Stages every change and commits it. */
    void commitAll(Path repo, String message) throws InterruptedException;

    void push(Path repo, String branch, String remote, boolean skipVerification) throws InterruptedException;

    String headSha(Path repo) throws InterruptedException;
}
