package com.patchpilot.orchestrator.workspace;

import com.patchpilot.orchestrator.resilience.GuardedCall;

import java.nio.file.Path;

/**
 * Scoped mutual exclusion per repository working copy.
 *
 * Not reentrant: taking the same repository's lock twice on one thread deadlocks.
 */
public interface RepoLockProvider {

    /** Runs {@code fn} holding the lock for {@code repoPath}; released on every exit path. */
    <T> T withLock(Path repoPath, GuardedCall<T> fn) throws InterruptedException;
}
