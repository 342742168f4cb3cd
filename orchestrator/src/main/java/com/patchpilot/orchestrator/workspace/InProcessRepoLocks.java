package com.patchpilot.orchestrator.workspace;

import com.patchpilot.orchestrator.resilience.GuardedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * One fair single-permit semaphore per normalized repository path.
 *
 * A semaphore rather than a ReentrantLock so a second acquisition from the
 * same thread blocks instead of silently succeeding.
 */
@Component
public class InProcessRepoLocks implements RepoLockProvider {

    private static final Logger log = LoggerFactory.getLogger(InProcessRepoLocks.class);

    private final Map<String, Semaphore> locks = new ConcurrentHashMap<>();

    @Override
    public <T> T withLock(Path repoPath, GuardedCall<T> fn) throws InterruptedException {
        String key = repoPath.toAbsolutePath().normalize().toString();
        Semaphore lock = locks.computeIfAbsent(key, k -> new Semaphore(1, true));
        if (!lock.tryAcquire()) {
            log.debug("Waiting for repository lock on {}", key);
            lock.acquire();
        }
        try {
            return fn.call();
        } finally {
            lock.release();
        }
    }

    public boolean isLocked(Path repoPath) {
        Semaphore lock = locks.get(repoPath.toAbsolutePath().normalize().toString());
        return lock != null && lock.availablePermits() == 0;
    }
}
