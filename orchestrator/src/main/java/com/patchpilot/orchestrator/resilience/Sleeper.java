package com.patchpilot.orchestrator.resilience;

import java.time.Duration;

/**
 * Blocking pause used by every wait in the engine (backoff, poll interval,
 * cooldown, pause-idle). Injected so tests can observe and skip the waits.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
