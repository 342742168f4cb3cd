package com.patchpilot.orchestrator.resilience;

/**
 * A call wrapped by the resilience primitives.
 *
 * Only interruption is allowed through as a checked exception; anything else
 * the call can fail with must be unchecked so the wrappers can classify it.
 */
@FunctionalInterface
public interface GuardedCall<T> {

    T call() throws InterruptedException;
}
