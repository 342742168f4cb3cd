package com.patchpilot.orchestrator.resilience;

import java.time.Duration;
import java.util.Optional;

/**
 * A dependency told us to slow down (HTTP 429, secondary rate limit, ...).
 *
 * When the dependency supplied a Retry-After hint, {@link RetryPolicy}
 * waits that long instead of the computed backoff (still capped at maxDelay).
 */
public class RateLimitedException extends TransientException {

    private final Duration retryAfter;

    public RateLimitedException(String message, Duration retryAfter) {
        super("RATE_LIMITED", message, null);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
