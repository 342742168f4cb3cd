package com.patchpilot.orchestrator.resilience;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;

/**
 * Bounded exponential backoff around one fallible call.
 *
 * The n-th retry (n starting at 0) waits {@code min(baseDelay * 2^n, maxDelay)},
 * optionally stretched by up to 25% jitter and then capped at maxDelay again.
 * A {@link RateLimitedException} carrying a retry-after hint waits for that hint
 * instead, also capped. Errors the classifier rejects propagate on the first throw.
 */
public class RetryPolicy {

    public record Settings(int maxRetries, Duration baseDelay, Duration maxDelay, boolean jitter) {
        public Settings {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
            }
            if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
                throw new IllegalArgumentException(
                        "need 0 <= baseDelay <= maxDelay (base: " + baseDelay + ", max: " + maxDelay + ")");
            }
        }
    }

    private static final double MAX_JITTER = 0.25;

    private final Settings                     settings;
    private final Predicate<RuntimeException>  retryable;
    private final RetryListener                listener;
    private final Sleeper                      sleeper;
    private final DoubleSupplier               random;

    public RetryPolicy(Settings settings, Sleeper sleeper) {
        this(settings, RetryPolicy::isTransient, RetryListener.NONE, sleeper,
                () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryPolicy(Settings settings,
                       Predicate<RuntimeException> retryable,
                       RetryListener listener,
                       Sleeper sleeper,
                       DoubleSupplier random) {
        this.settings  = settings;
        this.retryable = retryable;
        this.listener  = listener;
        this.sleeper   = sleeper;
        this.random    = random;
    }

    public RetryPolicy withListener(RetryListener listener) {
        return new RetryPolicy(settings, retryable, listener, sleeper, random);
    }

    public RetryPolicy withClassifier(Predicate<RuntimeException> retryable) {
        return new RetryPolicy(settings, retryable, listener, sleeper, random);
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    public <T> T execute(GuardedCall<T> call) throws InterruptedException {
        for (int attempt = 0; ; attempt++) {
            try {
                return call.call();
            } catch (RuntimeException e) {
                if (attempt >= settings.maxRetries() || !retryable.test(e)) {
                    throw e;
                }
                Duration delay = delayFor(attempt, e);
                listener.onRetry(e, attempt + 1, delay);
                sleeper.sleep(delay);
            }
        }
    }

    /** Backoff before retry number {@code attempt + 1}. */
    Duration delayFor(int attempt, RuntimeException error) {
        long maxMs = settings.maxDelay().toMillis();
        if (error instanceof RateLimitedException rl && rl.getRetryAfter().isPresent()) {
            return Duration.ofMillis(Math.min(rl.getRetryAfter().get().toMillis(), maxMs));
        }
        long baseMs = settings.baseDelay().toMillis();
        // 2^attempt overflows long long before any sane maxDelay, so clamp the shift.
        long exponential = attempt >= 62 ? maxMs : Math.min(baseMs << attempt, maxMs);
        if (exponential < 0) {
            exponential = maxMs;
        }
        if (settings.jitter()) {
            exponential = (long) (exponential * (1 + random.getAsDouble() * MAX_JITTER));
        }
        return Duration.ofMillis(Math.min(exponential, maxMs));
    }

    public Settings getSettings() { return settings; }

    // ------------------------------------------------------------------
    // Default classifier
    // ------------------------------------------------------------------

    /**
     * Transient by default: our own {@link TransientException} family, plus
     * wrapped I/O failures (connect refused, HTTP timeouts) from the JDK clients.
     */
    public static boolean isTransient(RuntimeException e) {
        if (e instanceof CircuitOpenException) {
            return false;
        }
        if (e instanceof TransientException) {
            return true;
        }
        if (e instanceof UncheckedIOException) {
            return true;
        }
        return e.getCause() instanceof IOException;
    }
}
