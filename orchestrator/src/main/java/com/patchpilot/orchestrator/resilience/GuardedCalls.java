package com.patchpilot.orchestrator.resilience;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * The one place external calls are wrapped: circuit breaker outermost, then
 * retry, then (for long-running calls) a watchdog around each attempt.
 *
 * Every call is timed and every retry counted:
 * <pre>
 *   patchpilot.external.duration{operation, outcome}
 *   patchpilot.retry.attempts{operation}
 * </pre>
 */
@Component
public class GuardedCalls {

    private static final Logger log = LoggerFactory.getLogger(GuardedCalls.class);

    private final CircuitBreakerRegistry   breakers;
    private final RetryPolicy              retryPolicy;
    private final ScheduledExecutorService watchdogScheduler;
    private final Clock                    clock;
    private final MeterRegistry            meterRegistry;

    public GuardedCalls(CircuitBreakerRegistry breakers,
                        RetryPolicy retryPolicy,
                        ScheduledExecutorService watchdogScheduler,
                        Clock clock,
                        MeterRegistry meterRegistry) {
        this.breakers          = breakers;
        this.retryPolicy       = retryPolicy;
        this.watchdogScheduler = watchdogScheduler;
        this.clock             = clock;
        this.meterRegistry     = meterRegistry;
    }

    /** Breaker + retry, for short calls that carry their own I/O timeout. */
    public <T> T call(String operation, GuardedCall<T> call) throws InterruptedException {
        RetryPolicy retry = retryFor(operation);
        return timed(operation, () -> breakers.execute(operation, () -> retry.execute(call)));
    }

    /**
     * Breaker + retry with a call-specific classifier, for calls that are only
     * safe to repeat on some failures (non-idempotent writes).
     */
    public <T> T call(String operation, Predicate<RuntimeException> retryable, GuardedCall<T> call)
            throws InterruptedException {
        RetryPolicy retry = retryFor(operation).withClassifier(retryable);
        return timed(operation, () -> breakers.execute(operation, () -> retry.execute(call)));
    }

    /**
     * Breaker + retry + watchdog. Each attempt gets a fresh watchdog; the call
     * heartbeats it and {@code onTimeout} must terminate the attempt.
     */
    public <T> T supervised(String operation,
                            Duration watchdogTimeout,
                            Consumer<WatchdogContext> onTimeout,
                            Map<String, Object> metadata,
                            Watchdog.WatchedCall<T> call) throws InterruptedException {
        RetryPolicy retry = retryFor(operation);
        return timed(operation, () -> breakers.execute(operation, () -> retry.execute(() -> {
            Watchdog watchdog = new Watchdog(operation, watchdogTimeout, watchdogScheduler, clock, onTimeout);
            return watchdog.supervise(metadata, call);
        })));
    }

    private RetryPolicy retryFor(String operation) {
        return retryPolicy.withListener((error, attempt, delay) -> {
            log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                    operation, attempt, retryPolicy.getSettings().maxRetries(),
                    delay.toMillis(), error.getMessage());
            meterRegistry.counter("patchpilot.retry.attempts", "operation", operation).increment();
        });
    }

    private <T> T timed(String operation, GuardedCall<T> call) throws InterruptedException {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            return call.call();
        } catch (InterruptedException e) {
            outcome = "interrupted";
            throw e;
        } catch (CircuitOpenException e) {
            outcome = "circuit_open";
            throw e;
        } catch (HungOperationException e) {
            outcome = "hung";
            throw e;
        } catch (RuntimeException e) {
            outcome = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("patchpilot.external.duration",
                    "operation", operation, "outcome", outcome));
        }
    }
}
