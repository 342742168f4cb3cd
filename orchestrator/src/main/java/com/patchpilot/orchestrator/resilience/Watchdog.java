package com.patchpilot.orchestrator.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Stall detector for one in-flight external call.
 *
 * The caller heartbeats while the call makes progress (a line of CLI output,
 * a chunk of a response). If neither a heartbeat nor {@link #stop()} arrives
 * within the timeout, {@code onTimeout} fires once; it is expected to kill the
 * underlying process or abort the request. A slow call that keeps
 * heartbeating is never fired on.
 */
public class Watchdog {

    /** A call that can heartbeat its own watchdog. */
    @FunctionalInterface
    public interface WatchedCall<T> {
        T call(Watchdog watchdog) throws InterruptedException;
    }

    private static final Logger log = LoggerFactory.getLogger(Watchdog.class);

    private final String                    operation;
    private final Duration                  timeout;
    private final ScheduledExecutorService  scheduler;
    private final Clock                     clock;
    private final Consumer<WatchdogContext> onTimeout;
    private final Consumer<WatchdogContext> onHeartbeat;

    private ScheduledFuture<?> pending;
    private WatchdogContext    context;
    private boolean            running;
    private boolean            fired;
    // bumped on every (re)schedule; a timer task from an older deadline is ignored
    private long               generation;

    public Watchdog(String operation,
                    Duration timeout,
                    ScheduledExecutorService scheduler,
                    Clock clock,
                    Consumer<WatchdogContext> onTimeout) {
        this(operation, timeout, scheduler, clock, onTimeout, ctx -> {});
    }

    public Watchdog(String operation,
                    Duration timeout,
                    ScheduledExecutorService scheduler,
                    Clock clock,
                    Consumer<WatchdogContext> onTimeout,
                    Consumer<WatchdogContext> onHeartbeat) {
        this.operation   = operation;
        this.timeout     = timeout;
        this.scheduler   = scheduler;
        this.clock       = clock;
        this.onTimeout   = onTimeout;
        this.onHeartbeat = onHeartbeat;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    public synchronized void start(Map<String, Object> metadata) {
        if (running) {
            log.warn("Watchdog for {} already running, restarting", operation);
            cancelPending();
        }
        Instant now = clock.instant();
        context = new WatchdogContext(operation, now, now, metadata == null ? Map.of() : Map.copyOf(metadata));
        running = true;
        fired   = false;
        schedule();
        log.debug("Watchdog started for {} (timeout {} ms)", operation, timeout.toMillis());
    }

    /** Pushes the deadline out by a full timeout. No-op when not running. */
    public void heartbeat() {
        WatchdogContext snapshot;
        synchronized (this) {
            if (!running) {
                return;
            }
            context = new WatchdogContext(operation, context.startedAt(), clock.instant(), context.metadata());
            cancelPending();
            schedule();
            snapshot = context;
        }
        onHeartbeat.accept(snapshot);
    }

    public synchronized void stop() {
        running = false;
        cancelPending();
    }

    // ------------------------------------------------------------------
    // Introspection
    // ------------------------------------------------------------------

    public synchronized boolean isRunning() { return running; }
    public synchronized boolean hasFired()  { return fired; }

    public synchronized Duration elapsed() {
        return context == null ? Duration.ZERO : Duration.between(context.startedAt(), clock.instant());
    }

    public synchronized Duration sinceLastHeartbeat() {
        return context == null ? Duration.ZERO : Duration.between(context.lastHeartbeat(), clock.instant());
    }

    public String   getOperation() { return operation; }
    public Duration getTimeout()   { return timeout; }

    // ------------------------------------------------------------------
    // Scoped supervision
    // ------------------------------------------------------------------

    /**
     * Runs {@code call} under this watchdog and stops it on every exit path.
     *
     * If the watchdog fired, the outcome of the call is discarded and a
     * {@link HungOperationException} is thrown instead: whatever the call
     * returned after being killed is not trustworthy.
     */
    public <T> T supervise(Map<String, Object> metadata, WatchedCall<T> call) throws InterruptedException {
        start(metadata);
        T result;
        try {
            result = call.call(this);
        } catch (RuntimeException e) {
            if (hasFired()) {
                throw hung(e);
            }
            throw e;
        } finally {
            stop();
        }
        if (hasFired()) {
            throw hung(null);
        }
        return result;
    }

    private HungOperationException hung(Throwable cause) {
        return new HungOperationException(operation, timeout.toMillis(), cause);
    }

    // ------------------------------------------------------------------
    // Internals (callers hold the lock)
    // ------------------------------------------------------------------

    private void schedule() {
        long deadline = ++generation;
        pending = scheduler.schedule(() -> fire(deadline), timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cancelPending() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    private void fire(long deadline) {
        WatchdogContext snapshot;
        synchronized (this) {
            if (!running || deadline != generation) {
                return;
            }
            running = false;
            fired   = true;
            pending = null;
            snapshot = context;
        }
        log.warn("Watchdog timeout for {}: no heartbeat for {} ms, terminating",
                operation, timeout.toMillis());
        try {
            onTimeout.accept(snapshot);
        } catch (RuntimeException e) {
            log.error("Watchdog onTimeout handler for {} failed: {}", operation, e.getMessage(), e);
        }
    }
}
