package com.patchpilot.orchestrator.resilience;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Three-state failure isolator for one operation key.
 *
 * <pre>
 *   CLOSED    --(failureThreshold consecutive failures)--> OPEN
 *   OPEN      --(openDuration elapsed, next call)-------> HALF_OPEN
 *   HALF_OPEN --(successThreshold consecutive successes)-> CLOSED
 *   HALF_OPEN --(any failure)---------------------------> OPEN
 * </pre>
 *
 * While OPEN every call is rejected with {@link CircuitOpenException} and the
 * wrapped call is never invoked. Interruption is not counted as a failure.
 */
public class CircuitBreaker {

    /** Notified after every state change, outside the breaker's lock. */
    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(String operation, CircuitState from, CircuitState to);

        TransitionListener NONE = (operation, from, to) -> {};
    }

    public record Settings(int failureThreshold, int successThreshold, Duration openDuration) {
        public Settings {
            if (failureThreshold < 1 || successThreshold < 1) {
                throw new IllegalArgumentException("thresholds must be >= 1");
            }
            if (openDuration == null || openDuration.isNegative()) {
                throw new IllegalArgumentException("openDuration must be >= 0");
            }
        }
    }

    private final String             operation;
    private final Settings           settings;
    private final Clock              clock;
    private final TransitionListener listener;

    private CircuitState state = CircuitState.CLOSED;
    private int          consecutiveFailures;
    private int          consecutiveSuccesses;
    private Instant      reopenAt;

    public CircuitBreaker(String operation, Settings settings, Clock clock, TransitionListener listener) {
        this.operation = operation;
        this.settings  = settings;
        this.clock     = clock;
        this.listener  = listener;
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    public <T> T execute(GuardedCall<T> call) throws InterruptedException {
        admit();
        T result;
        try {
            result = call.call();
        } catch (InterruptedException e) {
            throw e;
        } catch (RuntimeException | Error e) {
            recordFailure();
            throw e;
        }
        recordSuccess();
        return result;
    }

    /**
     * Throws {@link CircuitOpenException} if the breaker is open, moving it to
     * HALF_OPEN first when the open window has elapsed.
     */
    void admit() {
        CircuitState from = null;
        synchronized (this) {
            if (state == CircuitState.OPEN) {
                Instant now = clock.instant();
                if (now.isBefore(reopenAt)) {
                    throw new CircuitOpenException(operation, reopenAt, Duration.between(now, reopenAt));
                }
                from = moveTo(CircuitState.HALF_OPEN);
            }
        }
        notifyIfChanged(from, CircuitState.HALF_OPEN);
    }

    void recordSuccess() {
        CircuitState from = null;
        synchronized (this) {
            consecutiveFailures = 0;
            if (state == CircuitState.HALF_OPEN) {
                consecutiveSuccesses++;
                if (consecutiveSuccesses >= settings.successThreshold()) {
                    from = moveTo(CircuitState.CLOSED);
                }
            }
        }
        notifyIfChanged(from, CircuitState.CLOSED);
    }

    void recordFailure() {
        CircuitState from = null;
        synchronized (this) {
            consecutiveSuccesses = 0;
            consecutiveFailures++;
            if (state == CircuitState.HALF_OPEN
                    || (state == CircuitState.CLOSED && consecutiveFailures >= settings.failureThreshold())) {
                from = moveTo(CircuitState.OPEN);
            }
        }
        notifyIfChanged(from, CircuitState.OPEN);
    }

    // ------------------------------------------------------------------
    // Operator controls
    // ------------------------------------------------------------------

    /** Forces the breaker open for a full open window, regardless of counts. */
    public void trip() {
        CircuitState from;
        synchronized (this) {
            from = state == CircuitState.OPEN ? null : moveTo(CircuitState.OPEN);
            reopenAt = clock.instant().plus(settings.openDuration());
        }
        notifyIfChanged(from, CircuitState.OPEN);
    }

    public void reset() {
        CircuitState from;
        synchronized (this) {
            from = state == CircuitState.CLOSED ? null : moveTo(CircuitState.CLOSED);
            consecutiveFailures  = 0;
            consecutiveSuccesses = 0;
        }
        notifyIfChanged(from, CircuitState.CLOSED);
    }

    public synchronized CircuitSnapshot snapshot() {
        return new CircuitSnapshot(operation, state, consecutiveFailures, consecutiveSuccesses,
                state == CircuitState.OPEN ? reopenAt : null);
    }

    public synchronized CircuitState getState() { return state; }
    public String getOperation()                { return operation; }

    // ------------------------------------------------------------------
    // Internals (callers hold the lock)
    // ------------------------------------------------------------------

    private CircuitState moveTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        switch (next) {
            case OPEN -> {
                reopenAt = clock.instant().plus(settings.openDuration());
                consecutiveSuccesses = 0;
            }
            case HALF_OPEN -> consecutiveSuccesses = 0;
            case CLOSED -> {
                consecutiveFailures  = 0;
                consecutiveSuccesses = 0;
                reopenAt = null;
            }
        }
        return previous;
    }

    private void notifyIfChanged(CircuitState from, CircuitState to) {
        if (from != null && from != to) {
            listener.onTransition(operation, from, to);
        }
    }
}
