package com.patchpilot.orchestrator.resilience;

import com.patchpilot.orchestrator.config.PatchPilotProperties;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One independent {@link CircuitBreaker} per operation key, created on first use.
 *
 * Every state change is logged and counted:
 * <pre>
 *   patchpilot.circuit.transitions{operation, to="closed|open|half_open"}
 * </pre>
 */
@Component
public class CircuitBreakerRegistry {

    public static final String AI_INVOKE  = "ai-invoke";
    public static final String CI_STATUS  = "ci-status";
    public static final String PR_CREATE  = "pr-create";
    public static final String ISSUE_LIST = "issue-list";

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreaker.Settings     settings;
    private final Clock                       clock;
    private final MeterRegistry               meterRegistry;

    @Autowired
    public CircuitBreakerRegistry(PatchPilotProperties props, Clock clock, MeterRegistry meterRegistry) {
        this(new CircuitBreaker.Settings(
                        props.circuitBreaker().failureThreshold(),
                        props.circuitBreaker().successThreshold(),
                        Duration.ofMillis(props.circuitBreaker().openDurationMs())),
                clock, meterRegistry);
    }

    public CircuitBreakerRegistry(CircuitBreaker.Settings settings, Clock clock, MeterRegistry meterRegistry) {
        this.settings      = settings;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
    }

    public CircuitBreaker get(String operation) {
        return breakers.computeIfAbsent(operation,
                key -> new CircuitBreaker(key, settings, clock, this::onTransition));
    }

    public <T> T execute(String operation, GuardedCall<T> call) throws InterruptedException {
        return get(operation).execute(call);
    }

    // ------------------------------------------------------------------
    // Operator controls
    // ------------------------------------------------------------------

    public List<CircuitSnapshot> status() {
        return breakers.values().stream()
                .map(CircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitSnapshot::operation))
                .toList();
    }

    public void reset(String operation) {
        CircuitBreaker breaker = breakers.get(operation);
        if (breaker == null) {
            throw new NoSuchElementException("No circuit breaker for operation '" + operation + "'");
        }
        breaker.reset();
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }

    public void trip(String operation) {
        get(operation).trip();
    }

    private void onTransition(String operation, CircuitState from, CircuitState to) {
        if (to == CircuitState.OPEN) {
            log.warn("Circuit '{}' opened (was {}), rejecting calls for {} ms",
                    operation, from, settings.openDuration().toMillis());
        } else {
            log.info("Circuit '{}' {} -> {}", operation, from, to);
        }
        meterRegistry.counter("patchpilot.circuit.transitions",
                "operation", operation, "to", to.name().toLowerCase()).increment();
    }
}
