package com.patchpilot.orchestrator.resilience;

import com.patchpilot.orchestrator.support.MutableClock;
import com.patchpilot.orchestrator.support.RecordingSleeper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GuardedCallsTest {

    MutableClock             clock    = MutableClock.at("2026-03-01T10:00:00Z");
    RecordingSleeper         sleeper  = new RecordingSleeper();
    SimpleMeterRegistry      registry = new SimpleMeterRegistry();
    ScheduledExecutorService scheduler;
    CircuitBreakerRegistry   breakers;
    GuardedCalls             calls;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        breakers  = new CircuitBreakerRegistry(
                new CircuitBreaker.Settings(2, 1, Duration.ofMinutes(1)), clock, registry);
        RetryPolicy retry = new RetryPolicy(
                new RetryPolicy.Settings(2, Duration.ofMillis(10), Duration.ofMillis(100), false), sleeper);
        calls = new GuardedCalls(breakers, retry, scheduler, clock, registry);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void retriesInsideTheBreaker_soOneExhaustedSeriesIsOneFailure() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> calls.call("ci-status", () -> {
            attempts.incrementAndGet();
            throw new TransientException("503");
        })).isInstanceOf(TransientException.class);

        assertThat(attempts).hasValue(3);
        assertThat(breakers.get("ci-status").snapshot().consecutiveFailures()).isEqualTo(1);
        assertThat(registry.counter("patchpilot.retry.attempts", "operation", "ci-status").count())
                .isEqualTo(2.0);
    }

    @Test
    void openCircuitIsNotRetried() {
        breakers.trip("pr-create");
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> calls.call("pr-create", attempts::incrementAndGet))
                .isInstanceOf(CircuitOpenException.class);

        assertThat(attempts).hasValue(0);
        assertThat(sleeper.sleeps()).isEmpty();
        assertThat(registry.timer("patchpilot.external.duration",
                "operation", "pr-create", "outcome", "circuit_open").count()).isEqualTo(1);
    }

    @Test
    void supervised_successfulCallIsTimed() throws Exception {
        String out = calls.supervised("ai-invoke", Duration.ofSeconds(30), ctx -> {}, Map.of(),
                wd -> {
                    wd.heartbeat();
                    return "done";
                });

        assertThat(out).isEqualTo("done");
        assertThat(registry.timer("patchpilot.external.duration",
                "operation", "ai-invoke", "outcome", "success").count()).isEqualTo(1);
    }

    @Test
    void callSpecificClassifierStopsRetriesItRejects() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> calls.call("pr-create", e -> e instanceof RateLimitedException, () -> {
            attempts.incrementAndGet();
            throw new TransientException("create pull request failed: HTTP 502");
        })).isInstanceOf(TransientException.class);

        assertThat(attempts).hasValue(1);
        assertThat(sleeper.sleeps()).isEmpty();
        assertThat(breakers.get("pr-create").snapshot().consecutiveFailures()).isEqualTo(1);
    }
}
