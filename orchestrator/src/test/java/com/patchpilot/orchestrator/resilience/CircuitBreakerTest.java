package com.patchpilot.orchestrator.resilience;

import com.patchpilot.orchestrator.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    MutableClock clock = MutableClock.at("2026-03-01T10:00:00Z");
    List<String> transitions = new ArrayList<>();
    CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        breaker = new CircuitBreaker("ai-invoke",
                new CircuitBreaker.Settings(3, 2, Duration.ofSeconds(30)), clock,
                (op, from, to) -> transitions.add(from + "->" + to));
    }

    @Test
    void opensAfterConsecutiveFailures_andRejectsWithoutInvoking() throws Exception {
        failTimes(3);
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);

        AtomicInteger invoked = new AtomicInteger();
        assertThatThrownBy(() -> breaker.execute(() -> invoked.incrementAndGet()))
                .isInstanceOf(CircuitOpenException.class)
                .satisfies(e -> assertThat(((CircuitOpenException) e).getRemaining())
                        .isEqualTo(Duration.ofSeconds(30)));
        assertThat(invoked).hasValue(0);
        assertThat(transitions).containsExactly("CLOSED->OPEN");
    }

    @Test
    void successResetsTheFailureCount() throws Exception {
        failTimes(2);
        breaker.execute(() -> "ok");
        failTimes(2);

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void halfOpenClosesAfterEnoughSuccesses() throws Exception {
        failTimes(3);
        clock.advance(Duration.ofSeconds(30));

        breaker.execute(() -> "probe");
        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
        breaker.execute(() -> "probe");

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(transitions).containsExactly("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED");
    }

    @Test
    void anyFailureInHalfOpenReopens() throws Exception {
        failTimes(3);
        clock.advance(Duration.ofSeconds(31));

        failTimes(1);

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.snapshot().reopenAt()).isEqualTo(clock.instant().plusSeconds(30));
    }

    @Test
    void interruptionIsNotCountedAsFailure() {
        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> breaker.execute(() -> { throw new InterruptedException(); }))
                    .isInstanceOf(InterruptedException.class);
        }
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void tripAndReset() {
        breaker.trip();
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);

        breaker.reset();
        assertThat(breaker.snapshot().consecutiveFailures()).isZero();
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void registry_keepsOneBreakerPerOperation() throws Exception {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(
                new CircuitBreaker.Settings(1, 1, Duration.ofSeconds(10)), clock, new SimpleMeterRegistry());

        assertThatThrownBy(() -> registry.execute(CircuitBreakerRegistry.CI_STATUS, () -> {
            throw new TransientException("boom");
        })).isInstanceOf(TransientException.class);

        assertThat(registry.get(CircuitBreakerRegistry.CI_STATUS).getState()).isEqualTo(CircuitState.OPEN);
        assertThat(registry.execute(CircuitBreakerRegistry.AI_INVOKE, () -> 42)).isEqualTo(42);
        assertThat(registry.status()).extracting(CircuitSnapshot::operation)
                .containsExactly(CircuitBreakerRegistry.AI_INVOKE, CircuitBreakerRegistry.CI_STATUS);

        registry.resetAll();
        assertThat(registry.get(CircuitBreakerRegistry.CI_STATUS).getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void registry_resetOfUnknownOperationFails() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(
                new CircuitBreaker.Settings(1, 1, Duration.ofSeconds(10)), clock, new SimpleMeterRegistry());

        assertThatThrownBy(() -> registry.reset("nope"))
                .isInstanceOf(NoSuchElementException.class);
    }

    private void failTimes(int n) {
        for (int i = 0; i < n; i++) {
            assertThatThrownBy(() -> breaker.execute(() -> {
                throw new TransientException("down");
            })).isInstanceOf(TransientException.class);
        }
    }
}
