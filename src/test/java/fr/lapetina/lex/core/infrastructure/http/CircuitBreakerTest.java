package fr.lapetina.lex.core.infrastructure.http;

import fr.lapetina.lex.core.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        // 3 failures, 100ms recovery
        clock = new MutableClock();
        circuitBreaker = new CircuitBreaker("chat", 3, Duration.ofMillis(100), clock);
    }

    private void tripOpen() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
    }

    @Test
    @DisplayName("should start in CLOSED state")
    void shouldStartClosed() {
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.tryAcquire()).isEqualTo(CircuitBreaker.Permit.ADMITTED);
    }

    @Test
    @DisplayName("should open after threshold failures")
    void shouldOpenAfterThresholdFailures() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);

        circuitBreaker.recordFailure(); // Third failure hits threshold

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.tryAcquire()).isEqualTo(CircuitBreaker.Permit.REJECTED);
    }

    @Test
    @DisplayName("should reset failure count on success")
    void shouldResetFailureCountOnSuccess() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        assertThat(circuitBreaker.getFailureCount()).isEqualTo(2);

        circuitBreaker.recordSuccess();

        assertThat(circuitBreaker.getFailureCount()).isZero();
    }

    @Test
    @DisplayName("should admit exactly one probe after recovery timeout")
    void shouldAdmitSingleProbe() {
        tripOpen();
        clock.advance(Duration.ofMillis(150));

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        assertThat(circuitBreaker.tryAcquire()).isEqualTo(CircuitBreaker.Permit.PROBE);
        assertThat(circuitBreaker.tryAcquire()).isEqualTo(CircuitBreaker.Permit.REJECTED);
    }

    @Test
    @DisplayName("should close when the probe succeeds")
    void shouldCloseAfterProbeSuccess() {
        tripOpen();
        clock.advance(Duration.ofMillis(150));
        circuitBreaker.tryAcquire();

        circuitBreaker.recordSuccess();

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.tryAcquire()).isEqualTo(CircuitBreaker.Permit.ADMITTED);
    }

    @Test
    @DisplayName("should reopen when the probe fails")
    void shouldReopenOnProbeFailure() {
        tripOpen();
        clock.advance(Duration.ofMillis(150));
        circuitBreaker.tryAcquire();

        circuitBreaker.recordFailure();

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.tryAcquire()).isEqualTo(CircuitBreaker.Permit.REJECTED);
    }

    @Test
    @DisplayName("should hand the probe to another caller once released")
    void shouldReissueReleasedProbe() {
        tripOpen();
        clock.advance(Duration.ofMillis(150));
        assertThat(circuitBreaker.tryAcquire()).isEqualTo(CircuitBreaker.Permit.PROBE);

        circuitBreaker.releaseProbe();

        assertThat(circuitBreaker.tryAcquire()).isEqualTo(CircuitBreaker.Permit.PROBE);
    }

    @Test
    @DisplayName("should report time until retry while open")
    void shouldReportTimeUntilRetry() {
        circuitBreaker = new CircuitBreaker("chat", 1, Duration.ofSeconds(10), clock);
        circuitBreaker.recordFailure();
        clock.advance(Duration.ofSeconds(4));

        assertThat(circuitBreaker.timeUntilRetry()).isEqualTo(Duration.ofSeconds(6));
    }

    @Test
    @DisplayName("should allow forcing state")
    void shouldAllowForcingState() {
        circuitBreaker.forceState(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);

        circuitBreaker.forceState(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getFailureCount()).isZero();
    }
}
