package fr.lapetina.lex.core.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Circuit breaker guarding a downstream target (a request type, or the primary cache).
 *
 * States:
 * - CLOSED: Normal operation, calls pass through
 * - OPEN: Failures reached the threshold, calls rejected until the recovery timeout elapses
 * - HALF_OPEN: Recovery timeout elapsed, exactly one probe call is let through
 *
 * A successful probe closes the circuit, a failed one reopens it.
 * All state changes happen under a single lock.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private static final Duration MIN_RETRY_DELAY = Duration.ofMillis(50);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    /**
     * Outcome of {@link #tryAcquire()}.
     */
    public enum Permit {
        /** Circuit closed, call allowed */
        ADMITTED,
        /** Circuit half-open, caller holds the single probe */
        PROBE,
        /** Circuit open or probe already taken */
        REJECTED
    }

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private State state = State.CLOSED;
    private int failureCount;
    private boolean probeInFlight;
    private Instant openedAt;
    private Instant lastFailureTime;

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
    }

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout) {
        this(name, failureThreshold, recoveryTimeout, Clock.systemUTC());
    }

    public CircuitBreaker(String name) {
        this(name, 5, Duration.ofSeconds(60));
    }

    /**
     * Asks to let one call through.
     */
    public Permit tryAcquire() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return Permit.ADMITTED;

                case OPEN:
                    if (!recoveryElapsed()) {
                        return Permit.REJECTED;
                    }
                    state = State.HALF_OPEN;
                    probeInFlight = true;
                    log.info("Circuit breaker HALF_OPEN, probe admitted: name={}", name);
                    return Permit.PROBE;

                case HALF_OPEN:
                    if (probeInFlight) {
                        return Permit.REJECTED;
                    }
                    probeInFlight = true;
                    return Permit.PROBE;

                default:
                    return Permit.REJECTED;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns true if a call may proceed. Claims the probe when half-open.
     */
    public boolean allowRequest() {
        return tryAcquire() != Permit.REJECTED;
    }

    /**
     * Gives back a probe that was claimed but never dispatched.
     */
    public void releaseProbe() {
        lock.lock();
        try {
            if (state == State.HALF_OPEN) {
                probeInFlight = false;
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordSuccess() {
        lock.lock();
        try {
            failureCount = 0;
            probeInFlight = false;
            if (state != State.CLOSED) {
                log.info("Circuit breaker CLOSED after recovery: name={}", name);
                state = State.CLOSED;
                openedAt = null;
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordFailure() {
        lock.lock();
        try {
            Instant now = clock.instant();
            lastFailureTime = now;

            if (state == State.HALF_OPEN) {
                state = State.OPEN;
                openedAt = now;
                probeInFlight = false;
                log.warn("Circuit breaker OPENED (probe failed): name={}", name);
                return;
            }

            if (state == State.CLOSED) {
                failureCount++;
                if (failureCount >= failureThreshold) {
                    state = State.OPEN;
                    openedAt = now;
                    log.warn("Circuit breaker OPENED: name={}, failures={}", name, failureCount);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forces the circuit to a specific state. For testing/admin use.
     */
    public void forceState(State newState) {
        lock.lock();
        try {
            State old = state;
            state = newState;
            probeInFlight = false;
            if (newState == State.CLOSED) {
                failureCount = 0;
                openedAt = null;
            }
            if (newState == State.OPEN) {
                openedAt = clock.instant();
            }
            log.info("Circuit breaker forced from {} to {}: name={}", old, newState, name);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current state. An open circuit whose recovery timeout has elapsed reports HALF_OPEN
     * without claiming the probe.
     */
    public State getState() {
        lock.lock();
        try {
            if (state == State.OPEN && recoveryElapsed()) {
                return State.HALF_OPEN;
            }
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * How long a rejected caller should wait before asking again.
     */
    public Duration timeUntilRetry() {
        lock.lock();
        try {
            if (state != State.OPEN || openedAt == null) {
                return MIN_RETRY_DELAY;
            }
            Duration left = Duration.between(clock.instant(), openedAt.plus(recoveryTimeout));
            return left.compareTo(MIN_RETRY_DELAY) < 0 ? MIN_RETRY_DELAY : left;
        } finally {
            lock.unlock();
        }
    }

    public int getFailureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    public Instant getLastFailureTime() {
        lock.lock();
        try {
            return lastFailureTime;
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    private boolean recoveryElapsed() {
        return openedAt == null || !clock.instant().isBefore(openedAt.plus(recoveryTimeout));
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "name='" + name + '\'' +
                ", state=" + getState() +
                ", failures=" + getFailureCount() +
                '}';
    }
}
