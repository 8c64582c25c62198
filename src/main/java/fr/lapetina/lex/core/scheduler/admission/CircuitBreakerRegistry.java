package fr.lapetina.lex.core.scheduler.admission;

import fr.lapetina.lex.core.infrastructure.http.CircuitBreaker;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One circuit breaker per request type, created on first use.
 */
public final class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    public CircuitBreakerRegistry(int failureThreshold, Duration recoveryTimeout, Clock clock) {
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
    }

    public CircuitBreakerRegistry(int failureThreshold, Duration recoveryTimeout) {
        this(failureThreshold, recoveryTimeout, Clock.systemUTC());
    }

    public CircuitBreaker forType(String requestType) {
        return breakers.computeIfAbsent(requestType,
                type -> new CircuitBreaker(type, failureThreshold, recoveryTimeout, clock));
    }

    public int openCount() {
        int open = 0;
        for (CircuitBreaker breaker : breakers.values()) {
            if (breaker.getState() != CircuitBreaker.State.CLOSED) {
                open++;
            }
        }
        return open;
    }

    /**
     * Request type to state, sorted by type.
     */
    public Map<String, String> states() {
        Map<String, String> states = new TreeMap<>();
        breakers.forEach((type, breaker) -> states.put(type, breaker.getState().name()));
        return states;
    }
}
