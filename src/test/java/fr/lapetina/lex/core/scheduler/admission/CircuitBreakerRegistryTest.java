package fr.lapetina.lex.core.scheduler.admission;

import fr.lapetina.lex.core.infrastructure.http.CircuitBreaker;
import fr.lapetina.lex.core.testing.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerRegistryTest {

    private final MutableClock clock = new MutableClock();
    private final CircuitBreakerRegistry registry = new CircuitBreakerRegistry(2, Duration.ofSeconds(30), clock);

    @Test
    @DisplayName("should return the same breaker for a request type")
    void shouldReuseBreakerPerType() {
        assertThat(registry.forType("chat")).isSameAs(registry.forType("chat"));
        assertThat(registry.forType("chat")).isNotSameAs(registry.forType("embed"));
    }

    @Test
    @DisplayName("should isolate failures per request type")
    void shouldIsolateTypes() {
        registry.forType("chat").recordFailure();
        registry.forType("chat").recordFailure();

        assertThat(registry.forType("chat").getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(registry.forType("embed").getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(registry.openCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should report states sorted by type")
    void shouldReportStates() {
        registry.forType("summarize");
        registry.forType("chat").forceState(CircuitBreaker.State.OPEN);

        assertThat(registry.states()).containsExactly(
                java.util.Map.entry("chat", "OPEN"),
                java.util.Map.entry("summarize", "CLOSED"));
    }
}
