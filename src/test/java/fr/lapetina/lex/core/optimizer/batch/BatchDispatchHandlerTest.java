package fr.lapetina.lex.core.optimizer.batch;

import fr.lapetina.lex.core.domain.model.ExecutionTier;
import fr.lapetina.lex.core.optimizer.DownstreamModel;
import fr.lapetina.lex.core.optimizer.GenerationRequest;
import fr.lapetina.lex.core.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class BatchDispatchHandlerTest {

    private MutableClock clock;
    private BatchDispatchHandler handler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        DownstreamModel model = (prompt, tier, context) -> prompt.toUpperCase();
        handler = new BatchDispatchHandler(model, 3, Duration.ofSeconds(2), Duration.ofMillis(500), clock);
    }

    private CompletableFuture<String> publish(String prompt, Instant deadline) {
        CompletableFuture<String> future = new CompletableFuture<>();
        BatchEvent event = new BatchEvent();
        event.initialize(new GenerationRequest(prompt, ExecutionTier.BALANCED, Map.of()),
                clock.instant(), deadline, future);
        handler.onEvent(event, 0, true);
        return future;
    }

    @Test
    @DisplayName("should hold items until a flush condition holds")
    void shouldBuffer() {
        CompletableFuture<String> a = publish("a", null);
        CompletableFuture<String> b = publish("b", null);

        assertThat(a).isNotDone();
        assertThat(b).isNotDone();

        publish("c", null);

        assertThat(a).isCompletedWithValue("A");
        assertThat(handler.getBatchesDispatched()).isEqualTo(1);
        assertThat(handler.getItemsDispatched()).isEqualTo(3);
    }

    @Test
    @DisplayName("should flush on idle timeout once the oldest item waited long enough")
    void shouldFlushOnTimeout() {
        CompletableFuture<String> a = publish("a", null);

        clock.advance(Duration.ofSeconds(1));
        handler.onTimeout(0);
        assertThat(a).isNotDone();

        clock.advance(Duration.ofSeconds(1));
        handler.onTimeout(0);
        assertThat(a).isCompletedWithValue("A");
    }

    @Test
    @DisplayName("should be due when a deadline enters the safety margin")
    void shouldHonorDeadlineMargin() {
        CompletableFuture<String> a = publish("a", clock.instant().plusSeconds(1));

        assertThat(handler.isDue(clock.instant())).isFalse();
        assertThat(handler.isDue(clock.instant().plusMillis(500))).isTrue();

        clock.advance(Duration.ofMillis(600));
        handler.onTimeout(0);
        assertThat(a).isCompletedWithValue("A");
    }

    @Test
    @DisplayName("should flush leftovers on shutdown")
    void shouldFlushOnShutdown() {
        CompletableFuture<String> a = publish("a", null);

        handler.onShutdown();

        assertThat(a).isCompletedWithValue("A");
        assertThat(handler.isDue(clock.instant())).isFalse();
    }

    @Test
    @DisplayName("should fail the batch when the result count does not match")
    void shouldFailOnCountMismatch() {
        DownstreamModel broken = new DownstreamModel() {
            @Override
            public String generate(String prompt, ExecutionTier tier, Map<String, Object> context) {
                return prompt;
            }

            @Override
            public List<String> generateBatch(List<GenerationRequest> requests) {
                return List.of("only one");
            }
        };
        handler = new BatchDispatchHandler(broken, 2, Duration.ofSeconds(2), Duration.ofMillis(500), clock);

        CompletableFuture<String> a = publish("a", null);
        CompletableFuture<String> b = publish("b", null);

        assertThat(a).isCompletedExceptionally();
        assertThat(b).isCompletedExceptionally();
    }
}
