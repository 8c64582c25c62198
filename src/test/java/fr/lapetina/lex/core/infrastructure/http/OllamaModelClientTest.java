package fr.lapetina.lex.core.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.lex.core.domain.model.ExecutionTier;
import fr.lapetina.lex.core.optimizer.DownstreamException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OllamaModelClientTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private HttpServer server;
    private OllamaModelClient client;

    private volatile int status = 200;
    private volatile String responseBody = "{\"response\":\"Paris\",\"done\":true}";
    private volatile long delayMillis;
    private volatile String lastRequestBody;
    private volatile String lastPath;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            lastPath = exchange.getRequestURI().getPath();
            lastRequestBody = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            if (delayMillis > 0) {
                try {
                    Thread.sleep(delayMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();

        client = new OllamaModelClient("http://127.0.0.1:" + server.getAddress().getPort(), models(),
                Duration.ofSeconds(2), Duration.ofMillis(500));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private static Map<ExecutionTier, String> models() {
        Map<ExecutionTier, String> models = new EnumMap<>(ExecutionTier.class);
        models.put(ExecutionTier.FAST, "llama3.2:1b");
        models.put(ExecutionTier.BALANCED, "llama3.1:8b");
        models.put(ExecutionTier.PREMIUM, "llama3.1:70b");
        return models;
    }

    @Test
    @DisplayName("should post a non-streaming generate call for the tier's model")
    void shouldGenerate() throws IOException {
        String text = client.generate("Capital of France?", ExecutionTier.BALANCED,
                Map.of("options", Map.of("temperature", 0.2), "priority", "speed"));

        assertThat(text).isEqualTo("Paris");
        assertThat(lastPath).isEqualTo("/api/generate");
        JsonNode body = mapper.readTree(lastRequestBody);
        assertThat(body.get("model").asText()).isEqualTo("llama3.1:8b");
        assertThat(body.get("prompt").asText()).isEqualTo("Capital of France?");
        assertThat(body.get("stream").asBoolean()).isFalse();
        assertThat(body.get("options").get("temperature").asDouble()).isEqualTo(0.2);
        assertThat(body.has("priority")).isFalse();
    }

    @Test
    @DisplayName("should report server errors as retryable")
    void shouldRetryServerErrors() {
        status = 503;
        responseBody = "{\"error\":\"model is loading\"}";

        assertThatThrownBy(() -> client.generate("q", ExecutionTier.FAST, Map.of()))
                .isInstanceOfSatisfying(DownstreamException.class, e -> {
                    assertThat(e.isRetryable()).isTrue();
                    assertThat(e.getMessage()).isEqualTo("HTTP 503: model is loading");
                });
    }

    @Test
    @DisplayName("should report throttling as retryable")
    void shouldRetryThrottling() {
        status = 429;
        responseBody = "slow down";

        assertThatThrownBy(() -> client.generate("q", ExecutionTier.FAST, Map.of()))
                .isInstanceOfSatisfying(DownstreamException.class, e -> assertThat(e.isRetryable()).isTrue());
    }

    @Test
    @DisplayName("should report client errors as fatal")
    void shouldFailClientErrors() {
        status = 404;
        responseBody = "{\"error\":\"model 'llama3.2:1b' not found\"}";

        assertThatThrownBy(() -> client.generate("q", ExecutionTier.FAST, Map.of()))
                .isInstanceOfSatisfying(DownstreamException.class, e -> {
                    assertThat(e.isRetryable()).isFalse();
                    assertThat(e.getMessage()).contains("not found");
                });
    }

    @Test
    @DisplayName("should report a slow server as a retryable timeout")
    void shouldTimeOut() {
        delayMillis = 1_500;

        assertThatThrownBy(() -> client.generate("q", ExecutionTier.FAST, Map.of()))
                .isInstanceOfSatisfying(DownstreamException.class, e -> {
                    assertThat(e.isRetryable()).isTrue();
                    assertThat(e.getMessage()).contains("timed out");
                });
    }

    @Test
    @DisplayName("should reject a body without a response field")
    void shouldRejectMissingResponse() {
        responseBody = "{\"done\":true}";

        assertThatThrownBy(() -> client.generate("q", ExecutionTier.FAST, Map.of()))
                .isInstanceOfSatisfying(DownstreamException.class, e -> assertThat(e.isRetryable()).isFalse());
    }

    @Test
    @DisplayName("should report an unreachable server as retryable")
    void shouldRetryConnectionFailure() {
        server.stop(0);

        assertThatThrownBy(() -> client.generate("q", ExecutionTier.FAST, Map.of()))
                .isInstanceOfSatisfying(DownstreamException.class, e -> assertThat(e.isRetryable()).isTrue());
    }

    @Test
    @DisplayName("should require a model for every tier")
    void shouldRequireEveryTier() {
        Map<ExecutionTier, String> partial = new EnumMap<>(ExecutionTier.class);
        partial.put(ExecutionTier.FAST, "small");

        assertThatThrownBy(() -> new OllamaModelClient("http://localhost:11434", partial,
                Duration.ofSeconds(1), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(client.modelFor(ExecutionTier.PREMIUM)).isEqualTo("llama3.1:70b");
    }
}
