package fr.lapetina.lex.core.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.lex.core.domain.model.ExecutionTier;
import fr.lapetina.lex.core.optimizer.DownstreamException;
import fr.lapetina.lex.core.optimizer.DownstreamModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Downstream model backed by an Ollama server's {@code /api/generate} endpoint.
 *
 * Each tier maps to a model name. Server errors, timeouts and I/O failures are
 * reported as retryable; 4xx responses are not.
 */
public final class OllamaModelClient implements DownstreamModel {

    private static final Logger log = LoggerFactory.getLogger(OllamaModelClient.class);

    static final String OPTIONS_KEY = "options";

    private final URI generateUri;
    private final Map<ExecutionTier, String> models;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OllamaModelClient(String baseUrl, Map<ExecutionTier, String> models,
                             Duration connectTimeout, Duration requestTimeout) {
        Objects.requireNonNull(baseUrl, "Base URL is required");
        String base = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        this.generateUri = URI.create(base + "api/generate");
        this.models = new EnumMap<>(models);
        for (ExecutionTier tier : ExecutionTier.values()) {
            if (!this.models.containsKey(tier)) {
                throw new IllegalArgumentException("No model configured for tier " + tier);
            }
        }
        this.requestTimeout = requestTimeout;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        log.info("OllamaModelClient created: uri={}, models={}", generateUri, this.models);
    }

    @Override
    public String generate(String prompt, ExecutionTier tier, Map<String, Object> context) {
        String model = models.get(tier);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(generateUri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(buildBody(model, prompt, context)))
                .build();

        Instant start = Instant.now();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            log.warn("Generation timed out: model={}, tier={}", model, tier);
            throw new DownstreamException("Model call timed out: " + model, true, e);
        } catch (IOException e) {
            log.warn("Generation I/O error: model={}, tier={}, error={}", model, tier, e.getMessage());
            throw new DownstreamException("Model call failed: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownstreamException("Model call interrupted", false, e);
        }

        long latencyMs = Duration.between(start, Instant.now()).toMillis();
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            log.debug("Generation succeeded: model={}, tier={}, latencyMs={}", model, tier, latencyMs);
            return parseText(response.body());
        }

        String message = "HTTP " + status + ": " + errorMessage(response.body());
        log.warn("Generation failed: model={}, tier={}, status={}, latencyMs={}", model, tier, status, latencyMs);
        throw new DownstreamException(message, status >= 500 || status == 429);
    }

    public String modelFor(ExecutionTier tier) {
        return models.get(tier);
    }

    private String buildBody(String model, String prompt, Map<String, Object> context) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("prompt", prompt);
        body.put("stream", false);
        Object options = context != null ? context.get(OPTIONS_KEY) : null;
        if (options instanceof Map) {
            body.put(OPTIONS_KEY, options);
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new DownstreamException("Request body not serializable: " + e.getOriginalMessage(), false, e);
        }
    }

    private String parseText(String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode text = node.get("response");
            if (text == null || text.isNull()) {
                throw new DownstreamException("Response has no 'response' field", false);
            }
            return text.asText();
        } catch (JsonProcessingException e) {
            throw new DownstreamException("Unparseable model response: " + e.getOriginalMessage(), false, e);
        }
    }

    private String errorMessage(String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode error = node != null ? node.get("error") : null;
            return error != null ? error.asText() : body;
        } catch (JsonProcessingException e) {
            return body;
        }
    }
}
