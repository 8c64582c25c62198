package fr.lapetina.lex.core.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.lex.core.infrastructure.http.CircuitBreaker;
import fr.lapetina.lex.core.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;
import java.util.regex.Pattern;

/**
 * Two-level response cache: an optional primary cache service backed by an
 * in-process {@link FallbackCache}.
 *
 * <p>Lookups go to the primary while its circuit breaker allows, and fall back
 * to the in-process map on a primary miss or failure. Primary failures are
 * never surfaced to callers: they are logged once per outage, counted, and
 * the breaker keeps the primary out of the path until its retry interval has
 * elapsed. Writes go to the primary when it is usable, otherwise to the
 * fallback.
 *
 * <p>Values are stored as JSON, so any Jackson-serializable type can be cached.
 * Safe for concurrent use without external locking.
 */
public final class ResponseCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    static final double SECONDS_SAVED_PER_HIT = 2.0;
    static final int MAX_PROMPT_KEY_LENGTH = 1000;

    private final RemoteCacheStore primary;
    private final CircuitBreaker primaryBreaker;
    private final FallbackCache fallback;
    private final CacheKeyGenerator keyGenerator;
    private final Map<CacheCategory, CategorySettings> settings;
    private final MetricsRegistry metricsRegistry;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean degraded = new AtomicBoolean(false);

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder sets = new LongAdder();
    private final LongAdder errors = new LongAdder();
    private final DoubleAdder costSaved = new DoubleAdder();
    private final Map<CacheCategory, LongAdder> hitsByCategory = new EnumMap<>(CacheCategory.class);

    private ResponseCache(Builder builder) {
        this.primary = builder.primary;
        this.keyGenerator = new CacheKeyGenerator(builder.namespace);
        this.metricsRegistry = builder.metricsRegistry;

        Map<CacheCategory, CategorySettings> resolved = new EnumMap<>(CacheCategory.class);
        for (CacheCategory category : CacheCategory.values()) {
            resolved.put(category, builder.settings.getOrDefault(category, category.defaults()));
            hitsByCategory.put(category, new LongAdder());
        }
        this.settings = resolved;
        this.fallback = new FallbackCache(resolved, builder.clock);
        this.primaryBreaker = new CircuitBreaker(
                "cache-primary",
                builder.primaryFailureThreshold,
                builder.primaryRetryInterval,
                builder.clock
        );

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        log.info("ResponseCache created: namespace={}, primary={}",
                builder.namespace, primary != null ? "configured" : "none");
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== CORE OPERATIONS ====================

    public <T> Optional<T> get(CacheCategory category, Object keyInputs, Class<T> type) {
        return get(category, keyInputs, objectMapper.constructType(type));
    }

    public <T> Optional<T> get(CacheCategory category, Object keyInputs, JavaType type) {
        String key = keyGenerator.key(category, keyInputs);
        String json = readPrimary(key);
        if (json == null) {
            json = fallback.get(category, key);
        }

        if (json != null) {
            try {
                T value = objectMapper.readValue(json, type);
                recordHit(category);
                log.debug("Cache hit: key={}", key);
                return Optional.of(value);
            } catch (JsonProcessingException e) {
                errors.increment();
                log.warn("Discarding unreadable cache entry: key={}, error={}", key, e.getOriginalMessage());
            }
        }

        misses.increment();
        if (metricsRegistry != null) {
            metricsRegistry.incrementCacheLookup(category.name(), false);
        }
        log.debug("Cache miss: key={}", key);
        return Optional.empty();
    }

    public void set(CacheCategory category, Object keyInputs, Object value) {
        Objects.requireNonNull(value, "Cached value must not be null");
        String key = keyGenerator.key(category, keyInputs);
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable: " + e.getOriginalMessage(), e);
        }

        if (!writePrimary(key, settings.get(category).ttl(), json)) {
            fallback.put(category, key, json);
        }
        sets.increment();
        log.debug("Cache set: key={}", key);
    }

    /**
     * Removes keys of the given category prefix (e.g. {@code model_responses}),
     * or every key in the namespace when the pattern is null.
     *
     * @return number of entries removed across both levels
     */
    public long invalidate(String pattern) {
        String glob = keyGenerator.glob(pattern);
        long removed = 0;

        if (primary != null && primaryBreaker.allowRequest()) {
            try {
                removed += primary.deleteMatching(glob);
                onPrimarySuccess();
            } catch (RuntimeException e) {
                onPrimaryFailure("invalidate", e);
            }
        }

        removed += pattern == null ? fallback.clear() : fallback.invalidate(globToRegex(glob));
        log.info("Cache invalidated: pattern={}, removed={}", glob, removed);
        return removed;
    }

    // ==================== CONVENIENCE ====================

    public void cacheModelResponse(String prompt, String model, Map<String, Object> context, Object response) {
        set(CacheCategory.MODEL_RESPONSE, modelResponseKey(prompt, model, context), response);
    }

    public <T> Optional<T> getCachedModelResponse(String prompt, String model, Map<String, Object> context,
                                                  Class<T> type) {
        return get(CacheCategory.MODEL_RESPONSE, modelResponseKey(prompt, model, context), type);
    }

    public void cacheUserSession(String sessionId, Map<String, Object> sessionData) {
        set(CacheCategory.USER_SESSION, Map.of("session_id", sessionId), sessionData);
    }

    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> getUserSession(String sessionId) {
        return get(CacheCategory.USER_SESSION, Map.of("session_id", sessionId), Map.class)
                .map(value -> (Map<String, Object>) value);
    }

    public void cacheEmbedding(String text, List<Double> embedding) {
        set(CacheCategory.EMBEDDING, Map.of("text", text), embedding);
    }

    public Optional<List<Double>> getCachedEmbedding(String text) {
        return get(CacheCategory.EMBEDDING, Map.of("text", text),
                objectMapper.getTypeFactory().constructCollectionType(List.class, Double.class));
    }

    /**
     * Key inputs for a model response. Prompts are truncated so that very long
     * prompts still hash from a bounded prefix.
     */
    public static Map<String, Object> modelResponseKey(String prompt, String model, Map<String, Object> context) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("prompt", truncate(prompt));
        inputs.put("model", model);
        inputs.put("context", context != null ? new TreeMap<>(context) : Map.of());
        return inputs;
    }

    // ==================== STATISTICS ====================

    public CacheStatistics statistics() {
        long hitCount = hits.sum();
        long missCount = misses.sum();
        long lookups = hitCount + missCount;
        double hitRate = lookups == 0 ? 0.0 : (hitCount * 100.0) / lookups;
        double timeSaved = hitCount * SECONDS_SAVED_PER_HIT;

        Map<String, Long> byCategory = new TreeMap<>();
        hitsByCategory.forEach((category, adder) -> byCategory.put(category.keyPrefix(), adder.sum()));

        return new CacheStatistics(
                hitCount,
                missCount,
                sets.sum(),
                errors.sum(),
                hitRate,
                costSaved.sum(),
                timeSaved,
                hitCount == 0 ? 0.0 : timeSaved / hitCount,
                fallback.size(),
                primary != null,
                degraded.get(),
                byCategory
        );
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    public CategorySettings settings(CacheCategory category) {
        return settings.get(category);
    }

    public int fallbackSize(CacheCategory category) {
        return fallback.size(category);
    }

    // ==================== INTERNALS ====================

    private String readPrimary(String key) {
        if (primary == null || !primaryBreaker.allowRequest()) {
            return null;
        }
        try {
            String json = primary.get(key);
            onPrimarySuccess();
            return json;
        } catch (RuntimeException e) {
            onPrimaryFailure("get", e);
            return null;
        }
    }

    private boolean writePrimary(String key, Duration ttl, String json) {
        if (primary == null || !primaryBreaker.allowRequest()) {
            return false;
        }
        try {
            primary.setex(key, ttl, json);
            onPrimarySuccess();
            return true;
        } catch (RuntimeException e) {
            onPrimaryFailure("set", e);
            return false;
        }
    }

    private void recordHit(CacheCategory category) {
        hits.increment();
        hitsByCategory.get(category).increment();
        costSaved.add(settings.get(category).costPerHit());
        if (metricsRegistry != null) {
            metricsRegistry.incrementCacheLookup(category.name(), true);
        }
    }

    private void onPrimarySuccess() {
        primaryBreaker.recordSuccess();
        if (degraded.compareAndSet(true, false)) {
            log.info("Primary cache recovered, leaving degraded mode");
        }
    }

    private void onPrimaryFailure(String operation, RuntimeException e) {
        primaryBreaker.recordFailure();
        errors.increment();
        if (metricsRegistry != null) {
            metricsRegistry.incrementCacheError(operation);
        }
        if (degraded.compareAndSet(false, true)) {
            log.warn("Primary cache unavailable, serving from in-process fallback: operation={}, error={}",
                    operation, e.getMessage());
        } else {
            log.debug("Primary cache still unavailable: operation={}, error={}", operation, e.getMessage());
        }
    }

    private static String truncate(String prompt) {
        if (prompt == null || prompt.length() <= MAX_PROMPT_KEY_LENGTH) {
            return prompt;
        }
        return prompt.substring(0, MAX_PROMPT_KEY_LENGTH);
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*':
                    regex.append(".*");
                    break;
                case '?':
                    regex.append('.');
                    break;
                default:
                    regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }

    @Override
    public void close() {
        if (primary != null) {
            try {
                primary.close();
            } catch (Exception e) {
                log.warn("Error closing primary cache", e);
            }
        }
    }

    public static final class Builder {
        private RemoteCacheStore primary;
        private String namespace = "lex";
        private final Map<CacheCategory, CategorySettings> settings = new EnumMap<>(CacheCategory.class);
        private int primaryFailureThreshold = 3;
        private Duration primaryRetryInterval = Duration.ofSeconds(30);
        private MetricsRegistry metricsRegistry;
        private Clock clock = Clock.systemUTC();

        public Builder primary(RemoteCacheStore primary) {
            this.primary = primary;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder category(CacheCategory category, CategorySettings categorySettings) {
            this.settings.put(category, categorySettings);
            return this;
        }

        public Builder primaryFailureThreshold(int threshold) {
            this.primaryFailureThreshold = threshold;
            return this;
        }

        public Builder primaryRetryInterval(Duration interval) {
            this.primaryRetryInterval = interval;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ResponseCache build() {
            Objects.requireNonNull(namespace, "Namespace is required");
            return new ResponseCache(this);
        }
    }
}
