package fr.lapetina.lex.core.infrastructure.cache;

import fr.lapetina.lex.core.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ResponseCacheTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
    }

    @Nested
    @DisplayName("Without a primary")
    class WithoutPrimary {

        private ResponseCache cache;

        @BeforeEach
        void setUp() {
            cache = ResponseCache.builder()
                    .namespace("test")
                    .category(CacheCategory.MODEL_RESPONSE, new CategorySettings(Duration.ofSeconds(10), 2, 0.02))
                    .clock(clock)
                    .build();
        }

        @Test
        @DisplayName("should return what was stored")
        void shouldRoundTrip() {
            cache.cacheModelResponse("What is Java?", "fast", Map.of(), Map.of("text", "A language"));

            Map<?, ?> cached = cache.getCachedModelResponse("What is Java?", "fast", Map.of(), Map.class)
                    .orElseThrow();

            assertThat(cached.get("text")).isEqualTo("A language");
            assertThat(cache.statistics().hits()).isEqualTo(1);
            assertThat(cache.statistics().primaryConfigured()).isFalse();
        }

        @Test
        @DisplayName("should match regardless of context insertion order")
        void shouldIgnoreContextOrder() {
            Map<String, Object> ctx1 = new LinkedHashMap<>();
            ctx1.put("lang", "en");
            ctx1.put("tone", "formal");
            Map<String, Object> ctx2 = new LinkedHashMap<>();
            ctx2.put("tone", "formal");
            ctx2.put("lang", "en");

            cache.cacheModelResponse("hi", "fast", ctx1, "hello");

            assertThat(cache.getCachedModelResponse("hi", "fast", ctx2, String.class)).contains("hello");
            assertThat(cache.getCachedModelResponse("hi", "premium", ctx2, String.class)).isEmpty();
        }

        @Test
        @DisplayName("should expire entries after their TTL")
        void shouldExpire() {
            cache.cacheModelResponse("q", "fast", null, "a");

            clock.advance(Duration.ofSeconds(11));

            assertThat(cache.getCachedModelResponse("q", "fast", null, String.class)).isEmpty();
            assertThat(cache.statistics().misses()).isEqualTo(1);
        }

        @Test
        @DisplayName("should evict the oldest entry past the category cap")
        void shouldEvictPastCap() {
            cache.cacheModelResponse("q1", "fast", null, "a1");
            cache.cacheModelResponse("q2", "fast", null, "a2");
            cache.cacheModelResponse("q3", "fast", null, "a3");

            assertThat(cache.fallbackSize(CacheCategory.MODEL_RESPONSE)).isEqualTo(2);
            assertThat(cache.getCachedModelResponse("q1", "fast", null, String.class)).isEmpty();
            assertThat(cache.getCachedModelResponse("q3", "fast", null, String.class)).contains("a3");
        }

        @Test
        @DisplayName("should treat long prompts sharing a prefix as the same key")
        void shouldTruncateLongPrompts() {
            String prefix = "x".repeat(ResponseCache.MAX_PROMPT_KEY_LENGTH);

            cache.cacheModelResponse(prefix + "tail-one", "fast", null, "same");

            assertThat(cache.getCachedModelResponse(prefix + "tail-two", "fast", null, String.class))
                    .contains("same");
        }

        @Test
        @DisplayName("should invalidate a single category")
        void shouldInvalidateCategory() {
            cache.cacheModelResponse("q", "fast", null, "a");
            cache.cacheUserSession("s1", Map.of("user", "u1"));

            long removed = cache.invalidate(CacheCategory.MODEL_RESPONSE.keyPrefix());

            assertThat(removed).isEqualTo(1);
            assertThat(cache.getCachedModelResponse("q", "fast", null, String.class)).isEmpty();
            assertThat(cache.getUserSession("s1")).hasValueSatisfying(s -> assertThat(s).containsEntry("user", "u1"));
        }

        @Test
        @DisplayName("should clear the whole namespace")
        void shouldClearNamespace() {
            cache.cacheModelResponse("q", "fast", null, "a");
            cache.cacheEmbedding("text", List.of(0.1, 0.2));

            assertThat(cache.invalidate(null)).isEqualTo(2);
            assertThat(cache.statistics().fallbackSize()).isZero();
        }

        @Test
        @DisplayName("should round-trip embeddings as doubles")
        void shouldRoundTripEmbeddings() {
            cache.cacheEmbedding("text", List.of(0.5, 1.0));

            assertThat(cache.getCachedEmbedding("text")).contains(List.of(0.5, 1.0));
        }

        @Test
        @DisplayName("should compute hit rate, cost and time saved")
        void shouldComputeStatistics() {
            cache.cacheModelResponse("q", "fast", null, "a");
            cache.getCachedModelResponse("q", "fast", null, String.class);
            cache.getCachedModelResponse("q", "fast", null, String.class);
            cache.getCachedModelResponse("other", "fast", null, String.class);
            cache.getCachedModelResponse("another", "fast", null, String.class);

            CacheStatistics stats = cache.statistics();

            assertThat(stats.hits()).isEqualTo(2);
            assertThat(stats.misses()).isEqualTo(2);
            assertThat(stats.sets()).isEqualTo(1);
            assertThat(stats.hitRatePercent()).isCloseTo(50.0, within(0.001));
            assertThat(stats.costSaved()).isCloseTo(0.04, within(0.0001));
            assertThat(stats.timeSavedSeconds()).isCloseTo(4.0, within(0.001));
            assertThat(stats.hitsByCategory()).containsEntry("model_responses", 2L);
        }
    }

    @Nested
    @DisplayName("With a primary")
    class WithPrimary {

        private StubStore store;
        private ResponseCache cache;

        @BeforeEach
        void setUp() {
            store = new StubStore();
            cache = ResponseCache.builder()
                    .primary(store)
                    .namespace("test")
                    .primaryFailureThreshold(2)
                    .primaryRetryInterval(Duration.ofSeconds(30))
                    .clock(clock)
                    .build();
        }

        @Test
        @DisplayName("should write through to the primary with the category TTL")
        void shouldWriteToPrimary() {
            cache.cacheModelResponse("q", "fast", null, "a");

            assertThat(store.data).hasSize(1);
            assertThat(store.data.keySet().iterator().next()).startsWith("test:model_responses:");
            assertThat(store.lastTtl).isEqualTo(CacheCategory.MODEL_RESPONSE.defaults().ttl());
            assertThat(cache.fallbackSize(CacheCategory.MODEL_RESPONSE)).isZero();
            assertThat(cache.getCachedModelResponse("q", "fast", null, String.class)).contains("a");
        }

        @Test
        @DisplayName("should serve from the fallback while the primary fails")
        void shouldDegradeToFallback() {
            store.failing = true;

            cache.cacheModelResponse("q", "fast", null, "a");
            assertThat(cache.isDegraded()).isTrue();
            assertThat(cache.fallbackSize(CacheCategory.MODEL_RESPONSE)).isEqualTo(1);

            assertThat(cache.getCachedModelResponse("q", "fast", null, String.class)).contains("a");
            assertThat(store.calls.get()).isEqualTo(2);

            // Breaker is now open, the primary is skipped
            assertThat(cache.getCachedModelResponse("q", "fast", null, String.class)).contains("a");
            assertThat(store.calls.get()).isEqualTo(2);

            CacheStatistics stats = cache.statistics();
            assertThat(stats.degraded()).isTrue();
            assertThat(stats.errors()).isEqualTo(2);
        }

        @Test
        @DisplayName("should leave degraded mode once the primary recovers")
        void shouldRecover() {
            store.failing = true;
            cache.cacheModelResponse("q", "fast", null, "a");
            cache.getCachedModelResponse("q", "fast", null, String.class);

            store.failing = false;
            clock.advance(Duration.ofSeconds(31));

            assertThat(cache.getCachedModelResponse("q", "fast", null, String.class)).contains("a");
            assertThat(cache.isDegraded()).isFalse();

            cache.cacheModelResponse("q2", "fast", null, "b");
            assertThat(store.data).hasSize(1);
        }

        @Test
        @DisplayName("should discard unreadable primary entries as misses")
        void shouldDiscardUnreadableEntries() {
            String key = new CacheKeyGenerator("test")
                    .key(CacheCategory.SYSTEM_DATA, Map.of("name", "flags"));
            store.data.put(key, "{not json");

            assertThat(cache.get(CacheCategory.SYSTEM_DATA, Map.of("name", "flags"), Map.class)).isEmpty();
            assertThat(cache.statistics().errors()).isEqualTo(1);
            assertThat(cache.statistics().misses()).isEqualTo(1);
        }

        @Test
        @DisplayName("should invalidate on both levels")
        void shouldInvalidateBothLevels() {
            cache.cacheModelResponse("q", "fast", null, "a");

            long removed = cache.invalidate("model_responses");

            assertThat(removed).isEqualTo(1);
            assertThat(store.data).isEmpty();
        }
    }

    /** In-memory primary that can be switched into failure. */
    static final class StubStore implements RemoteCacheStore {
        final Map<String, String> data = new ConcurrentHashMap<>();
        final AtomicInteger calls = new AtomicInteger();
        volatile boolean failing;
        volatile Duration lastTtl;

        @Override
        public String get(String key) {
            calls.incrementAndGet();
            check();
            return data.get(key);
        }

        @Override
        public void setex(String key, Duration ttl, String value) {
            calls.incrementAndGet();
            check();
            lastTtl = ttl;
            data.put(key, value);
        }

        @Override
        public long deleteMatching(String glob) {
            calls.incrementAndGet();
            check();
            Pattern pattern = ResponseCache.globToRegex(glob);
            long before = data.size();
            data.keySet().removeIf(k -> pattern.matcher(k).matches());
            return before - data.size();
        }

        @Override
        public void close() {
        }

        private void check() {
            if (failing) {
                throw new IllegalStateException("connection refused");
            }
        }
    }
}
