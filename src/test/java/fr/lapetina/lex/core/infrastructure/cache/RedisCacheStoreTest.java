package fr.lapetina.lex.core.infrastructure.cache;

import io.lettuce.core.RedisException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedisCacheStoreTest {

    // Nothing listens on port 1
    private static final String UNREACHABLE = "redis://127.0.0.1:1";

    @Test
    @DisplayName("should create the store even when Redis is unreachable")
    void shouldCreateWhileUnreachable() {
        try (RedisCacheStore store = RedisCacheStore.create(UNREACHABLE, Duration.ofMillis(500))) {
            assertThat(store.isConnected()).isFalse();

            assertThatThrownBy(() -> store.get("lex:system_data:abc"))
                    .isInstanceOf(RedisException.class);
            assertThat(store.isConnected()).isFalse();
        }
    }

    @Test
    @DisplayName("should let the cache fall back while the store cannot connect")
    void shouldServeFromFallbackWhileUnreachable() {
        try (ResponseCache cache = ResponseCache.builder()
                .primary(RedisCacheStore.create(UNREACHABLE, Duration.ofMillis(500)))
                .namespace("redis-test")
                .primaryFailureThreshold(1)
                .build()) {
            cache.cacheModelResponse("q", "fast", null, "a");

            assertThat(cache.getCachedModelResponse("q", "fast", null, String.class)).contains("a");
            CacheStatistics stats = cache.statistics();
            assertThat(stats.primaryConfigured()).isTrue();
            assertThat(stats.degraded()).isTrue();
        }
    }

    @Test
    @DisplayName("should reject a malformed URL")
    void shouldRejectMalformedUrl() {
        assertThatThrownBy(() -> RedisCacheStore.create("not a url", Duration.ofMillis(500)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
