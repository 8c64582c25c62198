package fr.lapetina.lex.core.infrastructure.cache;

import fr.lapetina.lex.core.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class FallbackCacheTest {

    private MutableClock clock;
    private FallbackCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        Map<CacheCategory, CategorySettings> settings = new EnumMap<>(CacheCategory.class);
        for (CacheCategory category : CacheCategory.values()) {
            settings.put(category, new CategorySettings(Duration.ofSeconds(10), 3, 0.0));
        }
        cache = new FallbackCache(settings, clock);
    }

    @Test
    @DisplayName("should evict the oldest inserted key when full")
    void shouldEvictOldest() {
        cache.put(CacheCategory.MODEL_RESPONSE, "k1", "1");
        cache.put(CacheCategory.MODEL_RESPONSE, "k2", "2");
        cache.put(CacheCategory.MODEL_RESPONSE, "k3", "3");

        // Reads do not refresh position
        cache.get(CacheCategory.MODEL_RESPONSE, "k1");
        cache.put(CacheCategory.MODEL_RESPONSE, "k4", "4");

        assertThat(cache.get(CacheCategory.MODEL_RESPONSE, "k1")).isNull();
        assertThat(cache.get(CacheCategory.MODEL_RESPONSE, "k4")).isEqualTo("4");
        assertThat(cache.size(CacheCategory.MODEL_RESPONSE)).isEqualTo(3);
    }

    @Test
    @DisplayName("should move a rewritten key to the back")
    void shouldMoveRewrittenKeyToBack() {
        cache.put(CacheCategory.MODEL_RESPONSE, "k1", "1");
        cache.put(CacheCategory.MODEL_RESPONSE, "k2", "2");
        cache.put(CacheCategory.MODEL_RESPONSE, "k3", "3");
        cache.put(CacheCategory.MODEL_RESPONSE, "k1", "1b");

        cache.put(CacheCategory.MODEL_RESPONSE, "k4", "4");

        assertThat(cache.get(CacheCategory.MODEL_RESPONSE, "k1")).isEqualTo("1b");
        assertThat(cache.get(CacheCategory.MODEL_RESPONSE, "k2")).isNull();
    }

    @Test
    @DisplayName("should bound each category independently")
    void shouldBoundCategoriesIndependently() {
        for (int i = 0; i < 3; i++) {
            cache.put(CacheCategory.MODEL_RESPONSE, "m" + i, "x");
            cache.put(CacheCategory.EMBEDDING, "e" + i, "x");
        }

        assertThat(cache.size(CacheCategory.MODEL_RESPONSE)).isEqualTo(3);
        assertThat(cache.size(CacheCategory.EMBEDDING)).isEqualTo(3);
        assertThat(cache.size()).isEqualTo(6);
    }

    @Test
    @DisplayName("should drop expired entries on read")
    void shouldDropExpiredEntries() {
        cache.put(CacheCategory.USER_SESSION, "s", "{}");

        clock.advance(Duration.ofSeconds(9));
        assertThat(cache.get(CacheCategory.USER_SESSION, "s")).isEqualTo("{}");

        clock.advance(Duration.ofSeconds(2));
        assertThat(cache.get(CacheCategory.USER_SESSION, "s")).isNull();
        assertThat(cache.size(CacheCategory.USER_SESSION)).isZero();
    }

    @Test
    @DisplayName("should invalidate matching keys only")
    void shouldInvalidateMatchingKeys() {
        cache.put(CacheCategory.MODEL_RESPONSE, "lex:model_responses:a", "1");
        cache.put(CacheCategory.MODEL_RESPONSE, "lex:model_responses:b", "2");
        cache.put(CacheCategory.EMBEDDING, "lex:embeddings:a", "3");

        int removed = cache.invalidate(Pattern.compile("lex:model_responses:.*"));

        assertThat(removed).isEqualTo(2);
        assertThat(cache.get(CacheCategory.EMBEDDING, "lex:embeddings:a")).isEqualTo("3");
    }

    @Test
    @DisplayName("should report removed count on clear")
    void shouldClear() {
        cache.put(CacheCategory.MODEL_RESPONSE, "a", "1");
        cache.put(CacheCategory.SYSTEM_DATA, "b", "2");

        assertThat(cache.clear()).isEqualTo(2);
        assertThat(cache.size()).isZero();
    }
}
