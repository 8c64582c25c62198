package fr.lapetina.lex.core.infrastructure.cache;

import java.time.Duration;

/**
 * Cache categories with their key prefix and default settings.
 */
public enum CacheCategory {
    MODEL_RESPONSE("model_responses", new CategorySettings(Duration.ofHours(1), 10_000, 0.02)),
    USER_SESSION("user_sessions", new CategorySettings(Duration.ofHours(2), 5_000, 0.0)),
    SYSTEM_DATA("system_data", new CategorySettings(Duration.ofHours(24), 1_000, 0.0)),
    EMBEDDING("embeddings", new CategorySettings(Duration.ofDays(7), 50_000, 0.001));

    private final String keyPrefix;
    private final CategorySettings defaults;

    CacheCategory(String keyPrefix, CategorySettings defaults) {
        this.keyPrefix = keyPrefix;
        this.defaults = defaults;
    }

    public String keyPrefix() {
        return keyPrefix;
    }

    public CategorySettings defaults() {
        return defaults;
    }
}
