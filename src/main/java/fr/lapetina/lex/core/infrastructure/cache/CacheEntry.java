package fr.lapetina.lex.core.infrastructure.cache;

import java.time.Instant;

/**
 * Fallback cache entry. The value is the JSON form of the cached object.
 * Access count is only touched under the owning cache's lock.
 */
final class CacheEntry {

    private final String key;
    private final String json;
    private final CacheCategory category;
    private final Instant createdAt;
    private final Instant expiresAt;
    private int accessCount;

    CacheEntry(String key, String json, CacheCategory category, Instant createdAt, Instant expiresAt) {
        this.key = key;
        this.json = json;
        this.category = category;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    void recordAccess() {
        accessCount++;
    }

    String key() { return key; }
    String json() { return json; }
    CacheCategory category() { return category; }
    Instant createdAt() { return createdAt; }
    Instant expiresAt() { return expiresAt; }
    int accessCount() { return accessCount; }
}
