package fr.lapetina.lex.core.infrastructure.cache;

import java.time.Duration;

/**
 * Primary cache service. Implementations throw unchecked exceptions on any
 * transport failure; {@link ResponseCache} treats those as degraded mode.
 */
public interface RemoteCacheStore extends AutoCloseable {

    /**
     * @return the stored value, or null if absent
     */
    String get(String key);

    void setex(String key, Duration ttl, String value);

    /**
     * Deletes every key matching a glob such as {@code lex:model_responses:*}.
     *
     * @return number of keys deleted
     */
    long deleteMatching(String glob);

    @Override
    void close();
}
