package fr.lapetina.lex.core.infrastructure.cache;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.KeyScanCursor;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.ScanArgs;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Redis-backed primary cache using a single shared Lettuce connection.
 * Lettuce connections are thread-safe, so no external locking is needed.
 *
 * <p>If Redis is unreachable when the store is created, the connection is
 * opened on a later call instead. Until then every call fails with a
 * {@link RedisException}, which {@link ResponseCache} handles as degraded mode.
 */
public final class RedisCacheStore implements RemoteCacheStore {

    private static final Logger log = LoggerFactory.getLogger(RedisCacheStore.class);

    private static final int SCAN_BATCH = 500;

    private final RedisClient client;
    private final String redisUrl;
    private final Duration commandTimeout;
    private volatile StatefulRedisConnection<String, String> connection;

    private RedisCacheStore(RedisClient client, String redisUrl, Duration commandTimeout) {
        this.client = client;
        this.redisUrl = redisUrl;
        this.commandTimeout = commandTimeout;
    }

    /**
     * Creates the store and tries a first connection. An unreachable server is
     * logged, not thrown; the connection is retried on use.
     *
     * @throws IllegalArgumentException if the URL is malformed
     */
    public static RedisCacheStore create(String redisUrl, Duration commandTimeout) {
        RedisClient client = RedisClient.create(RedisURI.create(redisUrl));
        client.setOptions(ClientOptions.builder()
                .socketOptions(SocketOptions.builder()
                        .connectTimeout(commandTimeout)
                        .keepAlive(true)
                        .build())
                .timeoutOptions(TimeoutOptions.enabled(commandTimeout))
                .autoReconnect(true)
                .build());
        RedisCacheStore store = new RedisCacheStore(client, redisUrl, commandTimeout);
        try {
            store.commands();
        } catch (RedisException e) {
            log.warn("Redis cache unreachable, will retry on use: url={}, error={}", redisUrl, e.getMessage());
        }
        return store;
    }

    /**
     * Whether a connection has been established. Lettuce reconnects it on its own afterwards.
     */
    public boolean isConnected() {
        StatefulRedisConnection<String, String> current = connection;
        return current != null && current.isOpen();
    }

    @Override
    public String get(String key) {
        return commands().get(key);
    }

    @Override
    public void setex(String key, Duration ttl, String value) {
        commands().setex(key, Math.max(1L, ttl.getSeconds()), value);
    }

    @Override
    public long deleteMatching(String glob) {
        ScanArgs args = ScanArgs.Builder.matches(glob).limit(SCAN_BATCH);
        long deleted = 0;
        RedisCommands<String, String> commands = commands();
        KeyScanCursor<String> cursor = commands.scan(args);
        while (true) {
            List<String> keys = cursor.getKeys();
            if (!keys.isEmpty()) {
                deleted += commands.del(keys.toArray(new String[0]));
            }
            if (cursor.isFinished()) {
                break;
            }
            cursor = commands.scan(cursor, args);
        }
        log.debug("Deleted keys from Redis: glob={}, count={}", glob, deleted);
        return deleted;
    }

    private RedisCommands<String, String> commands() {
        StatefulRedisConnection<String, String> current = connection;
        if (current == null) {
            synchronized (this) {
                current = connection;
                if (current == null) {
                    current = client.connect();
                    current.setTimeout(commandTimeout);
                    connection = current;
                    log.info("Connected to Redis cache: url={}", redisUrl);
                }
            }
        }
        return current.sync();
    }

    @Override
    public void close() {
        try {
            StatefulRedisConnection<String, String> current = connection;
            if (current != null) {
                current.close();
            }
        } finally {
            client.shutdown();
        }
    }
}
