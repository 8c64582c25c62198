package fr.lapetina.lex.core.infrastructure.pool;

import java.time.Duration;

/**
 * Thrown when no connection became available within the connection timeout
 * and the pool is already at its maximum size. Transient; callers may retry.
 */
public final class PoolExhaustedException extends RuntimeException {

    private final int maxSize;
    private final Duration waited;

    public PoolExhaustedException(int maxSize, Duration waited) {
        super("Connection pool exhausted: maxSize=" + maxSize + ", waitedMs=" + waited.toMillis());
        this.maxSize = maxSize;
        this.waited = waited;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public Duration getWaited() {
        return waited;
    }
}
