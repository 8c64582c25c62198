package fr.lapetina.lex.core.infrastructure.pool;

/**
 * Snapshot of pool occupancy and query counters.
 */
public record PoolStatistics(
        int minSize,
        int maxSize,
        int total,
        int active,
        int available,
        long created,
        long destroyed,
        long checkouts,
        long totalQueries,
        long successfulQueries,
        long failedQueries,
        double averageQueryMillis,
        double successRatePercent,
        long longWaits,
        long exhausted
) {
}
