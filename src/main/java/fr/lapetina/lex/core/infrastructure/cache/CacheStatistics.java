package fr.lapetina.lex.core.infrastructure.cache;

import java.util.Map;

/**
 * Snapshot of cache counters.
 */
public record CacheStatistics(
        long hits,
        long misses,
        long sets,
        long errors,
        double hitRatePercent,
        double costSaved,
        double timeSavedSeconds,
        double averageTimeSavedSeconds,
        int fallbackSize,
        boolean primaryConfigured,
        boolean degraded,
        Map<String, Long> hitsByCategory
) {
    public CacheStatistics {
        hitsByCategory = hitsByCategory != null ? Map.copyOf(hitsByCategory) : Map.of();
    }
}
