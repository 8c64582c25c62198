package fr.lapetina.lex.core.optimizer;

/**
 * Snapshot of optimizer counters.
 */
public record OptimizerStatistics(
        long totalRequests,
        long templateHits,
        long cacheHits,
        long downstreamCalls,
        long batchedRequests,
        long batchesDispatched,
        long fastTierUses,
        double cacheHitRatePercent,
        double timeSavedSeconds,
        double costSaved,
        int trackedUsers
) {
}
