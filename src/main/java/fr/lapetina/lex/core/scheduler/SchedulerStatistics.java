package fr.lapetina.lex.core.scheduler;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of scheduler state and counters.
 */
public record SchedulerStatistics(
        int queueDepth,
        int activeRequests,
        long submitted,
        long deduplicated,
        long completed,
        long failed,
        long timedOut,
        long cancelled,
        long retries,
        Map<String, Long> rejected,
        double averageProcessingMillis,
        List<WorkerStats> workers,
        int rateLimitedUsers,
        int openCircuitBreakers,
        Map<String, String> circuitBreakers
) {
    public SchedulerStatistics {
        rejected = Map.copyOf(rejected);
        workers = List.copyOf(workers);
        circuitBreakers = Map.copyOf(circuitBreakers);
    }
}
