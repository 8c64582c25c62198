package fr.lapetina.lex.core.scheduler;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-worker throughput snapshot.
 */
public record WorkerStats(
        String workerId,
        long processed,
        Duration totalProcessingTime,
        Instant lastRequestAt,
        State state
) {
    public enum State {
        IDLE,
        PROCESSING
    }

    public double averageProcessingMillis() {
        return processed == 0 ? 0.0 : totalProcessingTime.toNanos() / 1_000_000.0 / processed;
    }
}
