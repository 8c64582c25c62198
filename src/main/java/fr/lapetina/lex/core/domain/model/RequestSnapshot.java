package fr.lapetina.lex.core.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time copy of a {@link QueuedRequest}, returned by status lookups.
 */
public record RequestSnapshot(
        String id,
        String userId,
        String requestType,
        RequestPriority priority,
        RequestStatus status,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Duration timeout,
        int retryCount,
        int maxRetries,
        String workerId,
        Object result,
        ErrorType errorType,
        String error
) {
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Time from admission to terminal status, or null while still pending.
     */
    public Duration totalDuration() {
        return completedAt != null ? Duration.between(createdAt, completedAt) : null;
    }
}
