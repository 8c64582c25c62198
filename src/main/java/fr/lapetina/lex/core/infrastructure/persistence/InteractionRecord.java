package fr.lapetina.lex.core.infrastructure.persistence;

import fr.lapetina.lex.core.domain.model.ExecutionTier;
import fr.lapetina.lex.core.domain.model.QueryComplexity;

import java.time.Instant;
import java.util.Objects;

/**
 * One resolved prompt, as persisted for profile building.
 */
public record InteractionRecord(
        String userId,
        String promptHash,
        QueryComplexity complexity,
        ExecutionTier tier,
        boolean cacheHit,
        Instant createdAt
) {
    public InteractionRecord {
        Objects.requireNonNull(userId, "User id is required");
        Objects.requireNonNull(complexity, "Complexity is required");
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
