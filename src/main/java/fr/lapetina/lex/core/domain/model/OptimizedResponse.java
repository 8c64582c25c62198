package fr.lapetina.lex.core.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of resolving a prompt through the optimizer.
 */
public record OptimizedResponse(
        String text,
        ExecutionTier tier,
        QueryComplexity complexity,
        Source source,
        boolean cacheHit,
        double confidence,
        Duration latency
) {
    /**
     * Where the response text came from.
     */
    public enum Source {
        TEMPLATE,
        CACHE,
        DOWNSTREAM,
        BATCH
    }

    public OptimizedResponse {
        Objects.requireNonNull(text, "Text is required");
        Objects.requireNonNull(source, "Source is required");
        if (latency == null) {
            latency = Duration.ZERO;
        }
    }

    /**
     * Same response re-labelled as served from cache.
     */
    public OptimizedResponse asCacheHit(Duration lookupLatency) {
        return new OptimizedResponse(text, tier, complexity, Source.CACHE, true, confidence, lookupLatency);
    }
}
