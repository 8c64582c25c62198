package fr.lapetina.lex.core.infrastructure.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * TTL, fallback size cap and estimated cost saved per hit for one category.
 */
public record CategorySettings(Duration ttl, int maxEntries, double costPerHit) {

    public CategorySettings {
        Objects.requireNonNull(ttl, "TTL is required");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive");
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1");
        }
    }
}
