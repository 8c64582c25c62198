package fr.lapetina.lex.core.domain.model;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Rolling view of a user's recent interactions.
 */
public record UserProfile(
        String userId,
        QueryComplexity dominantComplexity,
        PriorityHint preference,
        int sampleSize,
        Map<QueryComplexity, Integer> complexityCounts
) {
    public UserProfile {
        Objects.requireNonNull(userId, "User id is required");
        Objects.requireNonNull(preference, "Preference is required");
        complexityCounts = complexityCounts != null
                ? Map.copyOf(complexityCounts)
                : Map.of();
    }

    public static UserProfile empty(String userId) {
        return new UserProfile(userId, QueryComplexity.SIMPLE, PriorityHint.BALANCED, 0,
                new EnumMap<>(QueryComplexity.class));
    }
}
