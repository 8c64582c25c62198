package fr.lapetina.lex.core.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Caller or profile preference biasing tier selection.
 */
public enum PriorityHint {
    SPEED,
    BALANCED,
    QUALITY;

    /**
     * Parses a hint such as {@code "speed"}; unknown or blank values yield empty.
     */
    public static Optional<PriorityHint> parse(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim().toUpperCase(Locale.ROOT);
        for (PriorityHint hint : values()) {
            if (hint.name().equals(text)) {
                return Optional.of(hint);
            }
        }
        return Optional.empty();
    }
}
