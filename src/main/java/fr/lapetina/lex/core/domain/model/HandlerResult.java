package fr.lapetina.lex.core.domain.model;

import java.util.Objects;

/**
 * Outcome of a single handler invocation. The scheduler's retry loop is a
 * plain check on {@link Kind}: only {@code RETRYABLE} results are retried.
 */
public record HandlerResult(
        Kind kind,
        Object value,
        ErrorType errorType,
        String message
) {
    public enum Kind {
        OK,
        RETRYABLE,
        FATAL
    }

    public HandlerResult {
        Objects.requireNonNull(kind, "Kind is required");
        if (kind != Kind.OK) {
            Objects.requireNonNull(errorType, "Error type is required for failed results");
        }
    }

    public static HandlerResult ok(Object value) {
        return new HandlerResult(Kind.OK, value, null, null);
    }

    public static HandlerResult retryable(ErrorType errorType, String message) {
        return new HandlerResult(Kind.RETRYABLE, null, errorType, message);
    }

    public static HandlerResult fatal(ErrorType errorType, String message) {
        return new HandlerResult(Kind.FATAL, null, errorType, message);
    }

    public boolean isOk() {
        return kind == Kind.OK;
    }
}
