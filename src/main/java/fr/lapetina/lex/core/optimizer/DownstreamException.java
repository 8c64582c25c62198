package fr.lapetina.lex.core.optimizer;

/**
 * Failure of the downstream model call. Retryable failures (server errors,
 * I/O problems) are retried by the scheduler; others fail the request at once.
 */
public final class DownstreamException extends RuntimeException {

    private final boolean retryable;

    public DownstreamException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public DownstreamException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
