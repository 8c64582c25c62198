package fr.lapetina.lex.core.domain.model;

/**
 * Error taxonomy for admitted and rejected requests.
 * Used on request snapshots and as a metrics tag.
 */
public enum ErrorType {
    /** Pending queue reached its configured maximum */
    QUEUE_FULL,

    /** Caller exceeded its per-minute or per-hour window */
    RATE_LIMITED,

    /** Circuit breaker is open for the request type */
    CIRCUIT_OPEN,

    /** No pooled connection could be obtained in time */
    POOL_EXHAUSTED,

    /** Request deadline elapsed while queued or executing */
    TIMEOUT,

    /** Downstream model call failed */
    DOWNSTREAM_ERROR,

    /** Primary cache service unreachable, fallback in use */
    CACHE_UNAVAILABLE,

    /** Request cancelled by the caller or at shutdown */
    CANCELLED,

    /** Payload missing required fields */
    VALIDATION_ERROR,

    /** Internal system error */
    INTERNAL_ERROR
}
