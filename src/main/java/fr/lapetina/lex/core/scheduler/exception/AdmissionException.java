package fr.lapetina.lex.core.scheduler.exception;

import fr.lapetina.lex.core.domain.model.ErrorType;

/**
 * Thrown synchronously by submit when a request is rejected at admission.
 * Rejected requests are never queued; callers retry later.
 */
public final class AdmissionException extends RuntimeException {

    private final Reason reason;

    public AdmissionException(Reason reason, String details) {
        super("Request rejected: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public ErrorType getErrorType() {
        return reason.getErrorType();
    }

    public enum Reason {
        QUEUE_FULL("Pending queue is full", ErrorType.QUEUE_FULL),
        RATE_LIMITED("Rate limit exceeded", ErrorType.RATE_LIMITED),
        CIRCUIT_OPEN("Circuit breaker is open", ErrorType.CIRCUIT_OPEN),
        NOT_RUNNING("Scheduler is not running", ErrorType.INTERNAL_ERROR);

        private final String message;
        private final ErrorType errorType;

        Reason(String message, ErrorType errorType) {
            this.message = message;
            this.errorType = errorType;
        }

        public String getMessage() {
            return message;
        }

        public ErrorType getErrorType() {
            return errorType;
        }
    }
}
