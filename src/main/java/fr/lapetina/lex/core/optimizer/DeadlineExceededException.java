package fr.lapetina.lex.core.optimizer;

/**
 * The request's deadline passed while its response was still being produced.
 */
public final class DeadlineExceededException extends RuntimeException {

    public DeadlineExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
