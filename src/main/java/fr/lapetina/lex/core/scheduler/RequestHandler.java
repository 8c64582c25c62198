package fr.lapetina.lex.core.scheduler;

import fr.lapetina.lex.core.domain.model.HandlerResult;
import fr.lapetina.lex.core.domain.model.QueuedRequest;

import java.time.Instant;

/**
 * Executes one attempt of a queued request on a worker.
 *
 * <p>Implementations report failures through {@link HandlerResult}. A thrown
 * exception is treated as a retryable downstream error. The worker interrupts
 * the executing thread when the deadline passes or the request is cancelled,
 * so long-running handlers should respond to interruption.
 */
@FunctionalInterface
public interface RequestHandler {

    HandlerResult handle(QueuedRequest request, Instant deadline) throws Exception;
}
