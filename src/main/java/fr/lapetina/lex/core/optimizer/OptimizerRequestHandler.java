package fr.lapetina.lex.core.optimizer;

import fr.lapetina.lex.core.domain.model.ErrorType;
import fr.lapetina.lex.core.domain.model.HandlerResult;
import fr.lapetina.lex.core.domain.model.OptimizedResponse;
import fr.lapetina.lex.core.domain.model.QueuedRequest;
import fr.lapetina.lex.core.scheduler.RequestHandler;

import java.time.Instant;
import java.util.Map;

/**
 * Default scheduler handler: resolves the payload's {@code prompt} through the optimizer.
 *
 * Payload keys: {@code prompt} (required string) and {@code context} (optional map,
 * may carry a {@code priority} hint of speed, balanced or quality).
 */
public final class OptimizerRequestHandler implements RequestHandler {

    public static final String PROMPT_KEY = "prompt";
    public static final String CONTEXT_KEY = "context";

    private final RequestOptimizer optimizer;

    public OptimizerRequestHandler(RequestOptimizer optimizer) {
        this.optimizer = optimizer;
    }

    @Override
    public HandlerResult handle(QueuedRequest request, Instant deadline) {
        Object prompt = request.payload().get(PROMPT_KEY);
        if (!(prompt instanceof String) || ((String) prompt).isBlank()) {
            return HandlerResult.fatal(ErrorType.VALIDATION_ERROR, "Payload must contain a non-empty 'prompt'");
        }

        try {
            OptimizedResponse response = optimizer.resolve(
                    (String) prompt, context(request), request.userId(), request.priority(), deadline);
            return HandlerResult.ok(response);
        } catch (DeadlineExceededException e) {
            return HandlerResult.fatal(ErrorType.TIMEOUT, e.getMessage());
        } catch (DownstreamException e) {
            return e.isRetryable()
                    ? HandlerResult.retryable(ErrorType.DOWNSTREAM_ERROR, e.getMessage())
                    : HandlerResult.fatal(ErrorType.DOWNSTREAM_ERROR, e.getMessage());
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> context(QueuedRequest request) {
        Object context = request.payload().get(CONTEXT_KEY);
        return context instanceof Map ? (Map<String, Object>) context : Map.of();
    }
}
