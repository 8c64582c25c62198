package fr.lapetina.lex.core.optimizer;

import fr.lapetina.lex.core.domain.model.ExecutionTier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The reasoning subsystem that actually produces response text.
 */
public interface DownstreamModel extends AutoCloseable {

    /**
     * @throws DownstreamException if generation fails
     */
    String generate(String prompt, ExecutionTier tier, Map<String, Object> context);

    /**
     * Generates several prompts in one go. Results are in request order.
     * The default issues one call per request.
     */
    default List<String> generateBatch(List<GenerationRequest> requests) {
        List<String> results = new ArrayList<>(requests.size());
        for (GenerationRequest request : requests) {
            results.add(generate(request.prompt(), request.tier(), request.context()));
        }
        return results;
    }

    @Override
    default void close() {
    }
}
