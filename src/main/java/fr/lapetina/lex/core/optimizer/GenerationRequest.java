package fr.lapetina.lex.core.optimizer;

import fr.lapetina.lex.core.domain.model.ExecutionTier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single prompt to generate on a given tier.
 */
public record GenerationRequest(String prompt, ExecutionTier tier, Map<String, Object> context) {

    public GenerationRequest {
        Objects.requireNonNull(prompt, "Prompt is required");
        Objects.requireNonNull(tier, "Tier is required");
        context = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of();
    }
}
