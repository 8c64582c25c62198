package fr.lapetina.lex.core.domain.routing;

import fr.lapetina.lex.core.domain.model.ExecutionTier;
import fr.lapetina.lex.core.domain.model.PriorityHint;
import fr.lapetina.lex.core.domain.model.QueryComplexity;

/**
 * Maps a complexity class and a priority hint to an execution tier.
 *
 * SIMPLE goes to FAST unless quality was asked for, MODERATE always goes to
 * BALANCED. Everything else, including quality-first SIMPLE prompts, goes to
 * PREMIUM unless speed was asked for.
 */
public final class TierSelector {

    public ExecutionTier select(QueryComplexity complexity, PriorityHint hint) {
        PriorityHint effective = hint != null ? hint : PriorityHint.BALANCED;
        if (complexity == QueryComplexity.SIMPLE && effective != PriorityHint.QUALITY) {
            return ExecutionTier.FAST;
        }
        if (complexity == QueryComplexity.MODERATE) {
            return ExecutionTier.BALANCED;
        }
        return effective == PriorityHint.SPEED ? ExecutionTier.BALANCED : ExecutionTier.PREMIUM;
    }
}
