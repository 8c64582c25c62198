package fr.lapetina.lex.core.domain.model;

/**
 * Downstream execution tiers, trading cost and latency against quality.
 */
public enum ExecutionTier {
    FAST(0.0),
    BALANCED(0.25),
    PREMIUM(3.0);

    private final double defaultCostPerRequest;

    ExecutionTier(double defaultCostPerRequest) {
        this.defaultCostPerRequest = defaultCostPerRequest;
    }

    public double defaultCostPerRequest() {
        return defaultCostPerRequest;
    }
}
