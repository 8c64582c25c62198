package fr.lapetina.lex.core.optimizer;

import fr.lapetina.lex.core.domain.model.ExecutionTier;
import fr.lapetina.lex.core.domain.model.OptimizedResponse;
import fr.lapetina.lex.core.domain.model.PriorityHint;
import fr.lapetina.lex.core.domain.model.QueryComplexity;
import fr.lapetina.lex.core.domain.model.RequestPriority;
import fr.lapetina.lex.core.domain.routing.ComplexityClassifier;
import fr.lapetina.lex.core.domain.routing.TemplateMatcher;
import fr.lapetina.lex.core.domain.routing.TierSelector;
import fr.lapetina.lex.core.infrastructure.cache.CacheCategory;
import fr.lapetina.lex.core.infrastructure.cache.ResponseCache;
import fr.lapetina.lex.core.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.lex.core.infrastructure.persistence.InteractionRecord;
import fr.lapetina.lex.core.infrastructure.persistence.InteractionStore;
import fr.lapetina.lex.core.infrastructure.pool.PoolExhaustedException;
import fr.lapetina.lex.core.optimizer.batch.BatchDispatcher;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Routes a prompt to the cheapest way of answering it.
 *
 * <p>Resolution steps:
 * <ol>
 *   <li>canned template match, answered instantly</li>
 *   <li>complexity classification</li>
 *   <li>tier selection from complexity and a priority hint (explicit in the context, or the user's profile)</li>
 *   <li>response cache lookup keyed on prompt, tier and context</li>
 *   <li>downstream generation on a miss, batched for low-priority requests, then cached</li>
 * </ol>
 *
 * <p>Every non-template resolution updates the user's rolling profile and is
 * persisted to the interaction store. Persistence failures are logged and never
 * fail the resolution.
 */
public final class RequestOptimizer {

    private static final Logger log = LoggerFactory.getLogger(RequestOptimizer.class);

    static final double SECONDS_SAVED_PER_SHORTCUT = 2.0;
    static final double DOWNSTREAM_CONFIDENCE = 0.8;
    static final String PRIORITY_HINT_KEY = "priority";

    private final ResponseCache cache;
    private final DownstreamModel downstream;
    private final TemplateMatcher templateMatcher;
    private final ComplexityClassifier classifier;
    private final TierSelector tierSelector;
    private final UserProfileTracker profileTracker;
    private final InteractionStore interactionStore;
    private final BatchDispatcher batchDispatcher;
    private final Map<ExecutionTier, Double> tierCosts;
    private final MetricsRegistry metricsRegistry;

    private final LongAdder totalRequests = new LongAdder();
    private final LongAdder templateHits = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder downstreamCalls = new LongAdder();
    private final LongAdder batchedRequests = new LongAdder();
    private final LongAdder fastTierUses = new LongAdder();
    private final DoubleAdder timeSaved = new DoubleAdder();
    private final DoubleAdder costSaved = new DoubleAdder();

    private RequestOptimizer(Builder builder) {
        this.cache = builder.cache;
        this.downstream = builder.downstream;
        this.templateMatcher = builder.templateMatcher;
        this.classifier = builder.classifier;
        this.tierSelector = builder.tierSelector;
        this.interactionStore = builder.interactionStore;
        this.profileTracker = builder.profileTracker != null
                ? builder.profileTracker
                : new UserProfileTracker(builder.profileHistorySize, builder.interactionStore);
        this.batchDispatcher = builder.batchDispatcher;
        this.metricsRegistry = builder.metricsRegistry;

        Map<ExecutionTier, Double> costs = new EnumMap<>(ExecutionTier.class);
        for (ExecutionTier tier : ExecutionTier.values()) {
            costs.put(tier, builder.tierCosts.getOrDefault(tier, tier.defaultCostPerRequest()));
        }
        this.tierCosts = costs;
    }

    public static Builder builder() {
        return new Builder();
    }

    public OptimizedResponse resolve(String prompt, Map<String, Object> context, String userId) {
        return resolve(prompt, context, userId, RequestPriority.NORMAL, null);
    }

    /**
     * Resolves a prompt.
     *
     * @param priority scheduling priority; low and batch priorities may be batched
     * @param deadline the request's deadline, or null for none
     * @throws DownstreamException if generation fails
     * @throws DeadlineExceededException if a batched result is not ready by the deadline
     */
    public OptimizedResponse resolve(String prompt, Map<String, Object> context, String userId,
                                     RequestPriority priority, Instant deadline) {
        Objects.requireNonNull(prompt, "Prompt is required");
        Objects.requireNonNull(userId, "User id is required");
        Map<String, Object> safeContext = context != null ? context : Map.of();
        long startNanos = System.nanoTime();
        totalRequests.increment();

        // 1. Template short-circuit
        Optional<TemplateMatcher.Template> template = templateMatcher.match(prompt);
        if (template.isPresent()) {
            templateHits.increment();
            timeSaved.add(SECONDS_SAVED_PER_SHORTCUT);
            recordRoute(null, OptimizedResponse.Source.TEMPLATE);
            log.debug("Template response: userId={}, template={}", userId, template.get().name());
            return new OptimizedResponse(template.get().response(), null, null,
                    OptimizedResponse.Source.TEMPLATE, false, template.get().confidence(), elapsed(startNanos));
        }

        // 2-3. Classification and tier selection
        QueryComplexity complexity = classifier.classify(prompt);
        PriorityHint hint = PriorityHint.parse(safeContext.get(PRIORITY_HINT_KEY))
                .orElseGet(() -> profileTracker.profile(userId).preference());
        ExecutionTier tier = tierSelector.select(complexity, hint);

        // 4. Cache lookup
        Map<String, Object> keyInputs = ResponseCache.modelResponseKey(prompt, tier.name(), safeContext);
        Optional<OptimizedResponse> cached = cache.get(CacheCategory.MODEL_RESPONSE, keyInputs, OptimizedResponse.class);
        if (cached.isPresent()) {
            cacheHits.increment();
            timeSaved.add(SECONDS_SAVED_PER_SHORTCUT);
            costSaved.add(tierCosts.get(tier));
            OptimizedResponse response = cached.get().asCacheHit(elapsed(startNanos));
            afterResolve(userId, prompt, complexity, tier, response);
            return response;
        }

        // 5-6. Execution, batched when allowed
        OptimizedResponse.Source source = OptimizedResponse.Source.DOWNSTREAM;
        String text = null;
        if (batchDispatcher != null && priority != null && priority.isDeferrable()) {
            Optional<CompletableFuture<String>> pending =
                    batchDispatcher.submit(new GenerationRequest(prompt, tier, safeContext), deadline);
            if (pending.isPresent()) {
                batchedRequests.increment();
                text = await(pending.get(), deadline);
                source = OptimizedResponse.Source.BATCH;
            }
        }
        if (text == null) {
            downstreamCalls.increment();
            text = downstream.generate(prompt, tier, safeContext);
        }

        OptimizedResponse response = new OptimizedResponse(text, tier, complexity, source, false,
                DOWNSTREAM_CONFIDENCE, elapsed(startNanos));
        cache.set(CacheCategory.MODEL_RESPONSE, keyInputs, response);
        afterResolve(userId, prompt, complexity, tier, response);
        return response;
    }

    public OptimizerStatistics statistics() {
        long total = totalRequests.sum();
        long hits = cacheHits.sum();
        return new OptimizerStatistics(
                total,
                templateHits.sum(),
                hits,
                downstreamCalls.sum(),
                batchedRequests.sum(),
                batchDispatcher != null ? batchDispatcher.getBatchesDispatched() : 0L,
                fastTierUses.sum(),
                total == 0 ? 0.0 : hits * 100.0 / total,
                timeSaved.sum(),
                costSaved.sum(),
                profileTracker.trackedUsers()
        );
    }

    public UserProfileTracker getProfileTracker() {
        return profileTracker;
    }

    private void afterResolve(String userId, String prompt, QueryComplexity complexity, ExecutionTier tier,
                              OptimizedResponse response) {
        if (tier == ExecutionTier.FAST) {
            fastTierUses.increment();
        }
        recordRoute(tier, response.source());
        profileTracker.record(userId, complexity);

        if (interactionStore == null) {
            return;
        }
        try {
            interactionStore.record(new InteractionRecord(
                    userId, DigestUtils.sha256Hex(prompt), complexity, tier, response.cacheHit(), Instant.now()));
        } catch (SQLException | PoolExhaustedException e) {
            log.warn("Interaction not persisted: userId={}, error={}", userId, e.getMessage());
        }
    }

    private void recordRoute(ExecutionTier tier, OptimizedResponse.Source source) {
        if (metricsRegistry != null) {
            metricsRegistry.incrementRoute(tier, source);
        }
    }

    private static String await(CompletableFuture<String> pending, Instant deadline) {
        try {
            if (deadline == null) {
                return pending.get();
            }
            long remainingMs = Math.max(1L, Duration.between(Instant.now(), deadline).toMillis());
            return pending.get(remainingMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new DownstreamException("Interrupted while waiting for batch result", false, e);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new DeadlineExceededException("Batch result not ready before deadline", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DownstreamException) {
                throw (DownstreamException) cause;
            }
            throw new DownstreamException("Batch generation failed: " + cause.getMessage(), true, cause);
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public static final class Builder {
        private ResponseCache cache;
        private DownstreamModel downstream;
        private TemplateMatcher templateMatcher = TemplateMatcher.withDefaults();
        private ComplexityClassifier classifier = ComplexityClassifier.withDefaults();
        private TierSelector tierSelector = new TierSelector();
        private UserProfileTracker profileTracker;
        private int profileHistorySize = 50;
        private InteractionStore interactionStore;
        private BatchDispatcher batchDispatcher;
        private final Map<ExecutionTier, Double> tierCosts = new EnumMap<>(ExecutionTier.class);
        private MetricsRegistry metricsRegistry;

        public Builder cache(ResponseCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder downstream(DownstreamModel downstream) {
            this.downstream = downstream;
            return this;
        }

        public Builder templateMatcher(TemplateMatcher templateMatcher) {
            this.templateMatcher = templateMatcher;
            return this;
        }

        public Builder classifier(ComplexityClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder tierSelector(TierSelector tierSelector) {
            this.tierSelector = tierSelector;
            return this;
        }

        public Builder profileTracker(UserProfileTracker profileTracker) {
            this.profileTracker = profileTracker;
            return this;
        }

        public Builder profileHistorySize(int profileHistorySize) {
            this.profileHistorySize = profileHistorySize;
            return this;
        }

        public Builder interactionStore(InteractionStore interactionStore) {
            this.interactionStore = interactionStore;
            return this;
        }

        public Builder batchDispatcher(BatchDispatcher batchDispatcher) {
            this.batchDispatcher = batchDispatcher;
            return this;
        }

        public Builder tierCost(ExecutionTier tier, double cost) {
            this.tierCosts.put(tier, cost);
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public RequestOptimizer build() {
            Objects.requireNonNull(cache, "Response cache is required");
            Objects.requireNonNull(downstream, "Downstream model is required");
            return new RequestOptimizer(this);
        }
    }
}
