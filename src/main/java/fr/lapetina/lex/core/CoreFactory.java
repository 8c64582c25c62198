package fr.lapetina.lex.core;

import fr.lapetina.lex.core.domain.model.ExecutionTier;
import fr.lapetina.lex.core.domain.routing.TemplateMatcher;
import fr.lapetina.lex.core.infrastructure.cache.CacheCategory;
import fr.lapetina.lex.core.infrastructure.cache.CategorySettings;
import fr.lapetina.lex.core.infrastructure.cache.RedisCacheStore;
import fr.lapetina.lex.core.infrastructure.cache.RemoteCacheStore;
import fr.lapetina.lex.core.infrastructure.cache.ResponseCache;
import fr.lapetina.lex.core.infrastructure.config.ConfigLoader;
import fr.lapetina.lex.core.infrastructure.config.CoreConfig;
import fr.lapetina.lex.core.infrastructure.http.OllamaModelClient;
import fr.lapetina.lex.core.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.lex.core.infrastructure.persistence.InteractionStore;
import fr.lapetina.lex.core.infrastructure.pool.ConnectionPool;
import fr.lapetina.lex.core.infrastructure.pool.JdbcConnectionFactory;
import fr.lapetina.lex.core.optimizer.DownstreamModel;
import fr.lapetina.lex.core.optimizer.OptimizerRequestHandler;
import fr.lapetina.lex.core.optimizer.RequestOptimizer;
import fr.lapetina.lex.core.optimizer.batch.BatchDispatcher;
import fr.lapetina.lex.core.scheduler.RequestScheduler;
import fr.lapetina.lex.core.scheduler.admission.CircuitBreakerRegistry;
import fr.lapetina.lex.core.scheduler.admission.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds every component from configuration and owns their lifecycle.
 * Components are plain instances passed by reference; nothing is process-global.
 *
 * <p>Usage:
 * <pre>{@code
 * try (CoreFactory factory = CoreFactory.create("lex-core.yaml").start()) {
 *     String id = factory.getScheduler().submit("chat", Map.of("prompt", "Explain TCP"), "user-1");
 *     // poll factory.getScheduler().getStatus(id)
 * }
 * }</pre>
 */
public class CoreFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CoreFactory.class);

    private final CoreConfig config;
    private final MetricsRegistry metricsRegistry;
    private final ResponseCache responseCache;
    private final ConnectionPool connectionPool;
    private final InteractionStore interactionStore;
    private final DownstreamModel downstream;
    private final BatchDispatcher batchDispatcher;
    private final RequestOptimizer optimizer;
    private final RateLimiter rateLimiter;
    private final CircuitBreakerRegistry breakerRegistry;
    private final RequestScheduler scheduler;

    protected CoreFactory(String configPath, DownstreamModel downstreamOverride, Map<String, String> environment) {
        log.info("Initializing CoreFactory from config: {}", configPath);

        // Load configuration
        this.config = new ConfigLoader(configPath, environment).load();

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix(), config.getMetrics().isJvmMetrics());

        // Cache, with Redis as primary when configured
        this.responseCache = createResponseCache();

        // Pool and the store behind it
        CoreConfig.PoolConfig poolConfig = config.getPool();
        this.connectionPool = ConnectionPool.builder()
                .connectionFactory(new JdbcConnectionFactory(
                        poolConfig.getJdbcUrl(), poolConfig.getUsername(), poolConfig.getPassword()))
                .minSize(poolConfig.getMinSize())
                .maxSize(poolConfig.getMaxSize())
                .idleTimeout(Duration.ofMillis(poolConfig.getIdleTimeoutMs()))
                .connectionTimeout(Duration.ofMillis(poolConfig.getConnectionTimeoutMs()))
                .maintenanceInterval(Duration.ofMillis(poolConfig.getMaintenanceIntervalMs()))
                .metricsRegistry(metricsRegistry)
                .build();
        this.interactionStore = config.getOptimizer().isPersistInteractions()
                ? new InteractionStore(connectionPool)
                : null;

        // Downstream model (allow override for testing)
        this.downstream = downstreamOverride != null ? downstreamOverride : createModelClient();

        this.batchDispatcher = config.getOptimizer().getBatching().isEnabled() ? createBatchDispatcher() : null;
        this.optimizer = createOptimizer();

        // Admission and scheduling
        this.rateLimiter = config.getRateLimit().isEnabled()
                ? new RateLimiter(config.getRateLimit().getPerMinute(), config.getRateLimit().getPerHour())
                : null;
        this.breakerRegistry = new CircuitBreakerRegistry(
                config.getCircuitBreaker().getFailureThreshold(),
                Duration.ofMillis(config.getCircuitBreaker().getRecoveryTimeoutMs())
        );

        CoreConfig.SchedulerConfig schedulerConfig = config.getScheduler();
        this.scheduler = RequestScheduler.builder()
                .workers(schedulerConfig.getWorkers())
                .maxQueueSize(schedulerConfig.getMaxQueueSize())
                .maxRetries(schedulerConfig.getMaxRetries())
                .completedHistorySize(schedulerConfig.getCompletedHistorySize())
                .defaultTimeout(Duration.ofMillis(schedulerConfig.getDefaultTimeoutMs()))
                .shutdownTimeout(Duration.ofMillis(schedulerConfig.getShutdownTimeoutMs()))
                .initialBackoff(Duration.ofMillis(config.getRetry().getInitialBackoffMs()))
                .maxBackoff(Duration.ofMillis(config.getRetry().getMaxBackoffMs()))
                .rateLimiter(rateLimiter)
                .breakerRegistry(breakerRegistry)
                .metricsRegistry(metricsRegistry)
                .defaultHandler(new OptimizerRequestHandler(optimizer))
                .build();

        log.info("CoreFactory initialized: redis={}, batching={}, persistence={}",
                responseCache.statistics().primaryConfigured(), batchDispatcher != null, interactionStore != null);
    }

    protected CoreFactory(String configPath, DownstreamModel downstreamOverride) {
        this(configPath, downstreamOverride, System.getenv());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static CoreFactory create(String configPath) {
        return new CoreFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration (lex-core.yaml).
     */
    public static CoreFactory create() {
        return create("lex-core.yaml");
    }

    /**
     * Opens the pool, prepares the schema and starts the batch and worker threads.
     *
     * @throws SQLException if the pool's initial connections or the schema cannot be created
     */
    public CoreFactory start() throws SQLException {
        connectionPool.start();
        if (interactionStore != null) {
            interactionStore.initSchema();
        }
        if (batchDispatcher != null) {
            batchDispatcher.start();
        }
        scheduler.start();
        log.info("Request core started");
        return this;
    }

    public CoreConfig getConfig() {
        return config;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ResponseCache getResponseCache() {
        return responseCache;
    }

    public ConnectionPool getConnectionPool() {
        return connectionPool;
    }

    public InteractionStore getInteractionStore() {
        return interactionStore;
    }

    public DownstreamModel getDownstream() {
        return downstream;
    }

    public RequestOptimizer getOptimizer() {
        return optimizer;
    }

    public RequestScheduler getScheduler() {
        return scheduler;
    }

    /**
     * Aggregated statistics of every component, JSON-serializable.
     */
    public Map<String, Object> statistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("scheduler", scheduler.statistics());
        stats.put("pool", connectionPool.statistics());
        stats.put("cache", responseCache.statistics());
        stats.put("optimizer", optimizer.statistics());
        return stats;
    }

    private ResponseCache createResponseCache() {
        CoreConfig.CacheConfig cacheConfig = config.getCache();
        ResponseCache.Builder builder = ResponseCache.builder()
                .primary(createPrimary(cacheConfig))
                .namespace(cacheConfig.getNamespace())
                .primaryFailureThreshold(cacheConfig.getPrimaryFailureThreshold())
                .primaryRetryInterval(Duration.ofMillis(cacheConfig.getPrimaryRetryMs()))
                .metricsRegistry(metricsRegistry);

        for (CacheCategory category : CacheCategory.values()) {
            CoreConfig.CategoryConfig settings = cacheConfig.forCategory(category);
            builder.category(category, new CategorySettings(
                    Duration.ofSeconds(settings.getTtlSeconds()),
                    settings.getMaxEntries(),
                    settings.getCostPerHit()
            ));
        }
        return builder.build();
    }

    private RemoteCacheStore createPrimary(CoreConfig.CacheConfig cacheConfig) {
        String redisUrl = cacheConfig.getRedisUrl();
        if (redisUrl == null || redisUrl.isBlank()) {
            log.info("No cache service configured, using in-process cache only");
            return null;
        }
        try {
            return RedisCacheStore.create(redisUrl, Duration.ofMillis(cacheConfig.getCommandTimeoutMs()));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid cache service URL, using in-process cache only: url={}, error={}",
                    redisUrl, e.getMessage());
            return null;
        }
    }

    private DownstreamModel createModelClient() {
        CoreConfig.TiersConfig tiers = config.getOptimizer().getTiers();
        Map<ExecutionTier, String> models = new EnumMap<>(ExecutionTier.class);
        models.put(ExecutionTier.FAST, tiers.getFast().getModel());
        models.put(ExecutionTier.BALANCED, tiers.getBalanced().getModel());
        models.put(ExecutionTier.PREMIUM, tiers.getPremium().getModel());

        return new OllamaModelClient(
                config.getDownstream().getBaseUrl(),
                models,
                Duration.ofMillis(config.getDownstream().getConnectTimeoutMs()),
                Duration.ofMillis(config.getDownstream().getRequestTimeoutMs())
        );
    }

    private BatchDispatcher createBatchDispatcher() {
        CoreConfig.BatchingConfig batching = config.getOptimizer().getBatching();
        return BatchDispatcher.builder()
                .downstream(downstream)
                .ringBufferSize(batching.getRingBufferSize())
                .batchSize(batching.getBatchSize())
                .maxWait(Duration.ofMillis(batching.getMaxWaitMs()))
                .deadlineMargin(Duration.ofMillis(batching.getDeadlineMarginMs()))
                .build();
    }

    private RequestOptimizer createOptimizer() {
        CoreConfig.OptimizerConfig optimizerConfig = config.getOptimizer();
        CoreConfig.TiersConfig tiers = optimizerConfig.getTiers();
        return RequestOptimizer.builder()
                .cache(responseCache)
                .downstream(downstream)
                .templateMatcher(optimizerConfig.isTemplatesEnabled()
                        ? TemplateMatcher.withDefaults()
                        : new TemplateMatcher(List.of()))
                .profileHistorySize(optimizerConfig.getProfileHistorySize())
                .interactionStore(interactionStore)
                .batchDispatcher(batchDispatcher)
                .tierCost(ExecutionTier.FAST, tiers.getFast().getCostPerRequest())
                .tierCost(ExecutionTier.BALANCED, tiers.getBalanced().getCostPerRequest())
                .tierCost(ExecutionTier.PREMIUM, tiers.getPremium().getCostPerRequest())
                .metricsRegistry(metricsRegistry)
                .build();
    }

    @Override
    public void close() {
        log.info("Shutting down CoreFactory...");

        try {
            scheduler.close();
        } catch (Exception e) {
            log.warn("Error closing scheduler", e);
        }

        if (batchDispatcher != null) {
            try {
                batchDispatcher.close();
            } catch (Exception e) {
                log.warn("Error closing batch dispatcher", e);
            }
        }

        try {
            downstream.close();
        } catch (Exception e) {
            log.warn("Error closing downstream model", e);
        }

        try {
            connectionPool.close();
        } catch (Exception e) {
            log.warn("Error closing connection pool", e);
        }

        try {
            responseCache.close();
        } catch (Exception e) {
            log.warn("Error closing response cache", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("CoreFactory shut down");
    }
}
