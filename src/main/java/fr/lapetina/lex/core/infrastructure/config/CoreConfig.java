package fr.lapetina.lex.core.infrastructure.config;

import fr.lapetina.lex.core.infrastructure.cache.CacheCategory;

/**
 * Root configuration object for the request core.
 * Designed to be populated from YAML.
 */
public class CoreConfig {

    private ServerConfig server = new ServerConfig();
    private SchedulerConfig scheduler = new SchedulerConfig();
    private RetryConfig retry = new RetryConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private CacheConfig cache = new CacheConfig();
    private PoolConfig pool = new PoolConfig();
    private OptimizerConfig optimizer = new OptimizerConfig();
    private DownstreamConfig downstream = new DownstreamConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public SchedulerConfig getScheduler() { return scheduler; }
    public void setScheduler(SchedulerConfig scheduler) { this.scheduler = scheduler; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public RateLimitConfig getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitConfig rateLimit) { this.rateLimit = rateLimit; }

    public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public PoolConfig getPool() { return pool; }
    public void setPool(PoolConfig pool) { this.pool = pool; }

    public OptimizerConfig getOptimizer() { return optimizer; }
    public void setOptimizer(OptimizerConfig optimizer) { this.optimizer = optimizer; }

    public DownstreamConfig getDownstream() { return downstream; }
    public void setDownstream(DownstreamConfig downstream) { this.downstream = downstream; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server for the statistics and metrics endpoints.
     */
    public static class ServerConfig {
        private boolean enabled = true;
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int threads = 4;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * Worker pool and queue settings.
     */
    public static class SchedulerConfig {
        private int workers = 4;
        private int maxQueueSize = 1000;
        private int maxRetries = 3;
        private int completedHistorySize = 1000;
        private long defaultTimeoutMs = 30000;
        private long shutdownTimeoutMs = 10000;

        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }

        public int getMaxQueueSize() { return maxQueueSize; }
        public void setMaxQueueSize(int maxQueueSize) { this.maxQueueSize = maxQueueSize; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public int getCompletedHistorySize() { return completedHistorySize; }
        public void setCompletedHistorySize(int completedHistorySize) { this.completedHistorySize = completedHistorySize; }

        public long getDefaultTimeoutMs() { return defaultTimeoutMs; }
        public void setDefaultTimeoutMs(long defaultTimeoutMs) { this.defaultTimeoutMs = defaultTimeoutMs; }

        public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
        public void setShutdownTimeoutMs(long shutdownTimeoutMs) { this.shutdownTimeoutMs = shutdownTimeoutMs; }
    }

    /**
     * Retry backoff: delay = min(initialBackoffMs * 2^retryCount, maxBackoffMs).
     */
    public static class RetryConfig {
        private long initialBackoffMs = 1000;
        private long maxBackoffMs = 60000;

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }
    }

    public static class RateLimitConfig {
        private boolean enabled = true;
        private int perMinute = 60;
        private int perHour = 1000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getPerMinute() { return perMinute; }
        public void setPerMinute(int perMinute) { this.perMinute = perMinute; }

        public int getPerHour() { return perHour; }
        public void setPerHour(int perHour) { this.perHour = perHour; }
    }

    public static class CircuitBreakerConfig {
        private int failureThreshold = 5;
        private long recoveryTimeoutMs = 60000;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getRecoveryTimeoutMs() { return recoveryTimeoutMs; }
        public void setRecoveryTimeoutMs(long recoveryTimeoutMs) { this.recoveryTimeoutMs = recoveryTimeoutMs; }
    }

    /**
     * Response cache. An empty {@code redisUrl} runs on the in-process fallback only.
     */
    public static class CacheConfig {
        private String redisUrl;
        private String namespace = "lex";
        private long commandTimeoutMs = 2000;
        private int primaryFailureThreshold = 3;
        private long primaryRetryMs = 30000;
        private CategoryConfig modelResponse = new CategoryConfig(3600, 10000, 0.02);
        private CategoryConfig userSession = new CategoryConfig(7200, 5000, 0.0);
        private CategoryConfig systemData = new CategoryConfig(86400, 1000, 0.0);
        private CategoryConfig embedding = new CategoryConfig(604800, 50000, 0.001);

        public String getRedisUrl() { return redisUrl; }
        public void setRedisUrl(String redisUrl) { this.redisUrl = redisUrl; }

        public String getNamespace() { return namespace; }
        public void setNamespace(String namespace) { this.namespace = namespace; }

        public long getCommandTimeoutMs() { return commandTimeoutMs; }
        public void setCommandTimeoutMs(long commandTimeoutMs) { this.commandTimeoutMs = commandTimeoutMs; }

        public int getPrimaryFailureThreshold() { return primaryFailureThreshold; }
        public void setPrimaryFailureThreshold(int primaryFailureThreshold) { this.primaryFailureThreshold = primaryFailureThreshold; }

        public long getPrimaryRetryMs() { return primaryRetryMs; }
        public void setPrimaryRetryMs(long primaryRetryMs) { this.primaryRetryMs = primaryRetryMs; }

        public CategoryConfig getModelResponse() { return modelResponse; }
        public void setModelResponse(CategoryConfig modelResponse) { this.modelResponse = modelResponse; }

        public CategoryConfig getUserSession() { return userSession; }
        public void setUserSession(CategoryConfig userSession) { this.userSession = userSession; }

        public CategoryConfig getSystemData() { return systemData; }
        public void setSystemData(CategoryConfig systemData) { this.systemData = systemData; }

        public CategoryConfig getEmbedding() { return embedding; }
        public void setEmbedding(CategoryConfig embedding) { this.embedding = embedding; }

        public CategoryConfig forCategory(CacheCategory category) {
            return switch (category) {
                case MODEL_RESPONSE -> modelResponse;
                case USER_SESSION -> userSession;
                case SYSTEM_DATA -> systemData;
                case EMBEDDING -> embedding;
            };
        }
    }

    /**
     * TTL, fallback size cap and estimated cost saved per hit for one cache category.
     */
    public static class CategoryConfig {
        private long ttlSeconds;
        private int maxEntries;
        private double costPerHit;

        public CategoryConfig() {
        }

        public CategoryConfig(long ttlSeconds, int maxEntries, double costPerHit) {
            this.ttlSeconds = ttlSeconds;
            this.maxEntries = maxEntries;
            this.costPerHit = costPerHit;
        }

        public long getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(long ttlSeconds) { this.ttlSeconds = ttlSeconds; }

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }

        public double getCostPerHit() { return costPerHit; }
        public void setCostPerHit(double costPerHit) { this.costPerHit = costPerHit; }
    }

    /**
     * Connection pool over the transactional store.
     */
    public static class PoolConfig {
        private String jdbcUrl = "jdbc:sqlite:lex-core.db";
        private String username;
        private String password;
        private int minSize = 20;
        private int maxSize = 50;
        private long idleTimeoutMs = 300000;
        private long connectionTimeoutMs = 30000;
        private long maintenanceIntervalMs = 60000;

        public String getJdbcUrl() { return jdbcUrl; }
        public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public int getMinSize() { return minSize; }
        public void setMinSize(int minSize) { this.minSize = minSize; }

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }

        public long getIdleTimeoutMs() { return idleTimeoutMs; }
        public void setIdleTimeoutMs(long idleTimeoutMs) { this.idleTimeoutMs = idleTimeoutMs; }

        public long getConnectionTimeoutMs() { return connectionTimeoutMs; }
        public void setConnectionTimeoutMs(long connectionTimeoutMs) { this.connectionTimeoutMs = connectionTimeoutMs; }

        public long getMaintenanceIntervalMs() { return maintenanceIntervalMs; }
        public void setMaintenanceIntervalMs(long maintenanceIntervalMs) { this.maintenanceIntervalMs = maintenanceIntervalMs; }
    }

    public static class OptimizerConfig {
        private boolean templatesEnabled = true;
        private int profileHistorySize = 50;
        private boolean persistInteractions = true;
        private BatchingConfig batching = new BatchingConfig();
        private TiersConfig tiers = new TiersConfig();

        public boolean isTemplatesEnabled() { return templatesEnabled; }
        public void setTemplatesEnabled(boolean templatesEnabled) { this.templatesEnabled = templatesEnabled; }

        public int getProfileHistorySize() { return profileHistorySize; }
        public void setProfileHistorySize(int profileHistorySize) { this.profileHistorySize = profileHistorySize; }

        public boolean isPersistInteractions() { return persistInteractions; }
        public void setPersistInteractions(boolean persistInteractions) { this.persistInteractions = persistInteractions; }

        public BatchingConfig getBatching() { return batching; }
        public void setBatching(BatchingConfig batching) { this.batching = batching; }

        public TiersConfig getTiers() { return tiers; }
        public void setTiers(TiersConfig tiers) { this.tiers = tiers; }
    }

    /**
     * Low-priority request batching (LMAX Disruptor ring).
     */
    public static class BatchingConfig {
        private boolean enabled = true;
        private int ringBufferSize = 1024;
        private int batchSize = 10;
        private long maxWaitMs = 2000;
        private long deadlineMarginMs = 500;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

        public long getMaxWaitMs() { return maxWaitMs; }
        public void setMaxWaitMs(long maxWaitMs) { this.maxWaitMs = maxWaitMs; }

        public long getDeadlineMarginMs() { return deadlineMarginMs; }
        public void setDeadlineMarginMs(long deadlineMarginMs) { this.deadlineMarginMs = deadlineMarginMs; }
    }

    public static class TiersConfig {
        private TierConfig fast = new TierConfig("llama3.2:1b", 0.0);
        private TierConfig balanced = new TierConfig("llama3.1:8b", 0.25);
        private TierConfig premium = new TierConfig("llama3.1:70b", 3.0);

        public TierConfig getFast() { return fast; }
        public void setFast(TierConfig fast) { this.fast = fast; }

        public TierConfig getBalanced() { return balanced; }
        public void setBalanced(TierConfig balanced) { this.balanced = balanced; }

        public TierConfig getPremium() { return premium; }
        public void setPremium(TierConfig premium) { this.premium = premium; }
    }

    /**
     * Model name and per-request cost of one execution tier.
     */
    public static class TierConfig {
        private String model;
        private double costPerRequest;

        public TierConfig() {
        }

        public TierConfig(String model, double costPerRequest) {
            this.model = model;
            this.costPerRequest = costPerRequest;
        }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public double getCostPerRequest() { return costPerRequest; }
        public void setCostPerRequest(double costPerRequest) { this.costPerRequest = costPerRequest; }
    }

    public static class DownstreamConfig {
        private String baseUrl = "http://localhost:11434";
        private long connectTimeoutMs = 5000;
        private long requestTimeoutMs = 120000;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    public static class MetricsConfig {
        private String prefix = "lex_core";
        private boolean jvmMetrics = true;

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public boolean isJvmMetrics() { return jvmMetrics; }
        public void setJvmMetrics(boolean jvmMetrics) { this.jvmMetrics = jvmMetrics; }
    }
}
