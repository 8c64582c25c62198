package fr.lapetina.lex.core.infrastructure.config;

import fr.lapetina.lex.core.infrastructure.cache.CacheCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading YAML from the file system, then from the classpath
 * - Environment-style overrides applied on top of the YAML values
 * - Validation of the resulting configuration
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Map<String, BiConsumer<CoreConfig, String>> OVERRIDES = buildOverrides();

    private final Path configPath;
    private final Map<String, String> environment;
    private final Yaml yaml;

    public ConfigLoader(String configPath, Map<String, String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = environment != null ? environment : Map.of();
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(CoreConfig.class, loaderOptions));
    }

    public ConfigLoader(String configPath) {
        this(configPath, System.getenv());
    }

    /**
     * Loads configuration from file or classpath, then applies overrides.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading, an override or validation fails
     */
    public CoreConfig load() {
        CoreConfig config = loadFromPath();
        applyOverrides(config, environment);
        validate(config);
        return config;
    }

    private CoreConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    /**
     * Loads configuration from an input stream, then applies overrides.
     */
    public CoreConfig loadFromStream(InputStream inputStream) {
        CoreConfig config = parse(inputStream, "stream");
        applyOverrides(config, environment);
        validate(config);
        return config;
    }

    private CoreConfig parse(InputStream is, String source) {
        try {
            CoreConfig config = yaml.load(is);
            // An empty document yields null
            return config != null ? config : new CoreConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Applies every recognized key present in {@code environment}. Unrecognized keys are ignored.
     */
    static void applyOverrides(CoreConfig config, Map<String, String> environment) {
        OVERRIDES.forEach((key, setter) -> {
            String value = environment.get(key);
            if (value != null && !value.isBlank()) {
                setter.accept(config, value.trim());
                log.info("Configuration override applied: key={}", key);
            }
        });
    }

    static void validate(CoreConfig config) {
        CoreConfig.PoolConfig pool = config.getPool();
        if (pool.getMinSize() < 0 || pool.getMaxSize() < 1 || pool.getMinSize() > pool.getMaxSize()) {
            throw new ConfigurationException("Invalid pool sizes: minSize=" + pool.getMinSize()
                    + ", maxSize=" + pool.getMaxSize());
        }
        if (config.getScheduler().getWorkers() < 1) {
            throw new ConfigurationException("scheduler.workers must be >= 1");
        }
        if (config.getScheduler().getMaxQueueSize() < 1) {
            throw new ConfigurationException("scheduler.maxQueueSize must be >= 1");
        }
        if (config.getRateLimit().getPerMinute() < 1 || config.getRateLimit().getPerHour() < 1) {
            throw new ConfigurationException("Rate limits must be >= 1");
        }
        if (config.getCircuitBreaker().getFailureThreshold() < 1) {
            throw new ConfigurationException("circuitBreaker.failureThreshold must be >= 1");
        }
        for (CacheCategory category : CacheCategory.values()) {
            CoreConfig.CategoryConfig settings = config.getCache().forCategory(category);
            if (settings == null || settings.getTtlSeconds() <= 0 || settings.getMaxEntries() < 1) {
                throw new ConfigurationException("Invalid cache settings for category " + category);
            }
        }
    }

    /**
     * Recognized override keys.
     */
    public static Set<String> overrideKeys() {
        return Collections.unmodifiableSet(OVERRIDES.keySet());
    }

    private static Map<String, BiConsumer<CoreConfig, String>> buildOverrides() {
        Map<String, BiConsumer<CoreConfig, String>> o = new LinkedHashMap<>();
        o.put("LEX_REDIS_URL", (c, v) -> c.getCache().setRedisUrl(v));
        o.put("LEX_CACHE_NAMESPACE", (c, v) -> c.getCache().setNamespace(v));
        o.put("LEX_POOL_JDBC_URL", (c, v) -> c.getPool().setJdbcUrl(v));
        o.put("LEX_POOL_MIN_SIZE", (c, v) -> c.getPool().setMinSize(parseInt("LEX_POOL_MIN_SIZE", v)));
        o.put("LEX_POOL_MAX_SIZE", (c, v) -> c.getPool().setMaxSize(parseInt("LEX_POOL_MAX_SIZE", v)));
        o.put("LEX_POOL_IDLE_TIMEOUT_MS",
                (c, v) -> c.getPool().setIdleTimeoutMs(parseLong("LEX_POOL_IDLE_TIMEOUT_MS", v)));
        o.put("LEX_POOL_CONNECTION_TIMEOUT_MS",
                (c, v) -> c.getPool().setConnectionTimeoutMs(parseLong("LEX_POOL_CONNECTION_TIMEOUT_MS", v)));

        for (CacheCategory category : CacheCategory.values()) {
            String ttlKey = "LEX_CACHE_TTL_" + category.name() + "_SECONDS";
            String sizeKey = "LEX_CACHE_MAX_ENTRIES_" + category.name();
            o.put(ttlKey, (c, v) -> c.getCache().forCategory(category).setTtlSeconds(parseLong(ttlKey, v)));
            o.put(sizeKey, (c, v) -> c.getCache().forCategory(category).setMaxEntries(parseInt(sizeKey, v)));
        }

        o.put("LEX_RATE_LIMIT_PER_MINUTE",
                (c, v) -> c.getRateLimit().setPerMinute(parseInt("LEX_RATE_LIMIT_PER_MINUTE", v)));
        o.put("LEX_RATE_LIMIT_PER_HOUR",
                (c, v) -> c.getRateLimit().setPerHour(parseInt("LEX_RATE_LIMIT_PER_HOUR", v)));
        o.put("LEX_BREAKER_FAILURE_THRESHOLD",
                (c, v) -> c.getCircuitBreaker().setFailureThreshold(parseInt("LEX_BREAKER_FAILURE_THRESHOLD", v)));
        o.put("LEX_BREAKER_RECOVERY_TIMEOUT_MS",
                (c, v) -> c.getCircuitBreaker().setRecoveryTimeoutMs(parseLong("LEX_BREAKER_RECOVERY_TIMEOUT_MS", v)));
        o.put("LEX_SCHEDULER_WORKERS",
                (c, v) -> c.getScheduler().setWorkers(parseInt("LEX_SCHEDULER_WORKERS", v)));
        o.put("LEX_SCHEDULER_MAX_QUEUE_SIZE",
                (c, v) -> c.getScheduler().setMaxQueueSize(parseInt("LEX_SCHEDULER_MAX_QUEUE_SIZE", v)));
        o.put("LEX_DOWNSTREAM_BASE_URL", (c, v) -> c.getDownstream().setBaseUrl(v));
        o.put("LEX_SERVER_PORT", (c, v) -> c.getServer().setPort(parseInt("LEX_SERVER_PORT", v)));
        return o;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid number for " + key + ": " + value, e);
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
