package fr.lapetina.lex.core.infrastructure.metrics;

import fr.lapetina.lex.core.domain.model.ErrorType;
import fr.lapetina.lex.core.domain.model.ExecutionTier;
import fr.lapetina.lex.core.domain.model.OptimizedResponse;
import fr.lapetina.lex.core.domain.model.RequestStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Admission counters by outcome
 * - Terminal request counters and dispatch latency per request type
 * - Cache hit/miss counters per category
 * - Pool, queue and breaker gauges registered by their owners
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix, boolean bindJvmMetrics) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        if (bindJvmMetrics) {
            new JvmMemoryMetrics().bindTo(registry);
            new JvmGcMetrics().bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
        }

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry(String prefix) {
        this(prefix, true);
    }

    public MetricsRegistry() {
        this("lex_core");
    }

    // ==================== SCHEDULER ====================

    /**
     * Counts an admission decision. Outcome is {@code admitted}, {@code deduplicated}
     * or the lower-cased rejection reason.
     */
    public void incrementAdmission(String requestType, String outcome) {
        counter("_admissions_total", "Admission decisions",
                "type", requestType, "outcome", outcome).increment();
    }

    public void incrementTerminal(String requestType, RequestStatus status) {
        counter("_requests_total", "Requests reaching a terminal status",
                "type", requestType, "status", status.name()).increment();
    }

    public void incrementRetries(String requestType, ErrorType errorType) {
        counter("_retries_total", "Retried handler attempts",
                "type", requestType, "error", errorType.name()).increment();
    }

    /**
     * Records handler execution latency for a request type.
     */
    public void recordDispatchLatency(String requestType, Duration latency) {
        latencyTimers.computeIfAbsent(requestType, k ->
                Timer.builder(prefix + "_dispatch_latency")
                        .description("Handler execution latency")
                        .tag("type", requestType)
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    // ==================== CACHE ====================

    public void incrementCacheLookup(String category, boolean hit) {
        counter("_cache_lookups_total", "Cache lookups",
                "category", category, "result", hit ? "hit" : "miss").increment();
    }

    public void incrementCacheError(String operation) {
        counter("_cache_errors_total", "Primary cache failures",
                "operation", operation).increment();
    }

    // ==================== POOL ====================

    public void incrementPoolExhausted() {
        counter("_pool_exhausted_total", "Acquire attempts that found the pool exhausted").increment();
    }

    // ==================== OPTIMIZER ====================

    public void incrementRoute(ExecutionTier tier, OptimizedResponse.Source source) {
        counter("_optimizer_routes_total", "Resolved prompts by tier and source",
                "tier", tier != null ? tier.name() : "NONE", "source", source.name()).increment();
    }

    // ==================== GAUGES ====================

    /**
     * Registers a gauge backed by a supplier. Owners call this once at construction.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_" + name, valueSupplier, s -> s.get().doubleValue())
                .description(description)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    private Counter counter(String suffix, String description, String... tags) {
        String key = suffix + String.join(":", tags);
        return counters.computeIfAbsent(key, k ->
                Counter.builder(prefix + suffix)
                        .description(description)
                        .tags(tags)
                        .register(registry)
        );
    }

    @Override
    public void close() {
        registry.close();
    }
}
