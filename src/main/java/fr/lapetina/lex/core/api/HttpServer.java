package fr.lapetina.lex.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.lex.core.CoreFactory;
import fr.lapetina.lex.core.infrastructure.cache.CacheStatistics;
import fr.lapetina.lex.core.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.lex.core.infrastructure.pool.ConnectionPool;
import fr.lapetina.lex.core.scheduler.RequestScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /stats - Aggregated scheduler, pool, cache and optimizer statistics
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final CoreFactory factory;
    private final MetricsRegistry metricsRegistry;

    public HttpServer(String host, int port, int backlog, int threads, CoreFactory factory) throws IOException {
        this.factory = factory;
        this.metricsRegistry = factory.getMetricsRegistry();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(host, port), backlog
        );

        this.executor = Executors.newFixedThreadPool(threads, new HttpThreadFactory());
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/stats", new StatsHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());

        log.info("HTTP server configured on {}:{}", host, port);
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Actual bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== STATS HANDLER ====================

    private class StatsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            try {
                sendJson(exchange, 200, factory.statistics());
            } catch (RuntimeException e) {
                log.error("Failed to collect statistics", e);
                sendError(exchange, 500, "Failed to collect statistics");
            }
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            RequestScheduler scheduler = factory.getScheduler();
            ConnectionPool pool = factory.getConnectionPool();
            CacheStatistics cache = factory.getResponseCache().statistics();

            Map<String, Object> health = new LinkedHashMap<>();
            String status = determineOverallHealth(scheduler, pool, cache);
            health.put("status", status);
            health.put("timestamp", System.currentTimeMillis());
            health.put("schedulerRunning", scheduler.isRunning());
            health.put("queueDepth", scheduler.queueDepth());
            health.put("poolRunning", pool.isRunning());
            health.put("poolAvailable", pool.availableCount());
            health.put("cacheDegraded", cache.degraded());

            sendJson(exchange, "DOWN".equals(status) ? 503 : 200, health);
        }

        private String determineOverallHealth(RequestScheduler scheduler, ConnectionPool pool, CacheStatistics cache) {
            if (!scheduler.isRunning() || !pool.isRunning()) {
                return "DOWN";
            }
            // Cache outages are served from the fallback
            if (cache.degraded()) {
                return "DEGRADED";
            }
            return "UP";
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message);
        sendJson(exchange, statusCode, error);
    }

    private static final class HttpThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "http-server-" + counter.getAndIncrement());
            t.setDaemon(false);
            return t;
        }
    }
}
