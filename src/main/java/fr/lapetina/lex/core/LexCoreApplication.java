package fr.lapetina.lex.core;

import fr.lapetina.lex.core.api.HttpServer;
import fr.lapetina.lex.core.infrastructure.config.CoreConfig;
import fr.lapetina.lex.core.scheduler.SchedulerStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.SQLException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process entry point. Builds the core from configuration, starts it with the
 * optional observability server, and tears both down exactly once.
 */
public class LexCoreApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LexCoreApplication.class);

    private final CoreFactory factory;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile HttpServer httpServer;

    public LexCoreApplication(String configPath) {
        this(CoreFactory.create(configPath));
    }

    LexCoreApplication(CoreFactory factory) {
        this.factory = factory;
    }

    /**
     * Opens the pool, starts the workers, then the HTTP server when enabled.
     *
     * @throws SQLException if the store cannot be reached
     * @throws IOException  if the HTTP server cannot bind
     */
    public void start() throws SQLException, IOException {
        factory.start();

        CoreConfig.ServerConfig server = factory.getConfig().getServer();
        if (server.isEnabled()) {
            httpServer = new HttpServer(server.getHost(), server.getPort(), server.getBacklog(),
                    server.getThreads(), factory);
            httpServer.start();
            log.info("Request core accepting work: workers={}, port={}",
                    factory.getConfig().getScheduler().getWorkers(), httpServer.getPort());
        } else {
            log.info("Request core accepting work: workers={}, httpServer=disabled",
                    factory.getConfig().getScheduler().getWorkers());
        }
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public CoreFactory getFactory() {
        return factory;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stops the HTTP server, then the core. Later calls are no-ops.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        requestShutdown();

        HttpServer server = httpServer;
        if (server != null) {
            try {
                server.close();
            } catch (Exception e) {
                log.warn("Error closing HTTP server", e);
            }
        }

        SchedulerStatistics stats = factory.getScheduler().statistics();
        factory.close();
        log.info("Request core stopped: submitted={}, completed={}, failed={}, timedOut={}, cancelled={}",
                stats.submitted(), stats.completed(), stats.failed(), stats.timedOut(), stats.cancelled());
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "lex-core.yaml";

        LexCoreApplication app;
        try {
            app = new LexCoreApplication(configPath);
        } catch (RuntimeException e) {
            log.error("Invalid request core configuration: path={}", configPath, e);
            System.exit(2);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(app::close, "lex-core-shutdown"));
        try {
            app.start();
            app.awaitShutdown();
        } catch (SQLException | IOException e) {
            log.error("Failed to start request core", e);
            app.close();
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            app.close();
        }
    }
}
