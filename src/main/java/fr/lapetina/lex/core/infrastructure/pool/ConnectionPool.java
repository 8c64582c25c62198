package fr.lapetina.lex.core.infrastructure.pool;

import fr.lapetina.lex.core.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded pool of {@link PooledConnection}s to the transactional store.
 *
 * <p>Invariants, all maintained under the pool lock:
 * <ul>
 *   <li>connections in {@code all} plus connections being opened never exceed {@code maxSize}</li>
 *   <li>every connection in {@code available} is also in {@code all} and not checked out</li>
 *   <li>a connection with an active transaction, or marked broken, is never put back in {@code available}</li>
 * </ul>
 *
 * <p>Opening and closing physical connections happens outside the lock.
 * A scheduled maintenance task closes connections idle beyond {@code idleTimeout}
 * while the pool stays at or above {@code minSize}.
 */
public final class ConnectionPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);

    private static final Duration LONG_WAIT = Duration.ofMillis(100);

    private final ConnectionFactory connectionFactory;
    private final int minSize;
    private final int maxSize;
    private final Duration idleTimeout;
    private final Duration connectionTimeout;
    private final Duration maintenanceInterval;
    private final MetricsRegistry metricsRegistry;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition returned = lock.newCondition();
    private final Deque<PooledConnection> available = new ArrayDeque<>();
    private final Map<String, PooledConnection> all = new LinkedHashMap<>();
    private int pendingCreates;

    private final PoolCounters counters = new PoolCounters();
    private final AtomicInteger idSequence = new AtomicInteger();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService maintenanceExecutor;

    private ConnectionPool(Builder builder) {
        this.connectionFactory = builder.connectionFactory;
        this.minSize = builder.minSize;
        this.maxSize = builder.maxSize;
        this.idleTimeout = builder.idleTimeout;
        this.connectionTimeout = builder.connectionTimeout;
        this.maintenanceInterval = builder.maintenanceInterval;
        this.metricsRegistry = builder.metricsRegistry;

        if (metricsRegistry != null) {
            metricsRegistry.registerGauge("pool_active_connections", "Checked-out connections", this::activeCount);
            metricsRegistry.registerGauge("pool_available_connections", "Idle pooled connections", this::availableCount);
        }

        log.info("ConnectionPool created: minSize={}, maxSize={}, idleTimeoutMs={}, connectionTimeoutMs={}",
                minSize, maxSize, idleTimeout.toMillis(), connectionTimeout.toMillis());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Opens {@code minSize} connections and starts the maintenance schedule.
     *
     * @throws SQLException if an initial connection cannot be opened
     */
    public void start() throws SQLException {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            for (int i = 0; i < minSize; i++) {
                PooledConnection connection = open();
                lock.lock();
                try {
                    all.put(connection.getId(), connection);
                    available.addLast(connection);
                } finally {
                    lock.unlock();
                }
            }
        } catch (SQLException e) {
            close();
            throw e;
        }

        maintenanceExecutor = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "pool-maintenance"));
        long intervalMs = maintenanceInterval.toMillis();
        maintenanceExecutor.scheduleWithFixedDelay(this::runMaintenance, intervalMs, intervalMs, TimeUnit.MILLISECONDS);

        log.info("ConnectionPool started with {} connections", minSize);
    }

    // ==================== SCOPED ACQUISITION ====================

    /**
     * Runs the callback with an exclusively owned connection and releases it on every exit path.
     *
     * @throws PoolExhaustedException if no connection could be obtained in time
     */
    public <T> T withConnection(ConnectionCallback<T> callback) throws SQLException {
        PooledConnection connection = acquire();
        try {
            return callback.apply(connection);
        } finally {
            release(connection);
        }
    }

    /**
     * Like {@link #withConnection} inside a transaction. Commits on success and rolls back
     * on any error before the connection is released.
     */
    public <T> T withTransaction(ConnectionCallback<T> callback) throws SQLException {
        PooledConnection connection = acquire();
        try {
            connection.begin();
            try {
                T result = callback.apply(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException | Error e) {
                try {
                    connection.rollback();
                } catch (SQLException rollbackError) {
                    e.addSuppressed(rollbackError);
                }
                throw e;
            }
        } finally {
            release(connection);
        }
    }

    public List<Map<String, Object>> query(String sql, Object... params) throws SQLException {
        return withConnection(connection -> connection.query(sql, params));
    }

    public int execute(String sql, Object... params) throws SQLException {
        return withConnection(connection -> connection.update(sql, params));
    }

    /**
     * Executes the statements atomically.
     *
     * @return affected row counts, one per statement
     */
    public int[] executeTransaction(List<SqlStatement> statements) throws SQLException {
        return withTransaction(connection -> {
            int[] counts = new int[statements.size()];
            for (int i = 0; i < statements.size(); i++) {
                SqlStatement statement = statements.get(i);
                counts[i] = connection.update(statement.sql(), statement.params().toArray());
            }
            return counts;
        });
    }

    // ==================== ACQUIRE / RELEASE ====================

    PooledConnection acquire() throws SQLException {
        long startNanos = System.nanoTime();
        long remainingNanos = connectionTimeout.toNanos();
        List<PooledConnection> discarded = new ArrayList<>();

        try {
            lock.lock();
            try {
                while (true) {
                    if (!running.get()) {
                        throw new IllegalStateException("Connection pool is not running");
                    }

                    PooledConnection connection = available.pollFirst();
                    if (connection != null) {
                        if (connection.isReusable()) {
                            counters.checkouts.increment();
                            recordWait(startNanos);
                            log.debug("Connection acquired: connectionId={}", connection.getId());
                            return connection;
                        }
                        all.remove(connection.getId());
                        counters.destroyed.increment();
                        discarded.add(connection);
                        continue;
                    }

                    if (all.size() + pendingCreates < maxSize) {
                        pendingCreates++;
                        break;
                    }

                    if (remainingNanos <= 0L) {
                        counters.exhausted.increment();
                        if (metricsRegistry != null) {
                            metricsRegistry.incrementPoolExhausted();
                        }
                        log.warn("Connection pool exhausted: size={}, maxSize={}", all.size(), maxSize);
                        throw new PoolExhaustedException(maxSize, Duration.ofNanos(System.nanoTime() - startNanos));
                    }
                    try {
                        remainingNanos = returned.awaitNanos(remainingNanos);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new SQLException("Interrupted while waiting for a connection", e);
                    }
                }
            } finally {
                lock.unlock();
            }
        } finally {
            discarded.forEach(PooledConnection::destroy);
        }

        // Capacity reserved, open the physical connection outside the lock
        PooledConnection connection;
        try {
            connection = open();
        } catch (SQLException | RuntimeException e) {
            lock.lock();
            try {
                pendingCreates--;
                returned.signal();
            } finally {
                lock.unlock();
            }
            throw e;
        }

        lock.lock();
        try {
            pendingCreates--;
            all.put(connection.getId(), connection);
        } finally {
            lock.unlock();
        }
        counters.checkouts.increment();
        recordWait(startNanos);
        return connection;
    }

    void release(PooledConnection connection) {
        boolean destroy;
        lock.lock();
        try {
            if (!all.containsKey(connection.getId())) {
                return;
            }
            destroy = !running.get() || !connection.isReusable();
            if (destroy) {
                all.remove(connection.getId());
                counters.destroyed.increment();
            } else {
                connection.touch(Instant.now());
                available.addLast(connection);
            }
            returned.signal();
        } finally {
            lock.unlock();
        }

        if (destroy) {
            log.debug("Connection destroyed on release: connectionId={}, transactionActive={}, broken={}",
                    connection.getId(), connection.isTransactionActive(), connection.isBroken());
            connection.destroy();
        }
    }

    // ==================== MAINTENANCE ====================

    /**
     * Closes connections idle beyond the idle timeout, never shrinking the pool below {@code minSize}.
     *
     * @return number of connections closed
     */
    int evictIdle() {
        Instant now = Instant.now();
        List<PooledConnection> evicted = new ArrayList<>();

        lock.lock();
        try {
            Iterator<PooledConnection> it = available.iterator();
            while (it.hasNext() && all.size() > minSize) {
                PooledConnection connection = it.next();
                if (connection.isIdleLongerThan(idleTimeout, now) || !connection.isReusable()) {
                    it.remove();
                    all.remove(connection.getId());
                    counters.destroyed.increment();
                    evicted.add(connection);
                }
            }
        } finally {
            lock.unlock();
        }

        evicted.forEach(PooledConnection::destroy);
        if (!evicted.isEmpty()) {
            log.info("Pool maintenance closed idle connections: count={}, remaining={}", evicted.size(), totalCount());
        }
        return evicted.size();
    }

    private void runMaintenance() {
        try {
            evictIdle();
        } catch (Exception e) {
            log.error("Pool maintenance failed", e);
        }
    }

    // ==================== STATISTICS ====================

    public PoolStatistics statistics() {
        int total;
        int idle;
        lock.lock();
        try {
            total = all.size();
            idle = available.size();
        } finally {
            lock.unlock();
        }
        long ok = counters.successfulQueries.sum();
        long failed = counters.failedQueries.sum();
        long queries = ok + failed;

        return new PoolStatistics(
                minSize,
                maxSize,
                total,
                total - idle,
                idle,
                counters.created.sum(),
                counters.destroyed.sum(),
                counters.checkouts.sum(),
                queries,
                ok,
                failed,
                queries == 0 ? 0.0 : counters.queryNanos.sum() / 1_000_000.0 / queries,
                queries == 0 ? 100.0 : ok * 100.0 / queries,
                counters.longWaits.sum(),
                counters.exhausted.sum()
        );
    }

    public int totalCount() {
        lock.lock();
        try {
            return all.size();
        } finally {
            lock.unlock();
        }
    }

    public int availableCount() {
        lock.lock();
        try {
            return available.size();
        } finally {
            lock.unlock();
        }
    }

    public int activeCount() {
        lock.lock();
        try {
            return all.size() - available.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    // ==================== INTERNALS ====================

    private PooledConnection open() throws SQLException {
        Connection handle = connectionFactory.create();
        PooledConnection connection = new PooledConnection(
                "conn-" + idSequence.incrementAndGet(), handle, Instant.now(), counters);
        counters.created.increment();
        log.debug("Connection opened: connectionId={}", connection.getId());
        return connection;
    }

    private void recordWait(long startNanos) {
        if (System.nanoTime() - startNanos > LONG_WAIT.toNanos()) {
            counters.longWaits.increment();
        }
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Shutting down ConnectionPool...");

        if (maintenanceExecutor != null) {
            maintenanceExecutor.shutdown();
            try {
                if (!maintenanceExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    maintenanceExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                maintenanceExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        List<PooledConnection> idle;
        lock.lock();
        try {
            idle = new ArrayList<>(available);
            for (PooledConnection connection : idle) {
                all.remove(connection.getId());
            }
            available.clear();
            counters.destroyed.add(idle.size());
            returned.signalAll();
        } finally {
            lock.unlock();
        }
        idle.forEach(PooledConnection::destroy);

        log.info("ConnectionPool shut down: closedIdle={}, stillCheckedOut={}", idle.size(), totalCount());
    }

    public static final class Builder {
        private ConnectionFactory connectionFactory;
        private int minSize = 20;
        private int maxSize = 50;
        private Duration idleTimeout = Duration.ofMinutes(5);
        private Duration connectionTimeout = Duration.ofSeconds(30);
        private Duration maintenanceInterval = Duration.ofSeconds(60);
        private MetricsRegistry metricsRegistry;

        public Builder connectionFactory(ConnectionFactory connectionFactory) {
            this.connectionFactory = connectionFactory;
            return this;
        }

        public Builder minSize(int minSize) {
            this.minSize = minSize;
            return this;
        }

        public Builder maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Builder connectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        public Builder maintenanceInterval(Duration maintenanceInterval) {
            this.maintenanceInterval = maintenanceInterval;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public ConnectionPool build() {
            Objects.requireNonNull(connectionFactory, "Connection factory is required");
            if (minSize < 0 || maxSize < 1 || minSize > maxSize) {
                throw new IllegalArgumentException("Require 0 <= minSize <= maxSize and maxSize >= 1");
            }
            return new ConnectionPool(this);
        }
    }
}
