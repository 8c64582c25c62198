package fr.lapetina.lex.core.infrastructure.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A reusable handle to the transactional store, exclusively owned by one caller
 * while checked out.
 *
 * <p>Bookkeeping (timestamps, counters, transaction flag) is guarded by the
 * connection's own lock; statement execution runs outside it. A connection that
 * reported a connection-class SQL error (SQLState {@code 08xxx}) is marked broken
 * and is never recycled.
 */
public final class PooledConnection {

    private static final Logger log = LoggerFactory.getLogger(PooledConnection.class);

    private final String id;
    private final Connection handle;
    private final Instant createdAt;
    private final PoolCounters counters;
    private final ReentrantLock lock = new ReentrantLock();

    private Instant lastUsedAt;
    private long queryCount;
    private boolean transactionActive;
    private boolean broken;

    PooledConnection(String id, Connection handle, Instant createdAt, PoolCounters counters) {
        this.id = id;
        this.handle = handle;
        this.createdAt = createdAt;
        this.lastUsedAt = createdAt;
        this.counters = counters;
    }

    /**
     * Executes a query and materializes its rows. Column labels are lower-cased.
     */
    public List<Map<String, Object>> query(String sql, Object... params) throws SQLException {
        long start = System.nanoTime();
        boolean success = false;
        try (PreparedStatement statement = prepare(sql, params);
             ResultSet rs = statement.executeQuery()) {
            List<Map<String, Object>> rows = new ArrayList<>();
            ResultSetMetaData meta = rs.getMetaData();
            int columns = meta.getColumnCount();
            while (rs.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= columns; i++) {
                    row.put(meta.getColumnLabel(i).toLowerCase(Locale.ROOT), rs.getObject(i));
                }
                rows.add(row);
            }
            success = true;
            return rows;
        } catch (SQLException e) {
            inspect(e);
            throw e;
        } finally {
            afterStatement(success, System.nanoTime() - start);
        }
    }

    /**
     * Executes an insert, update, delete or DDL statement.
     *
     * @return affected row count
     */
    public int update(String sql, Object... params) throws SQLException {
        long start = System.nanoTime();
        boolean success = false;
        try (PreparedStatement statement = prepare(sql, params)) {
            int count = statement.executeUpdate();
            success = true;
            return count;
        } catch (SQLException e) {
            inspect(e);
            throw e;
        } finally {
            afterStatement(success, System.nanoTime() - start);
        }
    }

    public void begin() throws SQLException {
        lock.lock();
        try {
            if (transactionActive) {
                throw new SQLException("Transaction already active on connection " + id);
            }
            handle.setAutoCommit(false);
            transactionActive = true;
        } finally {
            lock.unlock();
        }
    }

    public void commit() throws SQLException {
        lock.lock();
        try {
            if (!transactionActive) {
                throw new SQLException("No active transaction on connection " + id);
            }
            handle.commit();
            handle.setAutoCommit(true);
            transactionActive = false;
        } catch (SQLException e) {
            inspect(e);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    public void rollback() throws SQLException {
        lock.lock();
        try {
            if (!transactionActive) {
                return;
            }
            handle.rollback();
            handle.setAutoCommit(true);
            transactionActive = false;
        } catch (SQLException e) {
            broken = true;
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * True if the connection can go back to the available set.
     */
    boolean isReusable() {
        lock.lock();
        try {
            return !broken && !transactionActive && !handle.isClosed();
        } catch (SQLException e) {
            return false;
        } finally {
            lock.unlock();
        }
    }

    boolean isIdleLongerThan(Duration idleTimeout, Instant now) {
        lock.lock();
        try {
            return Duration.between(lastUsedAt, now).compareTo(idleTimeout) > 0;
        } finally {
            lock.unlock();
        }
    }

    void touch(Instant now) {
        lock.lock();
        try {
            lastUsedAt = now;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rolls back any open transaction, then closes the underlying handle.
     */
    void destroy() {
        try {
            rollback();
        } catch (SQLException e) {
            log.warn("Rollback before close failed: connectionId={}, error={}", id, e.getMessage());
        }
        try {
            handle.close();
        } catch (SQLException e) {
            log.warn("Error closing connection: connectionId={}", id, e);
        }
    }

    void markBroken() {
        lock.lock();
        try {
            broken = true;
        } finally {
            lock.unlock();
        }
    }

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastUsedAt() {
        lock.lock();
        try {
            return lastUsedAt;
        } finally {
            lock.unlock();
        }
    }

    public long getQueryCount() {
        lock.lock();
        try {
            return queryCount;
        } finally {
            lock.unlock();
        }
    }

    public boolean isTransactionActive() {
        lock.lock();
        try {
            return transactionActive;
        } finally {
            lock.unlock();
        }
    }

    public boolean isBroken() {
        lock.lock();
        try {
            return broken;
        } finally {
            lock.unlock();
        }
    }

    private PreparedStatement prepare(String sql, Object[] params) throws SQLException {
        PreparedStatement statement = handle.prepareStatement(sql);
        try {
            for (int i = 0; i < params.length; i++) {
                statement.setObject(i + 1, params[i]);
            }
            return statement;
        } catch (SQLException e) {
            statement.close();
            throw e;
        }
    }

    private void afterStatement(boolean success, long nanos) {
        lock.lock();
        try {
            queryCount++;
            lastUsedAt = Instant.now();
        } finally {
            lock.unlock();
        }
        counters.recordQuery(success, nanos);
    }

    private void inspect(SQLException e) {
        String state = e.getSQLState();
        if (state != null && state.startsWith("08")) {
            markBroken();
            log.warn("Connection marked broken: connectionId={}, sqlState={}", id, state);
        }
    }

    @Override
    public String toString() {
        return "PooledConnection{" +
                "id='" + id + '\'' +
                ", queries=" + getQueryCount() +
                ", transactionActive=" + isTransactionActive() +
                ", broken=" + isBroken() +
                '}';
    }
}
