package fr.lapetina.lex.core.infrastructure.pool;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionPoolTest {

    private ConnectionPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
    }

    private ConnectionPool startPool(int minSize, int maxSize, Duration connectionTimeout) throws SQLException {
        String url = "jdbc:h2:mem:pool-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        pool = ConnectionPool.builder()
                .connectionFactory(new JdbcConnectionFactory(url, "sa", ""))
                .minSize(minSize)
                .maxSize(maxSize)
                .idleTimeout(Duration.ofMillis(1))
                .connectionTimeout(connectionTimeout)
                .maintenanceInterval(Duration.ofHours(1))
                .build();
        pool.start();
        pool.execute("CREATE TABLE items (id INT PRIMARY KEY, name VARCHAR(32))");
        return pool;
    }

    private long itemCount() throws SQLException {
        Object count = pool.query("SELECT COUNT(*) AS n FROM items").get(0).get("n");
        return ((Number) count).longValue();
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("should open minSize connections on start")
        void shouldOpenMinSize() throws SQLException {
            startPool(2, 4, Duration.ofSeconds(1));

            assertThat(pool.totalCount()).isEqualTo(2);
            assertThat(pool.availableCount()).isEqualTo(2);
            assertThat(pool.isRunning()).isTrue();
        }

        @Test
        @DisplayName("should return rows keyed by lower-cased column label")
        void shouldQueryRows() throws SQLException {
            startPool(1, 2, Duration.ofSeconds(1));
            pool.execute("INSERT INTO items (id, name) VALUES (?, ?)", 1, "first");

            List<Map<String, Object>> rows = pool.query("SELECT ID, NAME FROM items WHERE id = ?", 1);

            assertThat(rows).hasSize(1);
            assertThat(rows.get(0)).containsEntry("name", "first");
        }

        @Test
        @DisplayName("should count failed queries in statistics")
        void shouldCountFailures() throws SQLException {
            startPool(1, 2, Duration.ofSeconds(1));

            assertThatThrownBy(() -> pool.query("SELECT * FROM missing_table"))
                    .isInstanceOf(SQLException.class);

            PoolStatistics stats = pool.statistics();
            assertThat(stats.failedQueries()).isEqualTo(1);
            assertThat(stats.successfulQueries()).isEqualTo(1);
            assertThat(stats.successRatePercent()).isEqualTo(50.0);
        }
    }

    @Nested
    @DisplayName("Transactions")
    class Transactions {

        @Test
        @DisplayName("should commit every statement together")
        void shouldCommitTogether() throws SQLException {
            startPool(1, 2, Duration.ofSeconds(1));

            int[] counts = pool.executeTransaction(List.of(
                    SqlStatement.of("INSERT INTO items (id, name) VALUES (?, ?)", 1, "a"),
                    SqlStatement.of("INSERT INTO items (id, name) VALUES (?, ?)", 2, "b")));

            assertThat(counts).containsExactly(1, 1);
            assertThat(itemCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should roll back every statement when one fails")
        void shouldRollBackOnFailure() throws SQLException {
            startPool(1, 2, Duration.ofSeconds(1));

            assertThatThrownBy(() -> pool.executeTransaction(List.of(
                    SqlStatement.of("INSERT INTO items (id, name) VALUES (?, ?)", 1, "a"),
                    SqlStatement.of("INSERT INTO items (id, name) VALUES (?, ?)", 1, "duplicate"))))
                    .isInstanceOf(SQLException.class);

            assertThat(itemCount()).isZero();
            assertThat(pool.totalCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should roll back when the callback throws an unchecked exception")
        void shouldRollBackOnRuntimeException() throws SQLException {
            startPool(1, 2, Duration.ofSeconds(1));

            assertThatThrownBy(() -> pool.withTransaction(connection -> {
                connection.update("INSERT INTO items (id, name) VALUES (?, ?)", 1, "a");
                throw new IllegalStateException("boom");
            })).isInstanceOf(IllegalStateException.class);

            assertThat(itemCount()).isZero();
        }

        @Test
        @DisplayName("should destroy a connection released with an open transaction")
        void shouldNotRecycleOpenTransaction() throws SQLException {
            startPool(1, 2, Duration.ofSeconds(1));

            String leakedId = pool.withConnection(connection -> {
                connection.begin();
                connection.update("INSERT INTO items (id, name) VALUES (?, ?)", 1, "uncommitted");
                return connection.getId();
            });

            assertThat(pool.statistics().destroyed()).isEqualTo(1);
            assertThat(itemCount()).isZero();
            PooledConnection next = pool.acquire();
            try {
                assertThat(next.getId()).isNotEqualTo(leakedId);
                assertThat(next.isTransactionActive()).isFalse();
            } finally {
                pool.release(next);
            }
        }
    }

    @Nested
    @DisplayName("Capacity")
    class Capacity {

        @Test
        @DisplayName("should throw PoolExhaustedException after the connection timeout")
        void shouldThrowWhenExhausted() throws SQLException {
            startPool(1, 1, Duration.ofMillis(100));
            PooledConnection held = pool.acquire();
            try {
                assertThatThrownBy(() -> pool.query("SELECT 1"))
                        .isInstanceOfSatisfying(PoolExhaustedException.class,
                                e -> assertThat(e.getMaxSize()).isEqualTo(1));
            } finally {
                pool.release(held);
            }
            assertThat(pool.statistics().exhausted()).isEqualTo(1);
            assertThat(pool.query("SELECT 1 AS one")).hasSize(1);
        }

        @Test
        @DisplayName("should hand a released connection to a waiting caller")
        void shouldWakeWaiter() throws Exception {
            startPool(1, 1, Duration.ofSeconds(5));
            PooledConnection held = pool.acquire();
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                CountDownLatch started = new CountDownLatch(1);
                Future<String> waiter = executor.submit(() -> {
                    started.countDown();
                    return pool.withConnection(PooledConnection::getId);
                });
                started.await();
                Thread.sleep(50);
                pool.release(held);

                assertThat(waiter.get(2, TimeUnit.SECONDS)).isEqualTo(held.getId());
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("should never exceed maxSize under contention")
        void shouldRespectMaxSize() throws Exception {
            startPool(0, 3, Duration.ofSeconds(5));
            AtomicInteger peak = new AtomicInteger();
            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int i = 0; i < 24; i++) {
                    futures.add(executor.submit(() -> pool.withConnection(connection -> {
                        peak.accumulateAndGet(pool.totalCount(), Math::max);
                        try {
                            Thread.sleep(10);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return connection.query("SELECT 1 AS one");
                    })));
                }
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertThat(peak.get()).isLessThanOrEqualTo(3);
            assertThat(pool.totalCount()).isLessThanOrEqualTo(3);
            assertThat(pool.activeCount()).isZero();
        }

        @Test
        @DisplayName("should close idle connections down to minSize")
        void shouldEvictIdle() throws Exception {
            startPool(1, 3, Duration.ofSeconds(1));
            PooledConnection a = pool.acquire();
            PooledConnection b = pool.acquire();
            PooledConnection c = pool.acquire();
            pool.release(a);
            pool.release(b);
            pool.release(c);
            assertThat(pool.totalCount()).isEqualTo(3);

            Thread.sleep(20);

            assertThat(pool.evictIdle()).isEqualTo(2);
            assertThat(pool.totalCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should refuse acquisition after close")
        void shouldRefuseAfterClose() throws SQLException {
            startPool(1, 2, Duration.ofSeconds(1));

            pool.close();

            assertThat(pool.isRunning()).isFalse();
            assertThat(pool.totalCount()).isZero();
            assertThatThrownBy(() -> pool.query("SELECT 1")).isInstanceOf(IllegalStateException.class);
        }
    }
}
