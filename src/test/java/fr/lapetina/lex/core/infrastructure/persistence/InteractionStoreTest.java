package fr.lapetina.lex.core.infrastructure.persistence;

import fr.lapetina.lex.core.domain.model.ExecutionTier;
import fr.lapetina.lex.core.domain.model.QueryComplexity;
import fr.lapetina.lex.core.infrastructure.pool.ConnectionPool;
import fr.lapetina.lex.core.infrastructure.pool.JdbcConnectionFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class InteractionStoreTest {

    private ConnectionPool pool;
    private InteractionStore store;

    @BeforeEach
    void setUp() throws SQLException {
        pool = ConnectionPool.builder()
                .connectionFactory(new JdbcConnectionFactory(
                        "jdbc:h2:mem:interactions-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", ""))
                .minSize(1)
                .maxSize(2)
                .build();
        pool.start();
        store = new InteractionStore(pool);
        store.initSchema();
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    private InteractionRecord record(String userId, QueryComplexity complexity, long epochSecond) {
        return new InteractionRecord(userId, "hash", complexity, ExecutionTier.BALANCED, false,
                Instant.ofEpochSecond(epochSecond));
    }

    @Test
    @DisplayName("should create the schema idempotently")
    void shouldInitSchemaTwice() throws SQLException {
        store.initSchema();

        assertThat(store.recentComplexities("nobody", 10)).isEmpty();
    }

    @Test
    @DisplayName("should return the newest complexities first, up to the limit")
    void shouldReturnNewestFirst() throws SQLException {
        store.record(record("alice", QueryComplexity.SIMPLE, 100));
        store.record(record("alice", QueryComplexity.COMPLEX, 300));
        store.record(record("alice", QueryComplexity.MODERATE, 200));

        assertThat(store.recentComplexities("alice", 2))
                .containsExactly(QueryComplexity.COMPLEX, QueryComplexity.MODERATE);
    }

    @Test
    @DisplayName("should keep users apart")
    void shouldIsolateUsers() throws SQLException {
        store.record(record("alice", QueryComplexity.SIMPLE, 100));
        store.record(record("bob", QueryComplexity.CREATIVE, 200));

        assertThat(store.recentComplexities("bob", 10)).containsExactly(QueryComplexity.CREATIVE);
    }

    @Test
    @DisplayName("should store template answers without a tier")
    void shouldAllowNullTier() throws SQLException {
        store.record(new InteractionRecord("carol", null, QueryComplexity.SIMPLE, null, true, null));

        assertThat(store.recentComplexities("carol", 10)).containsExactly(QueryComplexity.SIMPLE);
        assertThat(pool.query("SELECT tier FROM interactions WHERE user_id = ?", "carol").get(0).get("tier"))
                .isNull();
    }

    @Test
    @DisplayName("should skip rows with an unknown complexity")
    void shouldSkipUnknownComplexity() throws SQLException {
        pool.execute("INSERT INTO interactions (user_id, complexity, cache_hit, created_at) VALUES (?, ?, ?, ?)",
                "dave", "LEGENDARY", false, 50L);
        store.record(record("dave", QueryComplexity.MODERATE, 100));

        assertThat(store.recentComplexities("dave", 10)).containsExactly(QueryComplexity.MODERATE);
    }
}
