package fr.lapetina.lex.core.infrastructure.persistence;

import fr.lapetina.lex.core.domain.model.QueryComplexity;
import fr.lapetina.lex.core.infrastructure.pool.ConnectionPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Interaction history in the transactional store. Every access goes through the pool.
 */
public final class InteractionStore {

    private static final Logger log = LoggerFactory.getLogger(InteractionStore.class);

    static final String CREATE_TABLE =
            "CREATE TABLE IF NOT EXISTS interactions (" +
                    "user_id VARCHAR(128) NOT NULL, " +
                    "prompt_hash VARCHAR(64), " +
                    "complexity VARCHAR(16) NOT NULL, " +
                    "tier VARCHAR(16), " +
                    "cache_hit BOOLEAN NOT NULL, " +
                    "created_at BIGINT NOT NULL)";

    static final String CREATE_INDEX =
            "CREATE INDEX IF NOT EXISTS idx_interactions_user ON interactions (user_id, created_at)";

    private static final String INSERT =
            "INSERT INTO interactions (user_id, prompt_hash, complexity, tier, cache_hit, created_at) " +
                    "VALUES (?, ?, ?, ?, ?, ?)";

    private static final String SELECT_RECENT =
            "SELECT complexity FROM interactions WHERE user_id = ? ORDER BY created_at DESC LIMIT ?";

    private final ConnectionPool pool;

    public InteractionStore(ConnectionPool pool) {
        this.pool = pool;
    }

    public void initSchema() throws SQLException {
        pool.withTransaction(connection -> {
            connection.update(CREATE_TABLE);
            connection.update(CREATE_INDEX);
            return null;
        });
        log.info("Interaction store schema ready");
    }

    public void record(InteractionRecord interaction) throws SQLException {
        pool.withTransaction(connection -> connection.update(INSERT,
                interaction.userId(),
                interaction.promptHash(),
                interaction.complexity().name(),
                interaction.tier() != null ? interaction.tier().name() : null,
                interaction.cacheHit(),
                interaction.createdAt().toEpochMilli()));
    }

    /**
     * Most recent complexities for the user, newest first.
     */
    public List<QueryComplexity> recentComplexities(String userId, int limit) throws SQLException {
        List<Map<String, Object>> rows = pool.query(SELECT_RECENT, userId, limit);
        List<QueryComplexity> complexities = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Object value = row.get("complexity");
            if (value == null) {
                continue;
            }
            try {
                complexities.add(QueryComplexity.valueOf(value.toString()));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping unknown complexity in history: userId={}, value={}", userId, value);
            }
        }
        return complexities;
    }
}
