package fr.lapetina.lex.core.infrastructure.pool;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens raw connections to the transactional store.
 */
@FunctionalInterface
public interface ConnectionFactory {

    Connection create() throws SQLException;
}
