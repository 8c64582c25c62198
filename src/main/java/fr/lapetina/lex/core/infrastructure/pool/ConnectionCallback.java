package fr.lapetina.lex.core.infrastructure.pool;

import java.sql.SQLException;

/**
 * Work performed with an exclusively owned connection.
 */
@FunctionalInterface
public interface ConnectionCallback<T> {

    T apply(PooledConnection connection) throws SQLException;
}
