/**
 * Bounded JDBC connection pool with scoped acquisition.
 *
 * <p>{@link fr.lapetina.lex.core.infrastructure.pool.ConnectionPool#withConnection} and
 * {@link fr.lapetina.lex.core.infrastructure.pool.ConnectionPool#withTransaction} release
 * the connection on every exit path. A connection left in a transaction or broken by a
 * connection-class error is destroyed instead of returned.
 */
package fr.lapetina.lex.core.infrastructure.pool;
