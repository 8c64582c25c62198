package fr.lapetina.lex.core.infrastructure.pool;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;

/**
 * Opens connections through {@link DriverManager}. The driver is resolved from the URL
 * ({@code jdbc:sqlite:...} in production, {@code jdbc:h2:mem:...} in tests).
 */
public final class JdbcConnectionFactory implements ConnectionFactory {

    private final String jdbcUrl;
    private final Properties properties;

    public JdbcConnectionFactory(String jdbcUrl, String username, String password) {
        this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "JDBC URL is required");
        this.properties = new Properties();
        if (username != null) {
            properties.setProperty("user", username);
        }
        if (password != null) {
            properties.setProperty("password", password);
        }
    }

    public JdbcConnectionFactory(String jdbcUrl) {
        this(jdbcUrl, null, null);
    }

    @Override
    public Connection create() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl, properties);
        connection.setAutoCommit(true);
        return connection;
    }

    @Override
    public String toString() {
        return "JdbcConnectionFactory{url='" + jdbcUrl + "'}";
    }
}
