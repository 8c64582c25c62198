package fr.lapetina.lex.core.infrastructure.pool;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A parameterized statement, used for multi-statement transactions.
 */
public record SqlStatement(String sql, List<Object> params) {

    public SqlStatement {
        Objects.requireNonNull(sql, "SQL is required");
        // List.copyOf rejects null parameters, which JDBC allows
        params = params != null ? Collections.unmodifiableList(new ArrayList<>(params)) : List.of();
    }

    public static SqlStatement of(String sql, Object... params) {
        return new SqlStatement(sql, Arrays.asList(params));
    }
}
