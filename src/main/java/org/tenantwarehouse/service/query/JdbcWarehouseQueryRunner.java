package org.tenantwarehouse.service.query;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.utils.SqlIdentifiers;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Scopes the connection to the tenant schema through {@code search_path} for the duration of the
 * call and resets it before the connection goes back to the pool.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcWarehouseQueryRunner implements WarehouseQueryRunner {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public List<Map<String, Object>> query(String schema, String sql, List<Object> params, Duration timeout) {
        String searchPath = "SET search_path TO " + SqlIdentifiers.quote(schema) + ", public";
        return jdbcTemplate.execute((ConnectionCallback<List<Map<String, Object>>>) connection -> {
            execute(connection, searchPath);
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setQueryTimeout(timeoutSeconds(timeout));
                for (int i = 0; i < params.size(); i++) {
                    statement.setObject(i + 1, params.get(i));
                }
                try (ResultSet resultSet = statement.executeQuery()) {
                    return new RowMapperResultSetExtractor<>(new ColumnMapRowMapper()).extractData(resultSet);
                }
            } finally {
                try {
                    execute(connection, "RESET search_path");
                } catch (SQLException exception) {
                    log.warn("Could not reset search_path after query in {}: {}", schema, exception.getMessage());
                }
            }
        });
    }

    private void execute(Connection connection, String sql) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }

    private int timeoutSeconds(Duration timeout) {
        long seconds = (timeout.toMillis() + 999) / 1000;
        return (int) Math.max(1, Math.min(seconds, Integer.MAX_VALUE));
    }
}
