package org.tenantwarehouse.service.ingestion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.exceptions.ExtractException;
import org.tenantwarehouse.models.enums.SourceKind;
import org.tenantwarehouse.models.pipeline.SourceDescriptor;
import org.tenantwarehouse.utils.DatabaseConnector;
import org.tenantwarehouse.utils.SqlIdentifiers;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads source tables over JDBC. Without connection options the warehouse database itself is read;
 * {@code jdbcUrl} (or {@code host}/{@code port}/{@code database}) plus credentials point at an
 * external database. Tenant and watermark predicates are always bound as parameters.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseRecordExtractor implements RecordExtractor {

    static final String TABLE_FIELD = "__table__";

    private final JdbcTemplate warehouseJdbcTemplate;
    private final DatabaseConnector databaseConnector;

    @Override
    public boolean supports(SourceKind kind) {
        return kind == SourceKind.DATABASE;
    }

    @Override
    public List<Map<String, Object>> extract(String tenantId, SourceDescriptor source, Instant watermark) {
        if (source.tables().isEmpty()) {
            throw new ConfigurationException("Database source requires at least one table");
        }
        JdbcTemplate jdbcTemplate = resolveJdbcTemplate(source.options());
        List<String> columns = normalizeColumns(source.option("columns"));
        boolean labelRows = source.tables().size() > 1;

        List<Map<String, Object>> rows = new ArrayList<>();
        for (String table : source.tables()) {
            List<Object> params = new ArrayList<>();
            String query = buildSelect(source, table, columns, tenantId, watermark, params);
            List<Map<String, Object>> tableRows = executeQuery(jdbcTemplate, query, params, table);
            if (labelRows) {
                tableRows.forEach(row -> row.put(TABLE_FIELD, table));
            }
            log.info("DatabaseRecordExtractor: read {} rows from {} for tenant {}", tableRows.size(), table, tenantId);
            rows.addAll(tableRows);
        }
        return rows;
    }

    private JdbcTemplate resolveJdbcTemplate(Map<String, Object> options) {
        String jdbcUrl = resolveJdbcUrl(options);
        if (!StringUtils.hasText(jdbcUrl)) {
            return warehouseJdbcTemplate;
        }
        String username = stringValue(firstText(options.get("username"), options.get("user")));
        String password = stringValue(options.get("password"));
        return databaseConnector.buildJdbcTemplate(jdbcUrl, username, password);
    }

    private String resolveJdbcUrl(Map<String, Object> options) {
        String jdbcUrl = firstText(options.get("jdbcUrl"), options.get("url"));
        if (StringUtils.hasText(jdbcUrl)) {
            return jdbcUrl;
        }
        String host = stringValue(options.get("host"));
        String database = firstText(options.get("database"), options.get("dbname"), options.get("db"));
        if (!StringUtils.hasText(host) || !StringUtils.hasText(database)) {
            return null;
        }
        String port = stringValue(options.get("port"));
        String resolvedPort = StringUtils.hasText(port) ? port : "5432";
        return "jdbc:postgresql://" + host + ":" + resolvedPort + "/" + database;
    }

    String buildSelect(SourceDescriptor source,
                       String table,
                       List<String> columns,
                       String tenantId,
                       Instant watermark,
                       List<Object> params) {
        String schema = source.schema();
        String tableName = table;
        if (table.contains(".")) {
            String[] parts = table.split("\\.", 2);
            schema = parts[0];
            tableName = parts[1];
        }
        String projection = columns.isEmpty() ? "*" : SqlIdentifiers.quoteAll(columns);
        StringBuilder sql = new StringBuilder("SELECT ").append(projection)
                .append(" FROM ").append(SqlIdentifiers.qualify(schema, tableName));

        List<String> conditions = new ArrayList<>();
        if (StringUtils.hasText(source.tenantColumn())) {
            conditions.add(SqlIdentifiers.quote(source.tenantColumn()) + "::text = ?");
            params.add(tenantId);
        }
        if (source.isIncremental() && watermark != null) {
            conditions.add(SqlIdentifiers.quote(source.watermarkColumn()) + " > ?");
            params.add(Timestamp.from(watermark));
        }
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        if (source.isIncremental()) {
            sql.append(" ORDER BY ").append(SqlIdentifiers.quote(source.watermarkColumn()));
        }
        return sql.toString();
    }

    private List<String> normalizeColumns(Object columnsSpec) {
        if (columnsSpec == null) {
            return List.of();
        }
        if (columnsSpec instanceof String text) {
            if (!StringUtils.hasText(text) || "*".equals(text.trim())) {
                return List.of();
            }
            return List.of(text.split(","))
                    .stream()
                    .map(String::trim)
                    .filter(StringUtils::hasText)
                    .toList();
        }
        if (columnsSpec instanceof List<?> list) {
            return list.stream()
                    .map(this::stringValue)
                    .filter(StringUtils::hasText)
                    .map(String::trim)
                    .toList();
        }
        throw new ConfigurationException("columns must be a list of column names");
    }

    private List<Map<String, Object>> executeQuery(JdbcTemplate jdbcTemplate,
                                                   String query,
                                                   List<Object> params,
                                                   String table) {
        try {
            return jdbcTemplate.query(query, (resultSet, rowNum) -> {
                Map<String, Object> row = new LinkedHashMap<>();
                int columnCount = resultSet.getMetaData().getColumnCount();
                for (int columnIndex = 1; columnIndex <= columnCount; columnIndex++) {
                    row.put(resultSet.getMetaData().getColumnLabel(columnIndex), resultSet.getObject(columnIndex));
                }
                return row;
            }, params.toArray());
        } catch (DataAccessException exception) {
            throw new ExtractException("Failed to read source table " + table + ": "
                    + exception.getMostSpecificCause().getMessage(), exception);
        }
    }

    private String firstText(Object... values) {
        for (Object value : values) {
            String text = stringValue(value);
            if (StringUtils.hasText(text)) {
                return text;
            }
        }
        return null;
    }

    private String stringValue(Object value) {
        return value == null ? null : value.toString();
    }
}
