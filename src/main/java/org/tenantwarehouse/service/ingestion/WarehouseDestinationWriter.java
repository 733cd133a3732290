package org.tenantwarehouse.service.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.tenantwarehouse.exceptions.LoadException;
import org.tenantwarehouse.utils.SqlIdentifiers;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Upserts records into a warehouse table in batches. Record fields are matched to table columns
 * case-insensitively; fields without a column are dropped. Rows conflicting on the key columns are
 * updated in place, so re-loading the same records is idempotent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WarehouseDestinationWriter {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public int write(String schema,
                     String table,
                     List<String> keyColumns,
                     List<Map<String, Object>> records,
                     int batchSize) {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        SqlIdentifiers.requireSafe(schema);
        SqlIdentifiers.requireSafe(table);
        if (keyColumns == null || keyColumns.isEmpty()) {
            throw new LoadException("Warehouse destination " + schema + "." + table + " has no key columns");
        }

        Map<String, String> columnLookup = buildColumnLookup(resolveDestinationColumns(schema, table));
        if (columnLookup.isEmpty()) {
            throw new LoadException("Destination table " + schema + "." + table + " does not exist");
        }
        List<String> keys = new ArrayList<>();
        for (String key : keyColumns) {
            String resolved = columnLookup.get(key.toLowerCase(Locale.ROOT));
            if (resolved == null) {
                throw new LoadException("Key column " + key + " is not a column of " + schema + "." + table);
            }
            keys.add(resolved);
        }

        List<Map<String, Object>> rows = normalize(records, columnLookup);
        for (int i = 0; i < rows.size(); i++) {
            for (String key : keys) {
                if (rows.get(i).get(key) == null) {
                    throw new LoadException("Record " + i + " has no value for key column " + key);
                }
            }
        }

        List<String> columns = new ArrayList<>(collectColumnOrder(rows));
        String sql = buildUpsert(SqlIdentifiers.qualify(schema, table), columns, keys);
        int effectiveBatchSize = Math.max(1, batchSize);
        int written = 0;
        for (int start = 0; start < rows.size(); start += effectiveBatchSize) {
            List<Map<String, Object>> batch = rows.subList(start, Math.min(rows.size(), start + effectiveBatchSize));
            upsertBatch(sql, columns, batch);
            written += batch.size();
        }
        log.info("WarehouseDestinationWriter: upserted {} rows into {}.{}", written, schema, table);
        return written;
    }

    private List<String> resolveDestinationColumns(String schema, String table) {
        try {
            return jdbcTemplate.queryForList(
                    "SELECT column_name FROM information_schema.columns WHERE table_schema = ? AND table_name = ? "
                            + "ORDER BY ordinal_position",
                    String.class, schema, table);
        } catch (DataAccessException exception) {
            throw new LoadException("Failed to inspect destination table " + schema + "." + table + ": "
                    + exception.getMostSpecificCause().getMessage(), exception);
        }
    }

    private Map<String, String> buildColumnLookup(List<String> columns) {
        Map<String, String> lookup = new LinkedHashMap<>();
        for (String column : columns) {
            if (column != null) {
                lookup.put(column.toLowerCase(Locale.ROOT), column);
            }
        }
        return lookup;
    }

    private List<Map<String, Object>> normalize(List<Map<String, Object>> records, Map<String, String> destinationLookup) {
        List<Map<String, Object>> normalized = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : record.entrySet()) {
                if (entry.getKey() == null) {
                    continue;
                }
                String resolvedColumn = destinationLookup.get(entry.getKey().toLowerCase(Locale.ROOT));
                if (resolvedColumn != null) {
                    row.put(resolvedColumn, entry.getValue());
                }
            }
            normalized.add(row);
        }
        return normalized;
    }

    private Set<String> collectColumnOrder(List<Map<String, Object>> rows) {
        Set<String> ordered = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            ordered.addAll(row.keySet());
        }
        return ordered;
    }

    String buildUpsert(String qualifiedTable, List<String> columns, List<String> keys) {
        String columnList = SqlIdentifiers.quoteAll(columns);
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        List<String> updates = columns.stream()
                .filter(column -> !keys.contains(column))
                .map(column -> SqlIdentifiers.quote(column) + " = EXCLUDED." + SqlIdentifiers.quote(column))
                .toList();
        String conflictAction = updates.isEmpty() ? "DO NOTHING" : "DO UPDATE SET " + String.join(", ", updates);
        return "INSERT INTO " + qualifiedTable + " (" + columnList + ") VALUES (" + placeholders + ")"
                + " ON CONFLICT (" + SqlIdentifiers.quoteAll(keys) + ") " + conflictAction;
    }

    private void upsertBatch(String sql, List<String> columns, List<Map<String, Object>> rows) {
        try {
            jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
                @Override
                public void setValues(PreparedStatement ps, int i) throws SQLException {
                    Map<String, Object> row = rows.get(i);
                    for (int columnIndex = 0; columnIndex < columns.size(); columnIndex++) {
                        ps.setObject(columnIndex + 1, toJdbcValue(row.get(columns.get(columnIndex))));
                    }
                }

                @Override
                public int getBatchSize() {
                    return rows.size();
                }
            });
        } catch (DataAccessException exception) {
            throw new LoadException("Batch upsert failed: " + exception.getMostSpecificCause().getMessage(), exception);
        }
    }

    private Object toJdbcValue(Object value) {
        if (value instanceof Instant instant) {
            return Timestamp.from(instant);
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException exception) {
                throw new LoadException("Value is not serializable: " + exception.getOriginalMessage(), exception);
            }
        }
        return value;
    }
}
