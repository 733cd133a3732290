package org.tenantwarehouse.service.query;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cache form of a query result. Every column carries the Java type the JDBC driver produced and
 * values that JSON cannot hold exactly are stored as strings, so a restored row equals the row the
 * database returned. Results with a column of any other type are not cacheable.
 */
public record CachedRows(Map<String, ColumnType> columnTypes, List<Map<String, Object>> rows) {

    public enum ColumnType {
        STRING, BOOLEAN, INTEGER, LONG, FLOAT, DOUBLE, DECIMAL, BIG_INTEGER, DATE, TIMESTAMP, UUID;

        static Optional<ColumnType> of(Object value) {
            if (value instanceof String) {
                return Optional.of(STRING);
            }
            if (value instanceof Boolean) {
                return Optional.of(BOOLEAN);
            }
            if (value instanceof Integer) {
                return Optional.of(INTEGER);
            }
            if (value instanceof Long) {
                return Optional.of(LONG);
            }
            if (value instanceof Float) {
                return Optional.of(FLOAT);
            }
            if (value instanceof Double) {
                return Optional.of(DOUBLE);
            }
            if (value instanceof BigDecimal) {
                return Optional.of(DECIMAL);
            }
            if (value instanceof BigInteger) {
                return Optional.of(BIG_INTEGER);
            }
            if (value instanceof Date) {
                return Optional.of(DATE);
            }
            if (value instanceof Timestamp) {
                return Optional.of(TIMESTAMP);
            }
            if (value instanceof java.util.UUID) {
                return Optional.of(UUID);
            }
            return Optional.empty();
        }

        Object encode(Object value) {
            return switch (this) {
                case STRING, BOOLEAN, INTEGER, LONG, FLOAT, DOUBLE -> value;
                case DECIMAL -> ((BigDecimal) value).toString();
                case DATE -> ((Date) value).toLocalDate().toString();
                case TIMESTAMP -> ((Timestamp) value).toInstant().toString();
                case BIG_INTEGER, UUID -> value.toString();
            };
        }

        Object decode(Object value) {
            return switch (this) {
                case STRING -> (String) value;
                case BOOLEAN -> (Boolean) value;
                case INTEGER -> ((Number) value).intValue();
                case LONG -> ((Number) value).longValue();
                case FLOAT -> ((Number) value).floatValue();
                case DOUBLE -> ((Number) value).doubleValue();
                case DECIMAL -> new BigDecimal((String) value);
                case BIG_INTEGER -> new BigInteger((String) value);
                case DATE -> Date.valueOf(LocalDate.parse((String) value));
                case TIMESTAMP -> Timestamp.from(Instant.parse((String) value));
                case UUID -> java.util.UUID.fromString((String) value);
            };
        }
    }

    /**
     * @return the cache form, or empty when a column holds a type that cannot be restored exactly
     */
    static Optional<CachedRows> encode(List<Map<String, Object>> rows) {
        Map<String, ColumnType> types = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            for (Map.Entry<String, Object> cell : row.entrySet()) {
                if (cell.getValue() == null) {
                    continue;
                }
                Optional<ColumnType> type = ColumnType.of(cell.getValue());
                if (type.isEmpty()) {
                    return Optional.empty();
                }
                ColumnType known = types.putIfAbsent(cell.getKey(), type.get());
                if (known != null && known != type.get()) {
                    return Optional.empty();
                }
            }
        }
        List<Map<String, Object>> encoded = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> values = new LinkedHashMap<>();
            row.forEach((column, value) -> values.put(column, value == null ? null : types.get(column).encode(value)));
            encoded.add(values);
        }
        return Optional.of(new CachedRows(types, encoded));
    }

    /**
     * @throws IllegalArgumentException if the entry does not match its own column types
     */
    List<Map<String, Object>> restore() {
        if (columnTypes == null || rows == null) {
            throw new IllegalArgumentException("Cached result has no rows or column types");
        }
        List<Map<String, Object>> restored = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (Map.Entry<String, Object> cell : row.entrySet()) {
                Object value = cell.getValue();
                ColumnType type = columnTypes.get(cell.getKey());
                if (value != null && type == null) {
                    throw new IllegalArgumentException("No type recorded for column " + cell.getKey());
                }
                try {
                    values.put(cell.getKey(), value == null ? null : type.decode(value));
                } catch (ClassCastException | DateTimeParseException exception) {
                    throw new IllegalArgumentException("Malformed value for column " + cell.getKey(), exception);
                }
            }
            restored.add(values);
        }
        return restored;
    }
}
