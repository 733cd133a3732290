package org.tenantwarehouse.service.query;

import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.utils.SqlIdentifiers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Builds a single SELECT from whitelisted pieces. Identifiers are validated and quoted, values only
 * ever become {@code ?} placeholders. When the select list contains an aggregate, every plain item
 * is grouped on by position.
 */
public final class SafeQueryBuilder {

    public record BuiltQuery(String sql, List<Object> params) {
    }

    private static final Set<String> AGGREGATES = Set.of("SUM", "AVG", "MIN", "MAX", "COUNT");
    private static final Set<String> COMPARISONS = Set.of("=", "<>", ">", ">=", "<", "<=");
    private static final Set<String> DATE_PARTS = Set.of("hour", "day", "week", "month", "quarter", "year");

    private record SelectItem(String expression, boolean aggregate) {
    }

    private final List<SelectItem> selectItems = new ArrayList<>();
    private final List<String> conditions = new ArrayList<>();
    private final List<Object> params = new ArrayList<>();
    private final List<String> orderBy = new ArrayList<>();
    private String from;
    private Integer limit;

    private SafeQueryBuilder() {
    }

    public static SafeQueryBuilder select() {
        return new SafeQueryBuilder();
    }

    public SafeQueryBuilder column(String column) {
        selectItems.add(new SelectItem(SqlIdentifiers.quote(column), false));
        return this;
    }

    public SafeQueryBuilder dateTrunc(String datePart, String column, String alias) {
        String part = datePart == null ? null : datePart.toLowerCase(Locale.ROOT);
        if (!DATE_PARTS.contains(part)) {
            throw new ConfigurationException("Unsupported date part: " + datePart);
        }
        selectItems.add(new SelectItem("DATE_TRUNC('" + part + "', " + SqlIdentifiers.quote(column) + ") AS "
                + SqlIdentifiers.quote(alias), false));
        return this;
    }

    /**
     * {@code column} may be {@code *} for {@code COUNT}.
     */
    public SafeQueryBuilder aggregate(String function, String column, String alias) {
        String fn = function == null ? null : function.toUpperCase(Locale.ROOT);
        if (!AGGREGATES.contains(fn)) {
            throw new ConfigurationException("Unsupported aggregate function: " + function);
        }
        String argument;
        if ("*".equals(column)) {
            if (!"COUNT".equals(fn)) {
                throw new ConfigurationException(fn + "(*) is not supported");
            }
            argument = "*";
        } else {
            argument = SqlIdentifiers.quote(column);
        }
        selectItems.add(new SelectItem(fn + "(" + argument + ") AS " + SqlIdentifiers.quote(alias), true));
        return this;
    }

    public SafeQueryBuilder countDistinct(String column, String alias) {
        selectItems.add(new SelectItem("COUNT(DISTINCT " + SqlIdentifiers.quote(column) + ") AS "
                + SqlIdentifiers.quote(alias), true));
        return this;
    }

    public SafeQueryBuilder from(String table) {
        this.from = SqlIdentifiers.quote(table);
        return this;
    }

    public SafeQueryBuilder from(String schema, String table) {
        this.from = SqlIdentifiers.qualify(schema, table);
        return this;
    }

    public SafeQueryBuilder where(String column, String comparison, Object value) {
        if (!COMPARISONS.contains(comparison)) {
            throw new ConfigurationException("Unsupported comparison: " + comparison);
        }
        conditions.add(SqlIdentifiers.quote(column) + " " + comparison + " ?");
        params.add(value);
        return this;
    }

    public SafeQueryBuilder whereNotNull(String column) {
        conditions.add(SqlIdentifiers.quote(column) + " IS NOT NULL");
        return this;
    }

    public SafeQueryBuilder orderBy(String column) {
        orderBy.add(SqlIdentifiers.quote(column));
        return this;
    }

    public SafeQueryBuilder orderByDescending(String column) {
        orderBy.add(SqlIdentifiers.quote(column) + " DESC");
        return this;
    }

    public SafeQueryBuilder limit(int rows) {
        if (rows <= 0) {
            throw new ConfigurationException("Limit must be positive");
        }
        this.limit = rows;
        return this;
    }

    public BuiltQuery build() {
        if (selectItems.isEmpty()) {
            throw new ConfigurationException("Query has no select items");
        }
        if (from == null) {
            throw new ConfigurationException("Query has no FROM table");
        }
        StringJoiner select = new StringJoiner(", ");
        List<String> groupPositions = new ArrayList<>();
        boolean hasAggregate = selectItems.stream().anyMatch(SelectItem::aggregate);
        for (int i = 0; i < selectItems.size(); i++) {
            SelectItem item = selectItems.get(i);
            select.add(item.expression());
            if (hasAggregate && !item.aggregate()) {
                groupPositions.add(String.valueOf(i + 1));
            }
        }
        StringBuilder sql = new StringBuilder("SELECT ").append(select).append(" FROM ").append(from);
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        if (!groupPositions.isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", groupPositions));
        }
        if (!orderBy.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", orderBy));
        }
        if (limit != null) {
            sql.append(" LIMIT ").append(limit);
        }
        return new BuiltQuery(sql.toString(), Collections.unmodifiableList(new ArrayList<>(params)));
    }
}
