package org.tenantwarehouse.utils;

import org.tenantwarehouse.exceptions.ConfigurationException;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Identifier handling for the few places where SQL text has to name schemas, tables or columns.
 * Values never go through here; they are always bound as statement parameters.
 */
public final class SqlIdentifiers {

    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

    private SqlIdentifiers() {
    }

    public static String requireSafe(String identifier) {
        if (identifier == null || !SAFE_IDENTIFIER.matcher(identifier).matches()) {
            throw new ConfigurationException("Unsafe SQL identifier: " + identifier);
        }
        return identifier;
    }

    public static boolean isSafe(String identifier) {
        return identifier != null && SAFE_IDENTIFIER.matcher(identifier).matches();
    }

    public static String quote(String identifier) {
        return "\"" + requireSafe(identifier) + "\"";
    }

    public static String qualify(String schema, String table) {
        if (schema == null || schema.isBlank()) {
            return quote(table);
        }
        return quote(schema) + "." + quote(table);
    }

    public static String quoteAll(List<String> identifiers) {
        return identifiers.stream().map(SqlIdentifiers::quote).collect(Collectors.joining(", "));
    }
}
