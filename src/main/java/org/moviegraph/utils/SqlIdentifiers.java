package org.moviegraph.utils;

import org.springframework.util.StringUtils;

import java.util.regex.Pattern;

/**
 * Guards table, column and schema names before they are concatenated into DDL or DML.
 */
public final class SqlIdentifiers {

    private SqlIdentifiers() {
    }

    /**
     * Unquoted identifier: a letter or underscore, then letters, digits or underscores, at most
     * 63 characters (PostgreSQL limit).
     */
    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]{0,62}$");

    public static String require(String identifier) {
        if (!StringUtils.hasText(identifier) || !IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: '" + identifier + "'");
        }
        return identifier;
    }

    /**
     * {@code schema.table}, or just {@code table} when no schema is given.
     */
    public static String qualify(String schema, String table) {
        if (StringUtils.hasText(schema)) {
            return require(schema) + "." + require(table);
        }
        return require(table);
    }
}
