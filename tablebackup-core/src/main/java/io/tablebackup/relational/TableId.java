/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.relational;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.tablebackup.annotation.Immutable;
import io.tablebackup.util.Strings;

/**
 * Unique identifier for a database table, made of an optional schema name and the table name. The parts are held
 * unquoted.
 */
@Immutable
public final class TableId implements Comparable<TableId> {

    private static final char QUOTING_CHAR = '"';

    /**
     * Parse the supplied string, extracting up to the first two parts into a TableId. A part may be enclosed in double
     * quotes, in which case it may contain dots and doubled quote characters.
     *
     * @param str the string representation of the table identifier; may not be null
     * @return the table ID
     * @throws IllegalArgumentException if the string is not a {@code table} or {@code schema.table} identifier
     */
    public static TableId parse(String str) {
        List<String> parts = parseParts(str);
        if (parts.size() == 1) {
            return new TableId(null, parts.get(0));
        }
        if (parts.size() == 2) {
            return new TableId(parts.get(0), parts.get(1));
        }
        throw new IllegalArgumentException("Unexpected table identifier '" + str + "'");
    }

    private static List<String> parseParts(String str) {
        Objects.requireNonNull(str, "The table identifier is required");
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            if (c == QUOTING_CHAR) {
                if (quoted && i + 1 < str.length() && str.charAt(i + 1) == QUOTING_CHAR) {
                    current.append(c).append(c);
                    i++;
                    continue;
                }
                quoted = !quoted;
                current.append(c);
            }
            else if (c == '.' && !quoted) {
                parts.add(unquotedPart(str, current));
                current = new StringBuilder();
            }
            else {
                current.append(c);
            }
        }
        if (quoted) {
            throw new IllegalArgumentException("Unterminated quoted identifier in '" + str + "'");
        }
        parts.add(unquotedPart(str, current));
        return parts;
    }

    private static String unquotedPart(String str, StringBuilder part) {
        String trimmed = part.toString().trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Empty identifier part in '" + str + "'");
        }
        return Strings.unquoteIdentifierPart(trimmed, QUOTING_CHAR);
    }

    private final String schemaName;
    private final String tableName;
    private final String id;

    /**
     * Create a new table identifier.
     *
     * @param schemaName the name of the database schema that contains the table; may be null
     * @param tableName the name of the table; may not be null
     */
    public TableId(String schemaName, String tableName) {
        Objects.requireNonNull(tableName, "The table name is required");
        this.schemaName = Strings.isNullOrEmpty(schemaName) ? null : schemaName;
        this.tableName = tableName;
        this.id = this.schemaName == null ? tableName : this.schemaName + "." + tableName;
    }

    public String schema() {
        return schemaName;
    }

    public String table() {
        return tableName;
    }

    public String identifier() {
        return id;
    }

    /**
     * Returns a dot-separated String representation of this identifier, quoting all name parts with the {@code "} char
     * and doubling the quotes that appear inside a part.
     */
    public String toDoubleQuotedString() {
        return toQuotedString(QUOTING_CHAR);
    }

    /**
     * Returns a dot-separated String representation of this identifier, quoting all name parts with the given quoting
     * char.
     */
    public String toQuotedString(char quotingChar) {
        StringBuilder quoted = new StringBuilder();
        if (schemaName != null) {
            quoted.append(quote(schemaName, quotingChar)).append('.');
        }
        quoted.append(quote(tableName, quotingChar));
        return quoted.toString();
    }

    private static String quote(String identifierPart, char quotingChar) {
        String q = String.valueOf(quotingChar);
        return q + identifierPart.replace(q, q + q) + q;
    }

    @Override
    public int compareTo(TableId that) {
        if (this == that) {
            return 0;
        }
        return this.id.compareTo(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof TableId) {
            TableId that = (TableId) obj;
            return Objects.equals(this.schemaName, that.schemaName) && this.tableName.equals(that.tableName);
        }
        return false;
    }

    @Override
    public String toString() {
        return identifier();
    }
}
