/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.relational;

/**
 * Turns a {@link TableId} into a string that can be embedded verbatim into SQL text.
 */
@FunctionalInterface
public interface IdentifierSanitizer {

    /**
     * Quotes every part of the identifier with double quotes.
     */
    IdentifierSanitizer DOUBLE_QUOTED = TableId::toDoubleQuotedString;

    /**
     * @param tableId the table to reference; never null
     * @return the SQL-safe representation of the identifier; never null
     */
    String sanitize(TableId tableId);
}
