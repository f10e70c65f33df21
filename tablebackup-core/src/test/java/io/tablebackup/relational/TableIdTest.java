/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.relational;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

public class TableIdTest {

    @Test
    public void shouldParseSchemaAndTable() {
        TableId id = TableId.parse("public.orders");
        assertThat(id.schema()).isEqualTo("public");
        assertThat(id.table()).isEqualTo("orders");
        assertThat(id.toString()).isEqualTo("public.orders");
    }

    @Test
    public void shouldParseTableWithoutSchema() {
        TableId id = TableId.parse("orders");
        assertThat(id.schema()).isNull();
        assertThat(id.toDoubleQuotedString()).isEqualTo("\"orders\"");
    }

    @Test
    public void shouldParseQuotedParts() {
        TableId id = TableId.parse("\"my.schema\".\"Or\"\"ders\"");
        assertThat(id.schema()).isEqualTo("my.schema");
        assertThat(id.table()).isEqualTo("Or\"ders");
    }

    @Test
    public void shouldDoubleQuoteAndEscapeParts() {
        TableId id = new TableId("sch\"ema", "table; DROP TABLE x");
        assertThat(id.toDoubleQuotedString()).isEqualTo("\"sch\"\"ema\".\"table; DROP TABLE x\"");
        assertThat(IdentifierSanitizer.DOUBLE_QUOTED.sanitize(id)).isEqualTo(id.toDoubleQuotedString());
    }

    @Test
    public void shouldRoundTripThroughQuotedForm() {
        TableId id = new TableId("a.b", "c\"d");
        assertThat(TableId.parse(id.toDoubleQuotedString())).isEqualTo(id);
    }

    @Test
    public void shouldRejectMalformedIdentifiers() {
        assertThatThrownBy(() -> TableId.parse("a.b.c")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TableId.parse("a.")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TableId.parse("\"open")).isInstanceOf(IllegalArgumentException.class);
    }
}
