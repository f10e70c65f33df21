/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.postgresql;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;

import io.tablebackup.config.Configuration;
import io.tablebackup.config.Field;
import io.tablebackup.jdbc.JdbcConfiguration;
import io.tablebackup.relational.TableId;

/**
 * The configuration properties of a {@link TableBackup}. Connection settings are the {@link JdbcConfiguration} fields
 * prefixed with {@value #DATABASE_CONFIG_PREFIX}.
 */
public class TableBackupConfig {

    public static final String DATABASE_CONFIG_PREFIX = "database.";

    public static final Field HOSTNAME = prefixed(JdbcConfiguration.HOSTNAME).required();
    public static final Field PORT = prefixed(JdbcConfiguration.PORT);
    public static final Field USER = prefixed(JdbcConfiguration.USER).required();
    public static final Field PASSWORD = prefixed(JdbcConfiguration.PASSWORD);
    public static final Field DATABASE_NAME = prefixed(JdbcConfiguration.DATABASE).required();
    public static final Field ON_CONNECT_STATEMENTS = prefixed(JdbcConfiguration.ON_CONNECT_STATEMENTS);
    public static final Field CONNECTION_TIMEOUT_MS = prefixed(JdbcConfiguration.CONNECTION_TIMEOUT_MS);

    public static final Field TABLE_NAME = Field.create("table.name")
            .withDisplayName("Table")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .withDescription("The table to back up, given as 'schema.table'. Parts may be double-quoted.")
            .required()
            .withValidation(TableBackupConfig::validateTableName);

    public static final Field BASEBACKUP_PATH = Field.create("basebackup.path")
            .withDisplayName("Base backup file")
            .withType(Type.STRING)
            .withWidth(Width.LONG)
            .withImportance(Importance.HIGH)
            .withDescription("The file the table contents are written to. A temporary file with the suffix '.new' "
                    + "is created next to it while the backup is running.")
            .required();

    public static final Field PLUGIN_NAME = Field.create("plugin.name")
            .withDisplayName("Plugin")
            .withEnum(LogicalDecoder.class, LogicalDecoder.PGOUTPUT)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.MEDIUM)
            .withDescription("The name of the Postgres logical decoding plugin the temporary replication slot is created with. "
                    + "Defaults to '" + LogicalDecoder.PGOUTPUT.getValue() + "'.");

    public static final Field DELTAS_DIR = Field.create("deltas.dir")
            .withDisplayName("Delta directory")
            .withType(Type.STRING)
            .withWidth(Width.LONG)
            .withImportance(Importance.LOW)
            .withDescription("The directory holding the delta files of the table. Delta files older than the latest "
                    + "base backup are removed from it.")
            .withValidation(Field::isOptional);

    public static final List<Field> ALL_FIELDS = List.of(HOSTNAME, PORT, USER, PASSWORD, DATABASE_NAME, ON_CONNECT_STATEMENTS,
            CONNECTION_TIMEOUT_MS, TABLE_NAME, BASEBACKUP_PATH, PLUGIN_NAME, DELTAS_DIR);

    private static Field prefixed(Field field) {
        Field result = Field.create(DATABASE_CONFIG_PREFIX + field.name(), field.displayName(), field.description())
                .withType(field.type())
                .withWidth(field.width())
                .withImportance(field.importance())
                .withValidation(field.validator());
        return field.defaultValueAsString() != null ? result.withDefault(field.defaultValueAsString()) : result;
    }

    private static int validateTableName(Configuration config, Field field, Field.ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        try {
            TableId.parse(value);
            return 0;
        }
        catch (IllegalArgumentException e) {
            problems.accept(field, value, e.getMessage());
            return 1;
        }
    }

    /**
     * @return the definition of all fields, for tooling that consumes Kafka {@link ConfigDef}s
     */
    public static ConfigDef configDef() {
        ConfigDef config = new ConfigDef();
        Field.group(config, "Connection", HOSTNAME, PORT, USER, PASSWORD, DATABASE_NAME, ON_CONNECT_STATEMENTS, CONNECTION_TIMEOUT_MS);
        Field.group(config, "Backup", TABLE_NAME, BASEBACKUP_PATH, PLUGIN_NAME, DELTAS_DIR);
        return config;
    }

    private final Configuration config;

    public TableBackupConfig(Configuration config) {
        this.config = config;
    }

    public Configuration getConfig() {
        return config;
    }

    /**
     * Validate all fields, passing a message for each problem to the given consumer.
     *
     * @param problems the consumer of problem messages; may not be null
     * @return {@code true} if the configuration is valid
     */
    public boolean validateAndRecord(Consumer<String> problems) {
        return config.validateAndRecord(ALL_FIELDS, problems);
    }

    /**
     * @return the connection settings with the {@value #DATABASE_CONFIG_PREFIX} prefix removed
     */
    public JdbcConfiguration getJdbcConfig() {
        return JdbcConfiguration.adapt(config.subset(DATABASE_CONFIG_PREFIX, true));
    }

    public TableId tableId() {
        return TableId.parse(config.getString(TABLE_NAME));
    }

    public Path basebackupPath() {
        return Paths.get(config.getString(BASEBACKUP_PATH));
    }

    public LogicalDecoder plugin() {
        return LogicalDecoder.parse(config.getString(PLUGIN_NAME));
    }

    public Optional<Path> deltasDir() {
        String dir = config.getString(DELTAS_DIR);
        return dir == null || dir.trim().isEmpty() ? Optional.empty() : Optional.of(Paths.get(dir));
    }

    @Override
    public String toString() {
        return config.toString();
    }
}
