/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.jdbc;

import java.util.List;
import java.util.Set;

import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;

import io.tablebackup.annotation.Immutable;
import io.tablebackup.config.Configuration;
import io.tablebackup.config.Field;

/**
 * A specialized configuration holding the {@link Field fields} needed to open a JDBC session against the source database.
 */
@Immutable
public interface JdbcConfiguration extends Configuration {

    /**
     * A field for the name of the database. This field has no default value.
     */
    Field DATABASE = Field.create("dbname", "Name of the database")
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH);

    /**
     * A field for the user of the database. This field has no default value.
     */
    Field USER = Field.create("user", "Name of the database user to be used when connecting to the database")
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH);

    /**
     * A field for the password of the database. This field has no default value.
     */
    Field PASSWORD = Field.create("password", "Password to be used when connecting to the database")
            .withType(Type.PASSWORD)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH);

    Field HOSTNAME = Field.create("hostname", "IP address or hostname of the database server")
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH);

    Field PORT = Field.create("port", "Port of the database server")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withDefault(5432)
            .withValidation(Field::isPositiveInteger);

    /**
     * A semicolon separated list of SQL statements to be executed when the connection to database is established.
     * A literal semicolon is written as two semicolons. There is no default value.
     */
    Field ON_CONNECT_STATEMENTS = Field.create("initial.statements", "A semicolon separated list of statements to be executed on connection");

    Field CONNECTION_TIMEOUT_MS = Field.create("connection.timeout.ms")
            .withDisplayName("Time to wait for a connection to be established, given in milliseconds. Defaults to 30 seconds.")
            .withType(Type.INT)
            .withDefault(30000)
            .withValidation(Field::isOptional);

    /**
     * The pre-defined JDBC configuration fields.
     */
    List<Field> ALL_FIELDS = List.of(HOSTNAME, PORT, USER, PASSWORD, DATABASE, ON_CONNECT_STATEMENTS, CONNECTION_TIMEOUT_MS);

    /**
     * Obtain a {@link JdbcConfiguration} adapter for the given {@link Configuration}.
     *
     * @param config the configuration; may not be null
     * @return the JDBC configuration; never null
     */
    static JdbcConfiguration adapt(Configuration config) {
        if (config instanceof JdbcConfiguration) {
            return (JdbcConfiguration) config;
        }
        return new JdbcConfiguration() {
            @Override
            public Set<String> keys() {
                return config.keys();
            }

            @Override
            public String getString(String key) {
                return config.getString(key);
            }

            @Override
            public String toString() {
                return config.toString();
            }
        };
    }

    static JdbcConfiguration empty() {
        return JdbcConfiguration.adapt(Configuration.empty());
    }

    /**
     * The JDBC-specific builder used to construct and/or alter JDBC configuration instances.
     *
     * @see JdbcConfiguration#copy(Configuration)
     * @see JdbcConfiguration#create()
     */
    interface Builder extends Configuration.ConfigBuilder<JdbcConfiguration, Builder> {

        default Builder withUser(String username) {
            return with(USER, username);
        }

        default Builder withPassword(String password) {
            return with(PASSWORD, password);
        }

        default Builder withHostname(String hostname) {
            return with(HOSTNAME, hostname);
        }

        default Builder withDatabase(String databaseName) {
            return with(DATABASE, databaseName);
        }

        default Builder withPort(int port) {
            return with(PORT, port);
        }

        default Builder withConnectionTimeoutMs(int connectionTimeoutMs) {
            return with(CONNECTION_TIMEOUT_MS, connectionTimeoutMs);
        }
    }

    /**
     * Create a new {@link Builder configuration builder} that starts with a copy of the supplied configuration.
     *
     * @param config the configuration to copy
     * @return the configuration builder
     */
    static Builder copy(Configuration config) {
        return new DelegatingBuilder(Configuration.copy(config));
    }

    /**
     * Create a new {@link Builder configuration builder} that starts with an empty configuration.
     *
     * @return the configuration builder
     */
    static Builder create() {
        return new DelegatingBuilder(Configuration.create());
    }

    default String getHostname() {
        return getString(HOSTNAME);
    }

    default int getPort() {
        return getInteger(PORT);
    }

    default String getUser() {
        return getString(USER);
    }

    default String getPassword() {
        return getString(PASSWORD);
    }

    default String getDatabase() {
        return getString(DATABASE);
    }

    default int getConnectionTimeoutMs() {
        return getInteger(CONNECTION_TIMEOUT_MS);
    }

    final class DelegatingBuilder implements Builder {
        private final Configuration.Builder builder;

        private DelegatingBuilder(Configuration.Builder builder) {
            this.builder = builder;
        }

        @Override
        public Builder with(String key, String value) {
            builder.with(key, value);
            return this;
        }

        @Override
        public Builder withDefault(String key, String value) {
            builder.withDefault(key, value);
            return this;
        }

        @Override
        public JdbcConfiguration build() {
            return JdbcConfiguration.adapt(builder.build());
        }

        @Override
        public String toString() {
            return builder.build().toString();
        }
    }
}
