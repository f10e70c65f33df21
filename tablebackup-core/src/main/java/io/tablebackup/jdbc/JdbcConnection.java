/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.jdbc;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tablebackup.annotation.NotThreadSafe;
import io.tablebackup.annotation.VisibleForTesting;
import io.tablebackup.config.Field;

/**
 * A utility that simplifies using a JDBC connection and executing statements. The connection is established lazily
 * through a {@link ConnectionFactory} the first time it is needed.
 */
@NotThreadSafe
public class JdbcConnection implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcConnection.class);

    private static final char STATEMENT_DELIMITER = ';';

    /**
     * Establishes JDBC connections.
     */
    @FunctionalInterface
    public interface ConnectionFactory {
        /**
         * Establish a connection to the database denoted by the given configuration.
         *
         * @param config the configuration with JDBC connection information
         * @return the JDBC connection; may not be null
         * @throws SQLException if there is an error connecting to the database
         */
        Connection connect(JdbcConfiguration config) throws SQLException;
    }

    /**
     * Defines multiple JDBC operations.
     */
    @FunctionalInterface
    public interface Operations {
        /**
         * Apply a series of operations against the given JDBC statement.
         *
         * @param statement the JDBC statement to use to execute one or more operations
         * @throws SQLException if there is an error connecting to the database or executing the statements
         */
        void apply(Statement statement) throws SQLException;
    }

    @FunctionalInterface
    public interface ResultSetConsumer {
        void accept(ResultSet rs) throws SQLException;
    }

    @FunctionalInterface
    public interface ResultSetMapper<T> {
        T apply(ResultSet rs) throws SQLException;
    }

    /**
     * Create a {@link ConnectionFactory} that replaces variables in the supplied URL pattern. Variables include:
     * <ul>
     * <li><code>${hostname}</code></li>
     * <li><code>${port}</code></li>
     * <li><code>${dbname}</code></li>
     * </ul>
     * Every remaining configuration property is passed to the driver as a connection property.
     *
     * @param urlPattern the URL pattern string; may not be null
     * @param variables any custom or overridden configuration variables
     * @return the connection factory
     */
    public static ConnectionFactory patternBasedFactory(String urlPattern, Field... variables) {
        return (config) -> {
            Properties props = config.asProperties();
            List<Field> allVariables = new ArrayList<>(List.of(JdbcConfiguration.HOSTNAME, JdbcConfiguration.PORT, JdbcConfiguration.DATABASE));
            allVariables.addAll(List.of(variables));
            String url = findAndReplace(urlPattern, props, allVariables);
            props.setProperty("connectTimeout", Integer.toString(Math.max(1, config.getConnectionTimeoutMs() / 1000)));
            props.remove(JdbcConfiguration.CONNECTION_TIMEOUT_MS.name());
            props.remove(JdbcConfiguration.ON_CONNECT_STATEMENTS.name());
            LOGGER.trace("URL: {}", url);
            Connection conn = DriverManager.getConnection(url, props);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Connected to {} with {}", url, propsWithMaskedPassword(props));
            }
            return conn;
        };
    }

    private static Properties propsWithMaskedPassword(Properties props) {
        final Properties filtered = new Properties();
        filtered.putAll(props);
        if (props.containsKey(JdbcConfiguration.PASSWORD.name())) {
            filtered.put(JdbcConfiguration.PASSWORD.name(), "***");
        }
        return filtered;
    }

    private static String findAndReplace(String url, Properties props, List<Field> variables) {
        for (Field field : variables) {
            url = findAndReplace(url, field.name(), props, field.defaultValueAsString());
        }
        for (Object key : new HashSet<>(props.keySet())) {
            url = findAndReplace(url, key.toString(), props, null);
        }
        return url;
    }

    private static String findAndReplace(String url, String name, Properties props, String defaultValue) {
        String placeholder = "${" + name + "}";
        if (!url.contains(placeholder)) {
            return url;
        }
        // a property consumed by the URL is not also passed to the driver
        String value = (String) props.remove(name);
        if (value == null) {
            value = defaultValue;
        }
        return value != null ? url.replace(placeholder, value) : url;
    }

    private final JdbcConfiguration config;
    private final ConnectionFactory factory;
    private Connection conn;

    /**
     * Create a new instance with the given configuration and connection factory.
     *
     * @param config the configuration; may not be null
     * @param connectionFactory the connection factory; may not be null
     */
    public JdbcConnection(JdbcConfiguration config, ConnectionFactory connectionFactory) {
        this.config = config;
        this.factory = connectionFactory;
    }

    public JdbcConfiguration config() {
        return config;
    }

    /**
     * Ensure a connection to the database is established.
     *
     * @return this object for chaining methods together
     * @throws SQLException if there is an error connecting to the database
     */
    public JdbcConnection connect() throws SQLException {
        connection();
        return this;
    }

    /**
     * Execute a series of SQL statements on a single statement object.
     *
     * @param sqlStatements the SQL statements that are to be performed
     * @return this object for chaining methods together
     * @throws SQLException if there is an error connecting to the database or executing the statements
     */
    public JdbcConnection execute(String... sqlStatements) throws SQLException {
        return execute(statement -> {
            for (String sqlStatement : sqlStatements) {
                if (sqlStatement != null) {
                    LOGGER.trace("executing '{}'", sqlStatement);
                    statement.execute(sqlStatement);
                }
            }
        });
    }

    /**
     * Execute a series of operations against a newly created statement, committing afterwards unless the connection
     * is in auto-commit mode.
     *
     * @param operations the function that will be called with a newly-created {@link Statement}
     * @return this object for chaining methods together
     * @throws SQLException if there is an error connecting to the database or executing the statements
     */
    public JdbcConnection execute(Operations operations) throws SQLException {
        Connection conn = connection();
        try (Statement statement = conn.createStatement()) {
            operations.apply(statement);
            if (!conn.getAutoCommit()) {
                conn.commit();
            }
        }
        return this;
    }

    /**
     * Execute a SQL query.
     *
     * @param query the SQL query
     * @param resultConsumer the consumer of the query results; may be null
     * @return this object for chaining methods together
     * @throws SQLException if there is an error connecting to the database or executing the statements
     */
    public JdbcConnection query(String query, ResultSetConsumer resultConsumer) throws SQLException {
        Connection conn = connection();
        try (Statement statement = conn.createStatement()) {
            LOGGER.trace("running '{}'", query);
            try (ResultSet resultSet = statement.executeQuery(query)) {
                if (resultConsumer != null) {
                    resultConsumer.accept(resultSet);
                }
            }
        }
        return this;
    }

    /**
     * Execute a SQL query and map the result set into an expected type.
     *
     * @param <T> type returned by the mapper
     * @param query the SQL query
     * @param mapper the function processing the query results
     * @return the result of the mapper calculation
     * @throws SQLException if there is an error connecting to the database or executing the statements
     */
    public <T> T queryAndMap(String query, ResultSetMapper<T> mapper) throws SQLException {
        Connection conn = connection();
        try (Statement statement = conn.createStatement()) {
            LOGGER.trace("running '{}'", query);
            try (ResultSet resultSet = statement.executeQuery(query)) {
                return mapper.apply(resultSet);
            }
        }
    }

    public boolean isConnected() throws SQLException {
        if (conn == null) {
            return false;
        }
        return !conn.isClosed();
    }

    /**
     * Obtain the underlying connection, establishing it and running the configured
     * {@link JdbcConfiguration#ON_CONNECT_STATEMENTS initial statements} if needed.
     *
     * @return the open connection; never null
     * @throws SQLException if the connection cannot be established
     */
    public Connection connection() throws SQLException {
        if (!isConnected()) {
            conn = factory.connect(config);
            if (!isConnected()) {
                throw new SQLException("Unable to obtain a JDBC connection");
            }
            final String statements = config.getString(JdbcConfiguration.ON_CONNECT_STATEMENTS);
            if (statements != null) {
                final List<String> splitStatements = parseSqlStatementString(statements);
                execute(splitStatements.toArray(new String[0]));
            }
        }
        return conn;
    }

    @VisibleForTesting
    protected List<String> parseSqlStatementString(final String statements) {
        final List<String> splitStatements = new ArrayList<>();
        final char[] statementsChars = statements.toCharArray();
        StringBuilder activeStatement = new StringBuilder();
        for (int i = 0; i < statementsChars.length; i++) {
            if (statementsChars[i] != STATEMENT_DELIMITER) {
                activeStatement.append(statementsChars[i]);
            }
            else if (i + 1 < statementsChars.length && statementsChars[i + 1] == STATEMENT_DELIMITER) {
                // escaped delimiter
                activeStatement.append(STATEMENT_DELIMITER);
                i++;
            }
            else {
                addIfNotBlank(splitStatements, activeStatement);
                activeStatement = new StringBuilder();
            }
        }
        addIfNotBlank(splitStatements, activeStatement);
        return splitStatements;
    }

    private static void addIfNotBlank(List<String> statements, StringBuilder statement) {
        final String trimmed = statement.toString().trim();
        if (!trimmed.isEmpty()) {
            statements.add(trimmed);
        }
    }

    /**
     * Close the connection and release any resources. Closing an instance that is not connected does nothing.
     */
    @Override
    public void close() throws SQLException {
        if (conn != null) {
            try {
                LOGGER.trace("Closing database connection");
                conn.close();
                LOGGER.info("Connection gracefully closed");
            }
            finally {
                conn = null;
            }
        }
    }
}
