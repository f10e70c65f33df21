/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.postgresql.connection;

import java.io.IOException;
import java.io.OutputStream;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashMap;
import java.util.Map;

import org.postgresql.PGConnection;
import org.postgresql.PGProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tablebackup.annotation.NotThreadSafe;
import io.tablebackup.jdbc.JdbcConfiguration;
import io.tablebackup.jdbc.JdbcConnection;
import io.tablebackup.postgresql.IllegalBackupStateException;
import io.tablebackup.postgresql.ReplicationProtocolException;

/**
 * A session opened in logical replication mode ({@code replication=database}), which accepts both replication commands
 * such as {@code CREATE_REPLICATION_SLOT} and plain SQL sent with the simple query protocol.
 */
@NotThreadSafe
public class PostgresReplicationConnection extends JdbcConnection {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresReplicationConnection.class);

    public static final String URL_PATTERN = "jdbc:postgresql://${hostname}:${port}/${dbname}";

    private static final String TEMP_SLOT_PREFIX = "tempslot_";

    private ServerInfo serverInfo;

    /**
     * Creates a new replication connection for the given configuration, connecting through the PostgreSQL JDBC driver.
     *
     * @param config the connection settings; may not be null
     */
    public PostgresReplicationConnection(JdbcConfiguration config) {
        this(config, JdbcConnection.patternBasedFactory(URL_PATTERN));
    }

    public PostgresReplicationConnection(JdbcConfiguration config, ConnectionFactory connectionFactory) {
        super(addReplicationProperties(config), connectionFactory);
    }

    private static JdbcConfiguration addReplicationProperties(JdbcConfiguration config) {
        return JdbcConfiguration.copy(config)
                .with(PGProperty.REPLICATION.getName(), "database")
                .with(PGProperty.PREFER_QUERY_MODE.getName(), "simple")
                .with(PGProperty.ASSUME_MIN_SERVER_VERSION.getName(), "10")
                .build();
    }

    /**
     * Returns the name of the temporary replication slot owned by the session with the given process id.
     *
     * @param pid the backend process id
     * @return the slot name; never null
     */
    public static String tempSlotName(int pid) {
        return TEMP_SLOT_PREFIX + pid;
    }

    /**
     * Opens the session and reads the {@link ServerInfo}. If any step fails, whatever was opened is closed again.
     *
     * @return this connection
     * @throws ReplicationProtocolException if the session cannot be opened or initialized
     */
    @Override
    public PostgresReplicationConnection connect() {
        if (isOpen()) {
            return this;
        }
        try {
            super.connect();
            serverInfo = initialize();
        }
        catch (SQLException e) {
            throw closeAfterFailure(new ReplicationProtocolException("Could not connect", e));
        }
        catch (IllegalArgumentException e) {
            throw closeAfterFailure(new ReplicationProtocolException("Could not read server identity", e));
        }
        LOGGER.info("Connected to {}", serverInfo);
        return this;
    }

    private ServerInfo initialize() throws SQLException {
        ServerInfo identity = queryAndMap("IDENTIFY_SYSTEM", rs -> {
            if (!rs.next()) {
                throw new SQLException("IDENTIFY_SYSTEM returned no result");
            }
            String xlogPosition = rs.getString(3);
            return new ServerInfo(rs.getString(1), rs.getInt(2),
                    xlogPosition != null ? Lsn.valueOf(xlogPosition) : Lsn.INVALID,
                    rs.getString(4), null, Map.of());
        });
        String serverVersion = queryAndMap("SHOW server_version", rs -> rs.next() ? rs.getString(1) : null);
        Map<Integer, String> types = queryAndMap("SELECT oid, typname FROM pg_catalog.pg_type", rs -> {
            Map<Integer, String> result = new HashMap<>();
            while (rs.next()) {
                result.put(rs.getInt(1), rs.getString(2));
            }
            return result;
        });
        LOGGER.debug("Loaded {} types", types.size());
        return new ServerInfo(identity.systemId(), identity.timeline(), identity.xlogPosition(), identity.database(),
                serverVersion, types);
    }

    private ReplicationProtocolException closeAfterFailure(ReplicationProtocolException failure) {
        try {
            super.close();
        }
        catch (SQLException e) {
            failure.addSuppressed(e);
        }
        serverInfo = null;
        return failure;
    }

    /**
     * @return {@code true} if the session is open
     * @throws ReplicationProtocolException if the state of the underlying connection cannot be determined
     */
    public boolean isOpen() {
        try {
            return isConnected();
        }
        catch (SQLException e) {
            throw new ReplicationProtocolException("Could not determine connection state", e);
        }
    }

    /**
     * @return the information read while opening the session; never null
     * @throws IllegalBackupStateException if no session is open
     */
    public ServerInfo serverInfo() {
        requireOpen();
        return serverInfo;
    }

    /**
     * @return the process id of the server process serving this session
     * @throws IllegalBackupStateException if no session is open
     */
    public int backendPid() {
        try {
            return pgConnection().getBackendPID();
        }
        catch (SQLException e) {
            throw new ReplicationProtocolException("Could not obtain backend pid", e);
        }
    }

    /**
     * @return the name of the temporary replication slot of this session
     * @throws IllegalBackupStateException if no session is open
     */
    public String tempSlotName() {
        return tempSlotName(backendPid());
    }

    /**
     * Creates a new statement on the open session.
     *
     * @throws IllegalBackupStateException if no session is open
     */
    public Statement createStatement() throws SQLException {
        requireOpen();
        return connection().createStatement();
    }

    /**
     * Streams the output of the given {@code COPY ... TO STDOUT} command into the given stream.
     *
     * @return the number of rows copied
     * @throws IllegalBackupStateException if no session is open
     */
    public long copyOut(String sql, OutputStream out) throws SQLException, IOException {
        LOGGER.debug("running '{}'", sql);
        return pgConnection().getCopyAPI().copyOut(sql, out);
    }

    private PGConnection pgConnection() throws SQLException {
        requireOpen();
        return connection().unwrap(PGConnection.class);
    }

    private void requireOpen() {
        if (!isOpen()) {
            throw new IllegalBackupStateException("no postgresql connection");
        }
    }

    /**
     * Closes the session.
     *
     * @throws IllegalBackupStateException if no session is open
     * @throws ReplicationProtocolException if closing fails
     */
    @Override
    public void close() {
        if (!isOpen()) {
            throw new IllegalBackupStateException("no open connections");
        }
        try {
            super.close();
        }
        catch (SQLException e) {
            throw new ReplicationProtocolException("Could not close connection", e);
        }
        finally {
            serverInfo = null;
        }
    }
}
