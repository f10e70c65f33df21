/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.postgresql;

import java.sql.SQLException;

import io.tablebackup.BackupException;

/**
 * Raised when a command sent over the replication session fails or the server answers with an unexpected result.
 * The SQL state of the underlying {@link SQLException}, if any, is retained.
 */
public class ReplicationProtocolException extends BackupException {

    private static final long serialVersionUID = 1L;

    private final String sqlState;
    private final boolean retriable;

    public ReplicationProtocolException(String message, SQLException cause) {
        super(message + ": " + cause.getMessage(), cause);
        this.sqlState = cause.getSQLState();
        this.retriable = true;
    }

    public ReplicationProtocolException(String message) {
        super(message);
        this.sqlState = null;
        this.retriable = true;
    }

    /**
     * Creates an exception for a server response that could not be interpreted; such failures are not retriable.
     */
    public ReplicationProtocolException(String message, IllegalArgumentException cause) {
        super(message + ": " + cause.getMessage(), cause);
        this.sqlState = null;
        this.retriable = false;
    }

    /**
     * @return the SQL state reported by the server, or {@code null} if the failure did not come from the driver
     */
    public String getSqlState() {
        return sqlState;
    }

    @Override
    public boolean isRetriable() {
        return retriable;
    }
}
