/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.jdbc;

import java.sql.SQLException;

import io.tablebackup.BackupException;

/**
 * {@link BackupException} which is raised for various {@link java.sql.SQLException} instances and which retains the error
 * code from the original exception.
 */
public final class JdbcConnectionException extends BackupException {
    private static final long serialVersionUID = 1L;

    private final String sqlState;
    private final int errorCode;

    /**
     * Creates a new exception instance, wrapping the supplied SQLException
     *
     * @param e a {@link SQLException} instance, may not be null
     */
    public JdbcConnectionException(SQLException e) {
        this(e.getMessage(), e);
    }

    /**
     * Creates a new exception instance, wrapping the supplied SQLException with a custom message
     *
     * @param message the exception message, may not be null
     * @param e a {@link SQLException} instance, may not be null
     */
    public JdbcConnectionException(String message, SQLException e) {
        super(message, e);
        this.sqlState = e.getSQLState();
        this.errorCode = e.getErrorCode();
    }

    public String getSqlState() {
        return sqlState;
    }

    public int getErrorCode() {
        return errorCode;
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}
