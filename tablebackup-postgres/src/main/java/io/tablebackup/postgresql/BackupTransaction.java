/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.postgresql;

import java.io.IOException;
import java.io.OutputStream;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import org.postgresql.util.PSQLState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tablebackup.annotation.NotThreadSafe;
import io.tablebackup.jdbc.JdbcConnection.ResultSetMapper;
import io.tablebackup.postgresql.connection.PostgresReplicationConnection;

/**
 * A read-only, repeatable-read transaction running on a replication session. All statements are registered with the
 * {@link BackupContext} while they execute, so that a cancellation requested from another thread aborts them.
 */
@NotThreadSafe
public class BackupTransaction {

    private static final Logger LOGGER = LoggerFactory.getLogger(BackupTransaction.class);

    static final String BEGIN = "BEGIN TRANSACTION ISOLATION LEVEL REPEATABLE READ READ ONLY";
    static final String COMMIT = "COMMIT";
    static final String ROLLBACK = "ROLLBACK";

    private final PostgresReplicationConnection connection;
    private final BackupContext context;

    private BackupTransaction(PostgresReplicationConnection connection, BackupContext context) {
        this.connection = connection;
        this.context = context;
    }

    /**
     * Starts a new transaction on the given session.
     *
     * @throws BackupCancelledException if the context was cancelled before or while the transaction was started
     * @throws ReplicationProtocolException if the server refused to start the transaction
     */
    static BackupTransaction begin(PostgresReplicationConnection connection, BackupContext context) {
        context.checkCancelled();
        BackupTransaction transaction = new BackupTransaction(connection, context);
        transaction.query(BEGIN, "Could not begin transaction", true, statement -> statement.execute(BEGIN));
        return transaction;
    }

    void commit() {
        execute(COMMIT, "Could not commit transaction");
    }

    void rollback() {
        execute(ROLLBACK, "Could not roll back transaction");
    }

    /**
     * Executes a statement that returns no rows.
     */
    void execute(String sql, String failureMessage) {
        query(sql, failureMessage, false, statement -> statement.execute(sql));
    }

    /**
     * Executes a statement returning rows and maps its result.
     */
    <T> T queryAndMap(String sql, String failureMessage, ResultSetMapper<T> mapper) {
        return query(sql, failureMessage, false, statement -> {
            try (ResultSet rs = statement.executeQuery(sql)) {
                return mapper.apply(rs);
            }
        });
    }

    /**
     * Streams the output of a {@code COPY ... TO STDOUT} command into the given stream.
     *
     * @return the number of rows copied
     * @throws IOException if writing to the stream fails
     */
    long copyOut(String sql, OutputStream out) throws IOException {
        try {
            return connection.copyOut(sql, out);
        }
        catch (SQLException e) {
            throw new ReplicationProtocolException("Could not copy table contents", e);
        }
    }

    private <T> T query(String sql, String failureMessage, boolean cancellable, BackupContext.StatementWork<T> work) {
        LOGGER.debug("executing '{}'", sql);
        try (Statement statement = connection.createStatement()) {
            return cancellable ? context.runUnlessCancelled(statement, work) : context.run(statement, work);
        }
        catch (SQLException e) {
            if (context.isCancelled() && PSQLState.QUERY_CANCELED.getState().equals(e.getSQLState())) {
                throw new BackupCancelledException(failureMessage + ": cancelled", e);
            }
            throw new ReplicationProtocolException(failureMessage, e);
        }
    }
}
