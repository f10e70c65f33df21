/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.postgresql;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tablebackup.annotation.ThreadSafe;

/**
 * Cancellation token of a {@link TableBackup}. {@link #cancel()} may be called from any thread; it marks the backup as
 * cancelled and cancels the statement that is currently executing on the server, if there is one.
 */
@ThreadSafe
public class BackupContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(BackupContext.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicReference<Statement> runningStatement = new AtomicReference<>();

    /**
     * A unit of work executed against a registered statement.
     */
    @FunctionalInterface
    public interface StatementWork<T> {
        T apply(Statement statement) throws SQLException;
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            LOGGER.info("Cancelling table backup");
        }
        Statement statement = runningStatement.get();
        if (statement != null) {
            try {
                statement.cancel();
            }
            catch (SQLException e) {
                LOGGER.warn("Could not cancel the running statement", e);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws BackupCancelledException if {@link #cancel()} has been called
     */
    public void checkCancelled() {
        if (isCancelled()) {
            throw new BackupCancelledException("The table backup has been cancelled");
        }
    }

    /**
     * Run the given work with the statement registered as the one to cancel on {@link #cancel()}.
     */
    <T> T run(Statement statement, StatementWork<T> work) throws SQLException {
        return run(statement, work, false);
    }

    /**
     * Like {@link #run(Statement, StatementWork)}, but refuses to start the work if {@link #cancel()} was called before
     * the statement got registered.
     *
     * @throws BackupCancelledException if the context has been cancelled
     */
    <T> T runUnlessCancelled(Statement statement, StatementWork<T> work) throws SQLException {
        return run(statement, work, true);
    }

    private <T> T run(Statement statement, StatementWork<T> work, boolean refuseIfCancelled) throws SQLException {
        runningStatement.set(statement);
        try {
            // registered first, so a racing cancel() either trips this check or cancels the statement
            if (refuseIfCancelled) {
                checkCancelled();
            }
            return work.apply(statement);
        }
        finally {
            runningStatement.compareAndSet(statement, null);
        }
    }
}
