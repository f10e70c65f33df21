/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.postgresql;

import io.tablebackup.BackupException;

/**
 * Raised when streaming the table contents into the temporary base backup file fails. The streaming failure is the
 * cause; if rolling back the transaction afterwards failed as well, that failure is available through
 * {@link #getRollbackFailure()} and is also attached as a suppressed exception.
 */
public class SnapshotExportException extends BackupException {

    private static final long serialVersionUID = 1L;

    private final BackupException rollbackFailure;

    public SnapshotExportException(String message, Throwable copyFailure, BackupException rollbackFailure) {
        super(rollbackFailure == null ? message : message + " and could not roll back the transaction", copyFailure);
        this.rollbackFailure = rollbackFailure;
        if (rollbackFailure != null) {
            addSuppressed(rollbackFailure);
        }
    }

    public BackupException getRollbackFailure() {
        return rollbackFailure;
    }

    @Override
    public boolean isRetriable() {
        return !(getCause() instanceof BackupException) || ((BackupException) getCause()).isRetriable();
    }
}
