/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.postgresql;

import io.tablebackup.BackupException;

/**
 * Raised when an operation is invoked while the backup is not in the state the operation requires, e.g. copying
 * without an open transaction.
 */
public class IllegalBackupStateException extends BackupException {

    private static final long serialVersionUID = 1L;

    public IllegalBackupStateException(String message) {
        super(message);
    }
}
