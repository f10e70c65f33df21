/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.postgresql;

import io.tablebackup.BackupException;

public class BackupCancelledException extends BackupException {

    private static final long serialVersionUID = 1L;

    public BackupCancelledException(String message) {
        super(message);
    }

    public BackupCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
