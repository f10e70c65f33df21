/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.postgresql;

import io.tablebackup.BackupException;

/**
 * Raised when the name of a file in the delta directory does not start with a hexadecimal log position.
 */
public class DeltaFileNameException extends BackupException {

    private static final long serialVersionUID = 1L;

    private final String fileName;

    public DeltaFileNameException(String fileName, IllegalArgumentException cause) {
        super("Could not parse delta file name '" + fileName + "': " + cause.getMessage(), cause);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
