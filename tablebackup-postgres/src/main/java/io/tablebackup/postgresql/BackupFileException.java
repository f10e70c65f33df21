/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.postgresql;

import java.io.IOException;
import java.nio.file.Path;

import io.tablebackup.BackupException;

/**
 * Raised when a file of the backup or the delta directory cannot be opened, written, moved, listed or removed.
 */
public class BackupFileException extends BackupException {

    private static final long serialVersionUID = 1L;

    private final transient Path path;

    public BackupFileException(String message, Path path, IOException cause) {
        super(String.format("%s '%s': %s", message, path, cause.getMessage()), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}
