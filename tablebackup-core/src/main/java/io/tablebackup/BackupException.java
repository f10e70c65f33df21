/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup;

/**
 * Base exception raised by the table backup components.
 * <p>
 * Subtypes describe the kind of failure; {@link #isRetriable()} tells the caller whether repeating the
 * failed step at a later point may succeed. Nothing in this code base retries on its own.
 */
public class BackupException extends RuntimeException {

    private static final long serialVersionUID = 4735610384567093416L;

    public BackupException(String message) {
        super(message);
    }

    public BackupException(Throwable cause) {
        super(cause);
    }

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return {@code true} if the failure is likely transient (I/O, network, server side), {@code false} if
     *         it signals a programming or data error that repeating the operation will not fix
     */
    public boolean isRetriable() {
        return false;
    }
}
