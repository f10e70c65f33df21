/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.postgresql;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tablebackup.postgresql.connection.Lsn;

/**
 * Removes delta files that are superseded by a base backup. A delta file is named by the log position of its first
 * change in lowercase hexadecimal, optionally followed by a dot and an arbitrary suffix.
 */
public class DeltaFileRotator {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeltaFileRotator.class);

    private final Path deltasDir;

    public DeltaFileRotator(Path deltasDir) {
        this.deltasDir = deltasDir;
    }

    /**
     * Deletes every delta file whose position is strictly below the threshold, except the file at the
     * {@code current} position. Entries are visited in name order; the first unparsable name aborts the run and
     * leaves the entries not yet visited untouched.
     *
     * @param current the position of the delta file being written; never deleted
     * @param threshold the position of the base backup
     * @return the deleted files, in the order they were deleted; never null
     * @throws IllegalBackupStateException if the threshold is not a valid position
     * @throws DeltaFileNameException if a file name does not start with a position
     * @throws BackupFileException if the directory cannot be listed or a file cannot be deleted
     */
    public List<Path> rotate(Lsn current, Lsn threshold) {
        if (threshold == null || !threshold.isValid()) {
            throw new IllegalBackupStateException("no consistent point");
        }
        List<Path> deleted = new ArrayList<>();
        for (Path file : listEntries()) {
            String fileName = file.getFileName().toString();
            Lsn position = positionOf(fileName);
            if (position.equals(current)) {
                continue;
            }
            if (position.compareTo(threshold) < 0) {
                try {
                    Files.delete(file);
                }
                catch (IOException e) {
                    throw new BackupFileException("Could not remove delta file", file, e);
                }
                LOGGER.debug("Removed delta file {}", file);
                deleted.add(file);
            }
        }
        if (!deleted.isEmpty()) {
            LOGGER.info("Removed {} delta file(s) older than {} from {}", deleted.size(), threshold, deltasDir);
        }
        return deleted;
    }

    private List<Path> listEntries() {
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(deltasDir)) {
            stream.forEach(entries::add);
        }
        catch (IOException e) {
            throw new BackupFileException("Could not list directory", deltasDir, e);
        }
        catch (DirectoryIteratorException e) {
            throw new BackupFileException("Could not list directory", deltasDir, e.getCause());
        }
        entries.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return entries;
    }

    private static Lsn positionOf(String fileName) {
        int dot = fileName.indexOf('.');
        String hex = dot < 0 ? fileName : fileName.substring(0, dot);
        try {
            return Lsn.fromHexString(hex);
        }
        catch (IllegalArgumentException e) {
            throw new DeltaFileNameException(fileName, e);
        }
    }
}
