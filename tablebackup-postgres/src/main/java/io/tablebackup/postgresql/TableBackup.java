/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.postgresql;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tablebackup.BackupException;
import io.tablebackup.annotation.NotThreadSafe;
import io.tablebackup.annotation.VisibleForTesting;
import io.tablebackup.postgresql.connection.Lsn;
import io.tablebackup.postgresql.connection.PostgresReplicationConnection;
import io.tablebackup.postgresql.spi.SlotCreationResult;
import io.tablebackup.relational.IdentifierSanitizer;
import io.tablebackup.relational.TableId;
import io.tablebackup.util.Strings;

/**
 * Produces a transactionally consistent base backup of a single table together with the log position from which the
 * changes made after the backup can be decoded.
 * <p>
 * A backup cycle opens a replication session, starts a read-only repeatable-read transaction, creates a temporary
 * logical replication slot that uses the snapshot of that transaction, locks the table against schema changes and
 * streams its contents into the base backup file. The consistent point of the slot is the position from which delta
 * files continue, and delta files below it can be {@link #rotateOldDeltas(Path, Lsn) removed}.
 * <p>
 * Besides {@link #createBaseBackup()}, the individual steps are exposed so that callers can sequence them themselves.
 * Only {@link BackupContext#cancel()} may be called from another thread.
 */
@NotThreadSafe
public class TableBackup {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableBackup.class);

    private final TableBackupConfig config;
    private final PostgresReplicationConnection connection;
    private final IdentifierSanitizer sanitizer;
    private final TableId tableId;
    private final Path basebackupPath;
    private final BackupContext context = new BackupContext();

    private BackupTransaction transaction;
    private Lsn basebackupLsn = Lsn.INVALID;

    /**
     * Creates a new backup of the table named by the given configuration.
     *
     * @param config the configuration; may not be null
     * @throws BackupException if the configuration is not valid
     */
    public TableBackup(TableBackupConfig config) {
        this(config, null, IdentifierSanitizer.DOUBLE_QUOTED);
    }

    @VisibleForTesting
    TableBackup(TableBackupConfig config, PostgresReplicationConnection connection, IdentifierSanitizer sanitizer) {
        List<String> problems = new ArrayList<>();
        if (!config.validateAndRecord(problems::add)) {
            throw new BackupException("Invalid table backup configuration: " + Strings.join("; ", problems));
        }
        this.config = config;
        this.connection = connection != null ? connection : new PostgresReplicationConnection(config.getJdbcConfig());
        this.sanitizer = sanitizer;
        this.tableId = config.tableId();
        this.basebackupPath = config.basebackupPath();
    }

    public TableId tableId() {
        return tableId;
    }

    public Path basebackupPath() {
        return basebackupPath;
    }

    /**
     * @return the consistent point of the last successfully created slot, or {@link Lsn#INVALID} if there is none yet
     */
    public Lsn basebackupLsn() {
        return basebackupLsn;
    }

    /**
     * @return the cancellation token of this backup
     */
    public BackupContext context() {
        return context;
    }

    public boolean isTransactionOpen() {
        return transaction != null;
    }

    /**
     * Opens the replication session.
     *
     * @throws ReplicationProtocolException if the session cannot be opened
     */
    public void connect() {
        connection.connect();
    }

    /**
     * Closes the replication session.
     *
     * @throws IllegalBackupStateException if no session is open
     */
    public void disconnect() {
        connection.close();
    }

    /**
     * @return the name of the temporary replication slot of the open session
     * @throws IllegalBackupStateException if no session is open
     */
    public String tempSlotName() {
        return connection.tempSlotName();
    }

    public void txBegin() {
        if (transaction != null) {
            throw new IllegalBackupStateException("there is already a transaction in progress");
        }
        if (!connection.isOpen()) {
            throw new IllegalBackupStateException("no postgresql connection");
        }
        transaction = BackupTransaction.begin(connection, context);
    }

    public void txCommit() {
        requireTransactionAndConnection();
        transaction.commit();
        transaction = null;
    }

    public void txRollback() {
        requireTransactionAndConnection();
        transaction.rollback();
        transaction = null;
    }

    private void requireTransactionAndConnection() {
        requireTransaction();
        if (!connection.isOpen()) {
            throw new IllegalBackupStateException("no open connections");
        }
    }

    private void requireTransaction() {
        if (transaction == null) {
            throw new IllegalBackupStateException("no running transaction");
        }
    }

    /**
     * Creates a temporary logical replication slot that uses the snapshot of the running transaction. It has to be the
     * first command of the transaction. The slot is dropped by the server when the transaction ends.
     *
     * @return the slot information; never null
     * @throws IllegalBackupStateException if no transaction is running
     * @throws ReplicationProtocolException if the slot cannot be created or its consistent point is missing
     */
    public SlotCreationResult createTempReplicationSlot() {
        requireTransaction();
        String sql = String.format("CREATE_REPLICATION_SLOT %s TEMPORARY LOGICAL %s USE_SNAPSHOT",
                connection.tempSlotName(), config.plugin().getPostgresPluginName());
        SlotCreationResult result = transaction.queryAndMap(sql, "Could not create replication slot", rs -> {
            if (!rs.next()) {
                throw new ReplicationProtocolException("null consistent point");
            }
            String consistentPoint = rs.getString(2);
            if (consistentPoint == null) {
                throw new ReplicationProtocolException("null consistent point");
            }
            try {
                return new SlotCreationResult(rs.getString(1), Lsn.valueOf(consistentPoint), rs.getString(3), rs.getString(4));
            }
            catch (IllegalArgumentException e) {
                throw new ReplicationProtocolException("Could not parse consistent point", e);
            }
        });
        basebackupLsn = result.consistentPoint();
        LOGGER.info("Created temporary replication slot '{}' at {} with snapshot '{}'", result.slotName(),
                result.consistentPoint().asString(), result.snapshotName());
        return result;
    }

    /**
     * Locks the table in {@code ACCESS SHARE} mode for the rest of the transaction, so that it cannot be altered or
     * dropped while its contents are exported.
     *
     * @throws IllegalBackupStateException if no transaction is running
     */
    public void lockTable() {
        requireTransaction();
        transaction.execute("LOCK TABLE " + sanitizer.sanitize(tableId) + " IN ACCESS SHARE MODE", "Could not lock the table");
    }

    /**
     * Streams the table contents as seen by the running transaction into a temporary file next to the base backup and
     * then moves it over the base backup. If streaming fails, the transaction is rolled back, the temporary file is
     * removed and the existing base backup is left untouched.
     *
     * @return the number of rows written
     * @throws IllegalBackupStateException if no transaction is running or no consistent point has been established
     * @throws SnapshotExportException if streaming the contents fails
     * @throws BackupFileException if the temporary file cannot be created or moved
     */
    public long copyDump() {
        requireTransaction();
        if (!basebackupLsn.isValid()) {
            throw new IllegalBackupStateException("no consistent point");
        }
        Path tempPath = basebackupPath.resolveSibling(basebackupPath.getFileName() + ".new");
        try {
            Files.deleteIfExists(tempPath);
        }
        catch (IOException e) {
            throw new BackupFileException("Could not remove stale temporary file", tempPath, e);
        }

        FileChannel channel;
        try {
            channel = openTemporaryFile(tempPath);
        }
        catch (IOException e) {
            throw new BackupFileException("Could not open file", tempPath, e);
        }

        long rows;
        try (FileChannel file = channel; OutputStream stream = Channels.newOutputStream(file)) {
            rows = transaction.copyOut("COPY " + sanitizer.sanitize(tableId) + " TO STDOUT", stream);
            stream.flush();
            // contents must be on disk before the rename makes them the base backup
            file.force(true);
        }
        catch (IOException | BackupException e) {
            throw abortExport(tempPath, e);
        }

        try {
            Files.move(tempPath, basebackupPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        }
        catch (IOException e) {
            throw new BackupFileException("Could not move file to", basebackupPath, e);
        }
        LOGGER.info("Wrote {} rows of {} to {}", rows, tableId, basebackupPath);
        return rows;
    }

    @VisibleForTesting
    FileChannel openTemporaryFile(Path tempPath) throws IOException {
        return FileChannel.open(tempPath, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }

    private SnapshotExportException abortExport(Path tempPath, Exception copyFailure) {
        LOGGER.warn("Could not copy {}, rolling back the transaction", tableId, copyFailure);
        BackupException rollbackFailure = null;
        try {
            txRollback();
        }
        catch (BackupException e) {
            rollbackFailure = e;
        }
        SnapshotExportException failure = new SnapshotExportException("Could not copy " + tableId, copyFailure, rollbackFailure);
        try {
            Files.deleteIfExists(tempPath);
        }
        catch (IOException e) {
            failure.addSuppressed(new BackupFileException("Could not remove temporary file", tempPath, e));
        }
        return failure;
    }

    /**
     * Removes the delta files superseded by the current base backup from the configured delta directory.
     *
     * @see #rotateOldDeltas(Path, Lsn)
     * @throws IllegalBackupStateException if no delta directory is configured
     */
    public List<Path> rotateOldDeltas(Lsn current) {
        Path deltasDir = config.deltasDir()
                .orElseThrow(() -> new IllegalBackupStateException("no delta directory configured"));
        return rotateOldDeltas(deltasDir, current);
    }

    /**
     * Removes the delta files with a position strictly below the consistent point of the base backup, except the file
     * at the {@code current} position.
     *
     * @param deltasDir the directory with the delta files
     * @param current the position of the delta file that is being written
     * @return the deleted files; never null
     * @throws IllegalBackupStateException if no consistent point has been established
     */
    public List<Path> rotateOldDeltas(Path deltasDir, Lsn current) {
        return new DeltaFileRotator(deltasDir).rotate(current, basebackupLsn);
    }

    /**
     * Runs a complete backup cycle: connect, begin, create the slot, lock the table, copy it, commit and disconnect.
     * On failure the transaction is rolled back and the session closed; failures of that cleanup are attached to the
     * original failure as suppressed exceptions.
     *
     * @return the consistent point of the new base backup
     */
    public Lsn createBaseBackup() {
        basebackupLsn = Lsn.INVALID;
        try {
            if (!connection.isOpen()) {
                connect();
            }
            txBegin();
            createTempReplicationSlot();
            lockTable();
            copyDump();
            txCommit();
            disconnect();
        }
        catch (RuntimeException e) {
            cleanUpAfterFailure(e);
            throw e;
        }
        return basebackupLsn;
    }

    private void cleanUpAfterFailure(RuntimeException failure) {
        try {
            if (transaction != null && connection.isOpen()) {
                txRollback();
            }
        }
        catch (BackupException e) {
            failure.addSuppressed(e);
        }
        try {
            if (connection.isOpen()) {
                disconnect();
            }
            // the server ends the transaction with the session
            transaction = null;
        }
        catch (BackupException e) {
            failure.addSuppressed(e);
        }
        basebackupLsn = Lsn.INVALID;
    }
}
