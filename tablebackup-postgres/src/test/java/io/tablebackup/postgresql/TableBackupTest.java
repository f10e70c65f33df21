/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.postgresql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.InOrder;

import io.tablebackup.BackupException;
import io.tablebackup.config.Configuration;
import io.tablebackup.postgresql.connection.Lsn;
import io.tablebackup.postgresql.connection.MockedReplicationServer;
import io.tablebackup.postgresql.spi.SlotCreationResult;
import io.tablebackup.relational.IdentifierSanitizer;

public class TableBackupTest {

    private static final String QUOTED_TABLE = "\"public\".\"orders\"";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private MockedReplicationServer server;
    private Path basebackup;
    private Path tempFile;
    private Path deltas;
    private TableBackup backup;

    @Before
    public void beforeEach() throws Exception {
        server = new MockedReplicationServer();
        basebackup = folder.getRoot().toPath().resolve("orders");
        tempFile = folder.getRoot().toPath().resolve("orders.new");
        deltas = folder.newFolder("deltas").toPath();
        backup = backup(config().build());
    }

    private Configuration.Builder config() {
        return Configuration.create()
                .with(TableBackupConfig.HOSTNAME, "localhost")
                .with(TableBackupConfig.USER, "backup")
                .with(TableBackupConfig.DATABASE_NAME, "app")
                .with(TableBackupConfig.TABLE_NAME, "public.orders")
                .with(TableBackupConfig.BASEBACKUP_PATH, basebackup.toString())
                .with(TableBackupConfig.DELTAS_DIR, deltas.toString());
    }

    private TableBackup backup(Configuration config) {
        return new TableBackup(new TableBackupConfig(config), server.replicationConnection(), IdentifierSanitizer.DOUBLE_QUOTED);
    }

    private void beginWithSlot() {
        backup.connect();
        backup.txBegin();
        backup.createTempReplicationSlot();
    }

    private static String read(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    @Test
    public void shouldRejectInvalidConfiguration() {
        Configuration config = config().with(TableBackupConfig.TABLE_NAME, (String) null).build();

        assertThatThrownBy(() -> backup(config))
                .isInstanceOf(BackupException.class)
                .hasMessageContaining("table.name");
    }

    @Test
    public void shouldRequireConnectionToBegin() throws SQLException {
        assertThatThrownBy(() -> backup.txBegin())
                .isInstanceOf(IllegalBackupStateException.class)
                .hasMessage("no postgresql connection");
        assertThat(backup.isTransactionOpen()).isFalse();
    }

    @Test
    public void shouldBeginReadOnlyRepeatableReadTransaction() throws SQLException {
        backup.connect();
        backup.txBegin();

        verify(server.statement).execute("BEGIN TRANSACTION ISOLATION LEVEL REPEATABLE READ READ ONLY");
        assertThat(backup.isTransactionOpen()).isTrue();
    }

    @Test
    public void shouldRefuseSecondTransaction() throws SQLException {
        backup.connect();
        backup.txBegin();

        assertThatThrownBy(() -> backup.txBegin())
                .isInstanceOf(IllegalBackupStateException.class)
                .hasMessage("there is already a transaction in progress");
        verify(server.statement).execute(BackupTransaction.BEGIN);
    }

    @Test
    public void shouldRequireTransactionToCommitOrRollBack() {
        backup.connect();

        assertThatThrownBy(() -> backup.txCommit())
                .isInstanceOf(IllegalBackupStateException.class)
                .hasMessage("no running transaction");
        assertThatThrownBy(() -> backup.txRollback())
                .isInstanceOf(IllegalBackupStateException.class)
                .hasMessage("no running transaction");
    }

    @Test
    public void shouldRequireConnectionToCommit() {
        backup.connect();
        backup.txBegin();
        backup.disconnect();

        assertThatThrownBy(() -> backup.txCommit())
                .isInstanceOf(IllegalBackupStateException.class)
                .hasMessage("no open connections");
        assertThat(backup.isTransactionOpen()).isTrue();
    }

    @Test
    public void shouldClearTransactionOnCommitAndRollback() throws SQLException {
        backup.connect();
        backup.txBegin();
        backup.txCommit();
        assertThat(backup.isTransactionOpen()).isFalse();

        backup.txBegin();
        backup.txRollback();
        assertThat(backup.isTransactionOpen()).isFalse();

        verify(server.statement).execute("COMMIT");
        verify(server.statement).execute("ROLLBACK");
    }

    @Test
    public void shouldKeepTransactionWhenCommitFails() throws SQLException {
        backup.connect();
        backup.txBegin();
        doThrow(new SQLException("terminating connection", "08006")).when(server.statement).execute("COMMIT");

        assertThatThrownBy(() -> backup.txCommit())
                .isInstanceOf(ReplicationProtocolException.class)
                .satisfies(e -> {
                    assertThat(((ReplicationProtocolException) e).getSqlState()).isEqualTo("08006");
                    assertThat(((ReplicationProtocolException) e).isRetriable()).isTrue();
                });
        assertThat(backup.isTransactionOpen()).isTrue();

        backup.txRollback();
        assertThat(backup.isTransactionOpen()).isFalse();
    }

    @Test
    public void shouldRefuseToBeginAfterCancellation() throws SQLException {
        backup.connect();
        backup.context().cancel();

        assertThatThrownBy(() -> backup.txBegin()).isInstanceOf(BackupCancelledException.class);
        verify(server.statement, never()).execute(anyString());
        assertThat(backup.isTransactionOpen()).isFalse();
    }

    @Test
    public void shouldCancelRunningBegin() throws SQLException {
        backup.connect();
        doAnswer(inv -> {
            backup.context().cancel();
            throw new SQLException("canceling statement due to user request", "57014");
        }).when(server.statement).execute(BackupTransaction.BEGIN);

        assertThatThrownBy(() -> backup.txBegin()).isInstanceOf(BackupCancelledException.class);
        verify(server.statement).cancel();
        assertThat(backup.isTransactionOpen()).isFalse();
    }

    @Test
    public void shouldNotBeginWhenCancelledBeforeStatementIsRegistered() throws SQLException {
        backup.connect();
        when(server.connection.createStatement()).thenAnswer(inv -> {
            backup.context().cancel();
            return server.statement;
        });

        assertThatThrownBy(() -> backup.txBegin()).isInstanceOf(BackupCancelledException.class);
        verify(server.statement, never()).execute(BackupTransaction.BEGIN);
        assertThat(backup.isTransactionOpen()).isFalse();
    }

    @Test
    public void shouldRequireTransactionForSlot() {
        backup.connect();

        assertThatThrownBy(() -> backup.createTempReplicationSlot())
                .isInstanceOf(IllegalBackupStateException.class)
                .hasMessage("no running transaction");
    }

    @Test
    public void shouldCreateTemporarySlotUsingTransactionSnapshot() throws SQLException {
        backup.connect();
        backup.txBegin();

        SlotCreationResult result = backup.createTempReplicationSlot();

        verify(server.statement).executeQuery("CREATE_REPLICATION_SLOT tempslot_4242 TEMPORARY LOGICAL pgoutput USE_SNAPSHOT");
        assertThat(result.slotName()).isEqualTo("tempslot_4242");
        assertThat(result.snapshotName()).isEqualTo("00000003-00000002-1");
        assertThat(result.pluginName()).isEqualTo("pgoutput");
        assertThat(result.consistentPoint()).isEqualTo(Lsn.valueOf(MockedReplicationServer.CONSISTENT_POINT));
        assertThat(backup.basebackupLsn()).isEqualTo(result.consistentPoint());
    }

    @Test
    public void shouldCreateSlotWithConfiguredPlugin() throws SQLException {
        backup = backup(config().with(TableBackupConfig.PLUGIN_NAME, LogicalDecoder.WAL2JSON).build());
        beginWithSlot();

        verify(server.statement).executeQuery("CREATE_REPLICATION_SLOT tempslot_4242 TEMPORARY LOGICAL wal2json USE_SNAPSHOT");
    }

    @Test
    public void shouldFailOnNullConsistentPoint() throws SQLException {
        server.slotCreationReturns("tempslot_4242", null, "snap", "pgoutput");
        backup.connect();
        backup.txBegin();

        assertThatThrownBy(() -> backup.createTempReplicationSlot())
                .isInstanceOf(ReplicationProtocolException.class)
                .hasMessage("null consistent point");
        assertThat(backup.basebackupLsn().isValid()).isFalse();
    }

    @Test
    public void shouldFailOnMissingSlotRow() throws SQLException {
        backup.connect();
        backup.txBegin();
        when(server.statement.executeQuery(startsWith("CREATE_REPLICATION_SLOT"))).thenAnswer(inv -> MockedReplicationServer.rows());

        assertThatThrownBy(() -> backup.createTempReplicationSlot()).isInstanceOf(ReplicationProtocolException.class);
        assertThat(backup.basebackupLsn().isValid()).isFalse();
    }

    @Test
    public void shouldFailOnMalformedConsistentPoint() throws SQLException {
        server.slotCreationReturns("tempslot_4242", "not-a-position", "snap", "pgoutput");
        backup.connect();
        backup.txBegin();

        assertThatThrownBy(() -> backup.createTempReplicationSlot())
                .isInstanceOf(ReplicationProtocolException.class)
                .satisfies(e -> assertThat(((ReplicationProtocolException) e).isRetriable()).isFalse());
        assertThat(backup.basebackupLsn().isValid()).isFalse();
    }

    @Test
    public void shouldLockTableInAccessShareMode() throws SQLException {
        beginWithSlot();
        backup.lockTable();

        verify(server.statement).execute("LOCK TABLE " + QUOTED_TABLE + " IN ACCESS SHARE MODE");
    }

    @Test
    public void shouldRefuseToCopyWithoutConsistentPoint() {
        backup.connect();
        backup.txBegin();

        assertThatThrownBy(() -> backup.copyDump())
                .isInstanceOf(IllegalBackupStateException.class)
                .hasMessage("no consistent point");
        assertThat(basebackup).doesNotExist();
        assertThat(tempFile).doesNotExist();
    }

    @Test
    public void shouldRefuseToCopyWithoutTransaction() {
        backup.connect();

        assertThatThrownBy(() -> backup.copyDump())
                .isInstanceOf(IllegalBackupStateException.class)
                .hasMessage("no running transaction");
        assertThat(tempFile).doesNotExist();
    }

    @Test
    public void shouldWriteDumpAtomically() throws Exception {
        Files.write(basebackup, "old".getBytes(StandardCharsets.UTF_8));
        Files.write(tempFile, "stale".getBytes(StandardCharsets.UTF_8));
        beginWithSlot();

        long rows = backup.copyDump();

        assertThat(rows).isEqualTo(2);
        assertThat(read(basebackup)).isEqualTo(MockedReplicationServer.TABLE_CONTENTS);
        assertThat(tempFile).doesNotExist();
        verify(server.copyManager).copyOut(eq("COPY " + QUOTED_TABLE + " TO STDOUT"), any(OutputStream.class));
        assertThat(backup.isTransactionOpen()).isTrue();
    }

    @Test
    public void shouldForceDumpToDiskBeforeReplacingBaseBackup() throws Exception {
        Files.write(basebackup, "old".getBytes(StandardCharsets.UTF_8));
        AtomicReference<RecordingFileChannel> channel = new AtomicReference<>();
        AtomicReference<String> basebackupWhenForced = new AtomicReference<>();
        backup = new TableBackup(new TableBackupConfig(config().build()), server.replicationConnection(),
                IdentifierSanitizer.DOUBLE_QUOTED) {
            @Override
            FileChannel openTemporaryFile(Path tempPath) throws IOException {
                channel.set(new RecordingFileChannel(super.openTemporaryFile(tempPath), () -> {
                    try {
                        basebackupWhenForced.set(read(basebackup));
                    }
                    catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                }));
                return channel.get();
            }
        };
        beginWithSlot();

        backup.copyDump();

        assertThat(channel.get().forcedMetadata()).containsExactly(true);
        assertThat(channel.get().sizesWhenForced()).containsExactly((long) MockedReplicationServer.TABLE_CONTENTS.length());
        assertThat(channel.get().isOpen()).isFalse();
        assertThat(basebackupWhenForced.get()).isEqualTo("old");
        assertThat(read(basebackup)).isEqualTo(MockedReplicationServer.TABLE_CONTENTS);
    }

    @Test
    public void shouldRollBackAndKeepPreviousDumpWhenCopyFails() throws Exception {
        Files.write(basebackup, "old".getBytes(StandardCharsets.UTF_8));
        when(server.copyManager.copyOut(anyString(), any(OutputStream.class))).thenAnswer(inv -> {
            OutputStream out = inv.getArgument(1);
            out.write("1\tpartial".getBytes(StandardCharsets.UTF_8));
            throw new SQLException("connection lost", "08006");
        });
        beginWithSlot();

        assertThatThrownBy(() -> backup.copyDump())
                .isInstanceOf(SnapshotExportException.class)
                .hasCauseInstanceOf(ReplicationProtocolException.class)
                .satisfies(e -> assertThat(((SnapshotExportException) e).getRollbackFailure()).isNull());

        verify(server.statement).execute("ROLLBACK");
        assertThat(backup.isTransactionOpen()).isFalse();
        assertThat(tempFile).doesNotExist();
        assertThat(read(basebackup)).isEqualTo("old");
    }

    @Test
    public void shouldReportRollbackFailureWhenCopyFails() throws Exception {
        when(server.copyManager.copyOut(anyString(), any(OutputStream.class))).thenThrow(new IOException("disk full"));
        doThrow(new SQLException("connection lost", "08006")).when(server.statement).execute("ROLLBACK");
        beginWithSlot();

        assertThatThrownBy(() -> backup.copyDump())
                .isInstanceOf(SnapshotExportException.class)
                .hasCauseInstanceOf(IOException.class)
                .satisfies(e -> {
                    BackupException rollbackFailure = ((SnapshotExportException) e).getRollbackFailure();
                    assertThat(rollbackFailure).isInstanceOf(ReplicationProtocolException.class);
                    assertThat(e.getSuppressed()).contains(rollbackFailure);
                });

        assertThat(backup.isTransactionOpen()).isTrue();
        assertThat(tempFile).doesNotExist();
        assertThat(basebackup).doesNotExist();
    }

    @Test
    public void shouldRefuseToRotateWithoutConsistentPoint() throws IOException {
        Files.write(deltas.resolve("1"), new byte[0]);

        assertThatThrownBy(() -> backup.rotateOldDeltas(deltas, Lsn.INVALID))
                .isInstanceOf(IllegalBackupStateException.class);
        assertThat(deltas.resolve("1")).exists();
    }

    @Test
    public void shouldRotateDeltasBelowBackupPosition() throws IOException {
        // consistent point 0/16B3780 == 16b3780
        Files.write(deltas.resolve("16b3000"), new byte[0]);
        Files.write(deltas.resolve("16b3780.partial"), new byte[0]);
        Files.write(deltas.resolve("16b4000"), new byte[0]);
        beginWithSlot();

        List<Path> deleted = backup.rotateOldDeltas(Lsn.fromHexString("16b4000"));

        assertThat(deleted).containsExactly(deltas.resolve("16b3000"));
        assertThat(deltas.resolve("16b3780.partial")).exists();
        assertThat(deltas.resolve("16b4000")).exists();
    }

    @Test
    public void shouldRequireDeltaDirectoryForDefaultRotation() {
        backup = backup(config().with(TableBackupConfig.DELTAS_DIR, (String) null).build());

        assertThatThrownBy(() -> backup.rotateOldDeltas(Lsn.INVALID))
                .isInstanceOf(IllegalBackupStateException.class)
                .hasMessage("no delta directory configured");
    }

    @Test
    public void shouldRunCompleteBackupCycle() throws Exception {
        Lsn lsn = backup.createBaseBackup();

        assertThat(lsn).isEqualTo(Lsn.valueOf(MockedReplicationServer.CONSISTENT_POINT));
        assertThat(read(basebackup)).isEqualTo(MockedReplicationServer.TABLE_CONTENTS);
        InOrder order = inOrder(server.statement, server.copyManager, server.connection);
        order.verify(server.statement).execute(BackupTransaction.BEGIN);
        order.verify(server.statement).executeQuery("CREATE_REPLICATION_SLOT tempslot_4242 TEMPORARY LOGICAL pgoutput USE_SNAPSHOT");
        order.verify(server.statement).execute("LOCK TABLE " + QUOTED_TABLE + " IN ACCESS SHARE MODE");
        order.verify(server.copyManager).copyOut(anyString(), any(OutputStream.class));
        order.verify(server.statement).execute(BackupTransaction.COMMIT);
        order.verify(server.connection).close();
        assertThat(backup.isTransactionOpen()).isFalse();
    }

    @Test
    public void shouldRollBackAndDisconnectWhenCycleFails() throws Exception {
        doThrow(new SQLException("permission denied", "42501"))
                .when(server.statement).execute("LOCK TABLE " + QUOTED_TABLE + " IN ACCESS SHARE MODE");

        assertThatThrownBy(() -> backup.createBaseBackup())
                .isInstanceOf(ReplicationProtocolException.class)
                .hasMessageContaining("Could not lock the table");

        verify(server.statement).execute(BackupTransaction.ROLLBACK);
        verify(server.connection).close();
        verify(server.copyManager, never()).copyOut(anyString(), any(OutputStream.class));
        assertThat(backup.isTransactionOpen()).isFalse();
        assertThat(backup.basebackupLsn().isValid()).isFalse();
        assertThat(basebackup).doesNotExist();
    }

    @Test
    public void shouldAttachCleanupFailuresToCycleFailure() throws Exception {
        doThrow(new SQLException("permission denied", "42501"))
                .when(server.statement).execute("LOCK TABLE " + QUOTED_TABLE + " IN ACCESS SHARE MODE");
        doThrow(new SQLException("connection lost", "08006")).when(server.statement).execute(BackupTransaction.ROLLBACK);

        assertThatThrownBy(() -> backup.createBaseBackup())
                .isInstanceOf(ReplicationProtocolException.class)
                .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));

        verify(server.connection).close();
    }
}
