/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.postgresql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import io.tablebackup.postgresql.connection.Lsn;

public class DeltaFileRotatorTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path dir;
    private DeltaFileRotator rotator;

    @Before
    public void beforeEach() throws IOException {
        dir = folder.newFolder("deltas").toPath();
        rotator = new DeltaFileRotator(dir);
    }

    private void createFiles(String... names) throws IOException {
        for (String name : names) {
            Files.write(dir.resolve(name), name.getBytes());
        }
    }

    private static Lsn lsn(long value) {
        return Lsn.valueOf(value);
    }

    @Test
    public void shouldDeleteFilesBelowThresholdAndKeepCurrent() throws IOException {
        createFiles("5", "a", "14");

        List<Path> deleted = rotator.rotate(lsn(20), lsn(10));

        assertThat(deleted).containsExactly(dir.resolve("5"));
        assertThat(dir.resolve("5")).doesNotExist();
        assertThat(dir.resolve("a")).exists();
        assertThat(dir.resolve("14")).exists();
    }

    @Test
    public void shouldUsePositionBeforeFirstDot() throws IOException {
        createFiles("1.partial", "2.gz.tmp", "20.partial");

        List<Path> deleted = rotator.rotate(lsn(0x20), lsn(0x10));

        assertThat(deleted).containsExactly(dir.resolve("1.partial"), dir.resolve("2.gz.tmp"));
        assertThat(dir.resolve("20.partial")).exists();
    }

    @Test
    public void shouldNeverDeleteCurrentFile() throws IOException {
        createFiles("3", "4");

        List<Path> deleted = rotator.rotate(lsn(3), lsn(10));

        assertThat(deleted).containsExactly(dir.resolve("4"));
        assertThat(dir.resolve("3")).exists();
    }

    @Test
    public void shouldCompareUnsigned() throws IOException {
        createFiles("ffffffffffffffff", "1");

        rotator.rotate(Lsn.INVALID, lsn(0x10));

        assertThat(dir.resolve("ffffffffffffffff")).exists();
        assertThat(dir.resolve("1")).doesNotExist();
    }

    @Test
    public void shouldStopAtFirstUnparsableName() throws IOException {
        // name order: 0a, 0x-bad, 1
        createFiles("1", "0x-bad", "0a");

        assertThatThrownBy(() -> rotator.rotate(Lsn.INVALID, lsn(0x10)))
                .isInstanceOf(DeltaFileNameException.class)
                .satisfies(e -> assertThat(((DeltaFileNameException) e).getFileName()).isEqualTo("0x-bad"));

        assertThat(dir.resolve("0a")).doesNotExist();
        assertThat(dir.resolve("0x-bad")).exists();
        assertThat(dir.resolve("1")).exists();
    }

    @Test
    public void shouldRejectNonAsciiDigits() throws IOException {
        // name order: 1, arabic-indic five, fullwidth five
        createFiles("1", "\u0665", "\uFF15.partial");

        assertThatThrownBy(() -> rotator.rotate(Lsn.INVALID, lsn(0x10)))
                .isInstanceOf(DeltaFileNameException.class)
                .satisfies(e -> assertThat(((DeltaFileNameException) e).getFileName()).isEqualTo("\u0665"));

        assertThat(dir.resolve("1")).doesNotExist();
        assertThat(dir.resolve("\u0665")).exists();
        assertThat(dir.resolve("\uFF15.partial")).exists();
    }

    @Test
    public void shouldAcceptPositionsWithLeadingZeros() throws IOException {
        createFiles("00000000000000000005", "000000000000000000020.partial");

        List<Path> deleted = rotator.rotate(Lsn.INVALID, lsn(0x10));

        assertThat(deleted).containsExactly(dir.resolve("00000000000000000005"));
        assertThat(dir.resolve("000000000000000000020.partial")).exists();
    }

    @Test
    public void shouldRefuseUnsetThreshold() throws IOException {
        createFiles("1");

        assertThatThrownBy(() -> rotator.rotate(lsn(5), Lsn.INVALID))
                .isInstanceOf(IllegalBackupStateException.class)
                .hasMessage("no consistent point");
        assertThat(dir.resolve("1")).exists();
    }

    @Test
    public void shouldReportMissingDirectory() {
        DeltaFileRotator missing = new DeltaFileRotator(dir.resolve("missing"));

        assertThatThrownBy(() -> missing.rotate(lsn(5), lsn(10)))
                .isInstanceOf(BackupFileException.class)
                .satisfies(e -> assertThat(((BackupFileException) e).isRetriable()).isTrue());
    }

    @Test
    public void shouldReturnNothingForEmptyDirectory() {
        assertThat(rotator.rotate(lsn(5), lsn(10))).isEmpty();
    }
}
