/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.postgresql.connection;

import java.nio.ByteBuffer;

import io.tablebackup.annotation.Immutable;
import io.tablebackup.util.Strings;

/**
 * LSN (Log Sequence Number): a pointer to a location in the write-ahead log, compared as an unsigned 64-bit value.
 * <p>
 * Two textual forms exist. The server form, used by replication commands, is two hexadecimal numbers of up to 8 digits
 * separated by a slash ({@code 16/3002D50}). The file form, used to name delta files, is a single lowercase hexadecimal
 * number of up to 16 significant digits ({@code 1603002d50}).
 */
@Immutable
public final class Lsn implements Comparable<Lsn> {

    /**
     * Zero is used to indicate an invalid pointer, as no WAL record can begin at zero.
     */
    public static final Lsn INVALID = new Lsn(0);

    private static final int MAX_PART_DIGITS = 8;
    private static final int MAX_DIGITS = 16;

    private final long value;

    private Lsn(long value) {
        this.value = value;
    }

    /**
     * @param value numeric position in the write-ahead log stream, interpreted as unsigned
     * @return the LSN; never null
     */
    public static Lsn valueOf(long value) {
        return value == 0 ? INVALID : new Lsn(value);
    }

    /**
     * Parses the server form of a log position.
     *
     * @param strValue two hexadecimal numbers of 1 to 8 digits each separated by a slash, e.g. {@code 0/15D68C50}
     * @return the LSN; never null
     * @throws IllegalArgumentException if the value is null or not in the expected form
     */
    public static Lsn valueOf(String strValue) {
        if (strValue == null) {
            throw new IllegalArgumentException("Log position is null");
        }
        int slashIndex = strValue.indexOf('/');
        if (slashIndex < 0 || slashIndex != strValue.lastIndexOf('/')) {
            throw new IllegalArgumentException("Log position '" + strValue + "' is not of the form XXXXXXXX/XXXXXXXX");
        }
        String logicalXlog = strValue.substring(0, slashIndex);
        String segment = strValue.substring(slashIndex + 1);
        if (!isHexOfLength(logicalXlog, MAX_PART_DIGITS) || !isHexOfLength(segment, MAX_PART_DIGITS)) {
            throw new IllegalArgumentException("Log position '" + strValue + "' is not of the form XXXXXXXX/XXXXXXXX");
        }
        ByteBuffer buf = ByteBuffer.allocate(8);
        buf.putInt((int) Long.parseLong(logicalXlog, 16));
        buf.putInt((int) Long.parseLong(segment, 16));
        buf.position(0);
        return valueOf(buf.getLong());
    }

    /**
     * Parses the file form of a log position.
     *
     * @param hex a hexadecimal number in either case, without sign or prefix, of at most 16 digits once leading zeros
     *            are ignored
     * @return the LSN; never null
     * @throws IllegalArgumentException if the value is null or not in the expected form
     */
    public static Lsn fromHexString(String hex) {
        if (!Strings.isHexadecimal(hex)) {
            throw new IllegalArgumentException("'" + hex + "' is not a hexadecimal log position");
        }
        String significant = stripLeadingZeros(hex);
        if (significant.length() > MAX_DIGITS) {
            throw new IllegalArgumentException("'" + hex + "' is out of the range of a log position");
        }
        return valueOf(Long.parseUnsignedLong(significant, 16));
    }

    private static String stripLeadingZeros(String hex) {
        int start = 0;
        while (start < hex.length() - 1 && hex.charAt(start) == '0') {
            start++;
        }
        return hex.substring(start);
    }

    private static boolean isHexOfLength(String str, int maxDigits) {
        return Strings.isHexadecimal(str) && str.length() <= maxDigits;
    }

    /**
     * @return the position in the write-ahead log stream; to be interpreted as unsigned
     */
    public long asLong() {
        return value;
    }

    /**
     * @return the server form, e.g. {@code 16/3002D50}
     */
    public String asString() {
        ByteBuffer buf = ByteBuffer.allocate(8);
        buf.putLong(value);
        buf.position(0);

        int logicalXlog = buf.getInt();
        int segment = buf.getInt();
        return String.format("%X/%X", logicalXlog, segment);
    }

    /**
     * @return the file form, e.g. {@code 1603002d50}
     */
    public String toHexString() {
        return Long.toHexString(value);
    }

    public boolean isValid() {
        return value != 0;
    }

    @Override
    public int compareTo(Lsn o) {
        return Long.compareUnsigned(value, o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value == ((Lsn) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "LSN{" + asString() + '}';
    }
}
