/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.postgresql;

import io.tablebackup.config.EnumeratedValue;

/**
 * The logical decoding output plugins a temporary replication slot can be created with.
 */
public enum LogicalDecoder implements EnumeratedValue {
    PGOUTPUT("pgoutput"),
    DECODERBUFS("decoderbufs"),
    WAL2JSON("wal2json");

    private final String decoderName;

    LogicalDecoder(String decoderName) {
        this.decoderName = decoderName;
    }

    /**
     * Determine the decoder for the given plugin name, ignoring case and surrounding whitespace.
     *
     * @param s the plugin name
     * @return the decoder; never null
     * @throws IllegalArgumentException if no decoder has the given name
     */
    public static LogicalDecoder parse(String s) {
        String name = s.trim();
        for (LogicalDecoder decoder : values()) {
            if (decoder.decoderName.equalsIgnoreCase(name)) {
                return decoder;
            }
        }
        throw new IllegalArgumentException("Unknown logical decoding plugin '" + s + "'");
    }

    public String getPostgresPluginName() {
        return decoderName;
    }

    @Override
    public String getValue() {
        return decoderName;
    }
}
