/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.postgresql.spi;

import io.tablebackup.postgresql.connection.Lsn;

/**
 * A simple data container representing the creation of a temporary replication slot bound to the snapshot of the
 * running transaction.
 */
public class SlotCreationResult {

    private final String slotName;
    private final Lsn consistentPoint;
    private final String snapshotName;
    private final String pluginName;

    public SlotCreationResult(String slotName, Lsn consistentPoint, String snapshotName, String pluginName) {
        this.slotName = slotName;
        this.consistentPoint = consistentPoint;
        this.snapshotName = snapshotName;
        this.pluginName = pluginName;
    }

    public String slotName() {
        return slotName;
    }

    /**
     * @return the position from which changes not contained in the snapshot are decoded
     */
    public Lsn consistentPoint() {
        return consistentPoint;
    }

    public String snapshotName() {
        return snapshotName;
    }

    public String pluginName() {
        return pluginName;
    }

    @Override
    public String toString() {
        return "SlotCreationResult [slotName=" + slotName + ", consistentPoint=" + consistentPoint + ", snapshotName="
                + snapshotName + ", pluginName=" + pluginName + "]";
    }
}
