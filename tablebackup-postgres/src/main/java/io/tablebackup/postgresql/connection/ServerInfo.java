/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.postgresql.connection;

import java.util.Collections;
import java.util.Map;

/**
 * Information about the server obtained while opening a replication session.
 */
public class ServerInfo {

    private final String systemId;
    private final int timeline;
    private final Lsn xlogPosition;
    private final String database;
    private final String serverVersion;
    private final Map<Integer, String> typeNamesByOid;

    public ServerInfo(String systemId, int timeline, Lsn xlogPosition, String database, String serverVersion,
                      Map<Integer, String> typeNamesByOid) {
        this.systemId = systemId;
        this.timeline = timeline;
        this.xlogPosition = xlogPosition;
        this.database = database;
        this.serverVersion = serverVersion;
        this.typeNamesByOid = Collections.unmodifiableMap(typeNamesByOid);
    }

    public String systemId() {
        return systemId;
    }

    public int timeline() {
        return timeline;
    }

    /**
     * @return the write-ahead log flush position reported when the session was opened
     */
    public Lsn xlogPosition() {
        return xlogPosition;
    }

    public String database() {
        return database;
    }

    public String serverVersion() {
        return serverVersion;
    }

    /**
     * @return the names of the server's data types keyed by their oid; never null
     */
    public Map<Integer, String> typeNamesByOid() {
        return typeNamesByOid;
    }

    @Override
    public String toString() {
        return "ServerInfo [systemId=" + systemId + ", timeline=" + timeline + ", xlogPosition=" + xlogPosition
                + ", database=" + database + ", serverVersion=" + serverVersion + ", types=" + typeNamesByOid.size() + "]";
    }
}
