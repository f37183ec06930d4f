package com.questrail.lcn.protocol.pck.model;

/**
 * Connection-level events published by the connection manager.
 */
public enum LcnEvent {
    CONNECTION_LOST,
    BUS_CONNECTION_STATUS_CHANGED,
    BUS_CONNECTED,
    BUS_DISCONNECTED,
    PING_TIMEOUT
}
