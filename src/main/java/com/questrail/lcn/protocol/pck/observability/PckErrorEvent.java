package com.questrail.lcn.protocol.pck.observability;

import java.time.Instant;

/**
 * An error or anomaly in the PCK client: handshake rejection, transport
 * failure, a throwing listener.
 */
public record PckErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
