package com.questrail.lcn.protocol.pck.device;

import com.questrail.lcn.protocol.pck.config.PckConnectionConfig;
import com.questrail.lcn.protocol.pck.internal.time.MonotonicClock;
import com.questrail.lcn.protocol.pck.internal.time.MonotonicScheduler;
import com.questrail.lcn.protocol.pck.status.StatusRequester;

import java.util.concurrent.CompletableFuture;

/**
 * What a device connection needs from the connection that owns it.
 *
 * <p>Implemented by {@code PckConnectionManager}. Implementations must not
 * take the owner's lock in {@link #sendLine(String)} or
 * {@link #localSegmentId()}; device connections call them while holding
 * their own lock.</p>
 */
public interface ConnectionContext
{
    /**
     * Writes one complete PCK line (address header included).
     *
     * @return {@code false} if the line was dropped because the bus is not
     *         connected
     */
    boolean sendLine(String line);

    /** Local segment id, or -1 while unknown. */
    int localSegmentId();

    /**
     * Completes when the local segment id has been resolved (or the scan gave
     * up). Replaced by a fresh future after each bus disconnect.
     */
    CompletableFuture<Void> segmentScanCompleted();

    MonotonicScheduler scheduler();

    MonotonicClock clock();

    PckConnectionConfig config();

    StatusRequester statusRequester();
}
