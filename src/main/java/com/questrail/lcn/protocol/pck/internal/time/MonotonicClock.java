package com.questrail.lcn.protocol.pck.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for timeouts, retry spacing and status value ages.
 *
 * <h2>Binding invariant</h2>
 * Everything that decides <em>when</em> to resend, give up or treat a cached
 * status as stale uses this clock. Wall-clock time is used only for event
 * timestamps (see {@link WallClock}).
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between two readings are meaningful.
     */
    long nowNanos();

    /**
     * Same reading in milliseconds.
     */
    default long nowMillis()
    {
        return nowNanos() / 1_000_000L;
    }
}
