package com.questrail.lcn.protocol.pck.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a task handed to a {@link MonotonicScheduler}.
 *
 * <p>
 * Retry handlers, the keepalive loop and the status requester keep one of
 * these per armed timeout and cancel it when the awaited reply arrives.
 * </p>
 */
public interface Cancellable
{
    /**
     * Cancels the scheduled task if it has not run yet.
     *
     * @return {@code true} if the task will not run; {@code false} if it
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
