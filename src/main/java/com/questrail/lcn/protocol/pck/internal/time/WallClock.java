package com.questrail.lcn.protocol.pck.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for observability timestamps (state transitions, error
 * events). Never used to decide timeouts.
 */
public interface WallClock
{
    Instant now();
}
