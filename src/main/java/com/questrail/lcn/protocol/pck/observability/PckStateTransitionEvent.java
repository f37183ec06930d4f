package com.questrail.lcn.protocol.pck.observability;

import com.questrail.lcn.protocol.pck.PckConnectionState;

import java.time.Instant;
import java.util.Objects;

/**
 * A change of the connection state machine, with the input or lifecycle
 * signal that caused it.
 */
public record PckStateTransitionEvent(
    Instant timestamp,
    PckConnectionState oldState,
    PckConnectionState newState,
    String trigger
) {
    public PckStateTransitionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(oldState, "oldState");
        Objects.requireNonNull(newState, "newState");
    }

    /**
     * {@code true} if the transition entered or left {@link PckConnectionState#READY}.
     */
    public boolean isReadinessChange() {
        return (oldState == PckConnectionState.READY) != (newState == PckConnectionState.READY);
    }
}
