package com.questrail.lcn.protocol.pck.observability;

import com.questrail.lcn.protocol.pck.model.LcnEvent;

/**
 * Receives observability events from the PCK connection manager.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface PckObservabilitySink {
    /**
     * Called when the connection state machine changes state.
     * @param event the transition event details
     */
    void onStateTransition(PckStateTransitionEvent event);

    /**
     * Called for every connection event also delivered to event listeners
     * (bus connected, ping timeout, connection lost, ...).
     * @param event the event
     */
    void onLcnEvent(LcnEvent event);

    /**
     * Called when an error or anomaly occurs.
     * @param event the error event
     */
    void onError(PckErrorEvent event);
}
