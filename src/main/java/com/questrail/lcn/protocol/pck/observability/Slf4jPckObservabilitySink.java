package com.questrail.lcn.protocol.pck.observability;

import com.questrail.lcn.protocol.pck.PckConnectionState;
import com.questrail.lcn.protocol.pck.model.LcnEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of PckObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jPckObservabilitySink implements PckObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jPckObservabilitySink.class);

    @Override
    public void onStateTransition(PckStateTransitionEvent event) {
        if (event.isReadinessChange()) {
            log.info("PCK connection {}: {} -> {} ({})",
                event.newState() == PckConnectionState.READY ? "ready" : "not ready",
                event.oldState(),
                event.newState(),
                event.trigger());
        } else {
            log.debug("PCK State: {} -> {} ({})", event.oldState(), event.newState(), event.trigger());
        }
    }

    @Override
    public void onLcnEvent(LcnEvent event) {
        switch (event) {
            case CONNECTION_LOST, PING_TIMEOUT, BUS_DISCONNECTED -> log.warn("LCN Event: {}", event);
            default -> log.info("LCN Event: {}", event);
        }
    }

    @Override
    public void onError(PckErrorEvent event) {
        log.error("PCK Error: {}", event.message(), event.cause());
    }
}
