package com.questrail.lcn.protocol.pck.observability;

import com.questrail.lcn.protocol.pck.model.LcnEvent;

/**
 * No-op implementation of PckObservabilitySink.
 */
public final class NullObservabilitySink implements PckObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(PckStateTransitionEvent event) {}

    @Override
    public void onLcnEvent(LcnEvent event) {}

    @Override
    public void onError(PckErrorEvent event) {}
}
