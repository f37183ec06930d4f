package com.questrail.lcn.protocol.pck.observability;

import com.questrail.lcn.protocol.pck.PckConnectionState;
import com.questrail.lcn.protocol.pck.model.LcnEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements PckObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(PckStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onLcnEvent(LcnEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(PckErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<PckStateTransitionEvent> getStateTransitions() {
        return events.stream()
            .filter(e -> e instanceof PckStateTransitionEvent)
            .map(e -> (PckStateTransitionEvent) e)
            .collect(Collectors.toList());
    }

    /** Target states of all transitions, in order. */
    public synchronized List<PckConnectionState> getVisitedStates() {
        return getStateTransitions().stream()
            .map(PckStateTransitionEvent::newState)
            .collect(Collectors.toList());
    }

    public synchronized List<LcnEvent> getLcnEvents() {
        return events.stream()
            .filter(e -> e instanceof LcnEvent)
            .map(e -> (LcnEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
