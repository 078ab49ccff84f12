package com.questrail.homeshadow.protocol.isy.observability;

import java.util.ArrayList;
import java.util.List;

/**
 * RecordingObservabilitySink
 * -----------------------------------------------------------------------------
 * Keeps every reported event, split by category, for assertions. Safe to read
 * from the test thread while the dispatch thread is still reporting.
 */
public final class RecordingObservabilitySink implements ShadowObservabilitySink {

    private final List<SessionTransitionEvent> transitions = new ArrayList<>();
    private final List<TransportObservabilityEvent> transportEvents = new ArrayList<>();
    private final List<ShadowErrorEvent> errors = new ArrayList<>();

    @Override
    public synchronized void onSessionTransition(SessionTransitionEvent event) {
        transitions.add(event);
    }

    @Override
    public synchronized void onTransportEvent(TransportObservabilityEvent event) {
        transportEvents.add(event);
    }

    @Override
    public synchronized void onError(ShadowErrorEvent event) {
        errors.add(event);
    }

    public synchronized List<SessionTransitionEvent> sessionTransitions() {
        return List.copyOf(transitions);
    }

    public synchronized List<TransportObservabilityEvent> transportEvents() {
        return List.copyOf(transportEvents);
    }

    /** Transport kinds reported for one session, in order. */
    public synchronized List<TransportObservabilityEvent.Kind> transportKinds(long sessionId) {
        List<TransportObservabilityEvent.Kind> kinds = new ArrayList<>();
        for (TransportObservabilityEvent e : transportEvents) {
            if (e.sessionId() == sessionId) {
                kinds.add(e.kind());
            }
        }
        return kinds;
    }

    public synchronized List<ShadowErrorEvent> errors() {
        return List.copyOf(errors);
    }
}
