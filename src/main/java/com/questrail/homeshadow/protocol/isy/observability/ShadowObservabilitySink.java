package com.questrail.homeshadow.protocol.isy.observability;

/**
 * Main interface for receiving shadow client observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Called on the dispatch loop; implementations must not block.</p>
 */
public interface ShadowObservabilitySink {
    /**
     * Called after the supervisor processed an event.
     * @param event the transition event details
     */
    void onSessionTransition(SessionTransitionEvent event);

    /**
     * Called when a session's transport opens, comes up, goes down or closes.
     * @param event the transport event
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when an unexpected error occurs while processing an event.
     * @param event the error event
     */
    void onError(ShadowErrorEvent event);
}
