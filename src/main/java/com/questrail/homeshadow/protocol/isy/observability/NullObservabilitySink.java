package com.questrail.homeshadow.protocol.isy.observability;

/**
 * No-op implementation of ShadowObservabilitySink.
 */
public final class NullObservabilitySink implements ShadowObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onError(ShadowErrorEvent event) {}
}
