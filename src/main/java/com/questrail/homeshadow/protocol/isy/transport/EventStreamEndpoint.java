package com.questrail.homeshadow.protocol.isy.transport;

/**
 * EventStreamEndpoint
 * -----------------------------------------------------------------------------
 * Port for one connection to the controller's event stream.
 *
 * <p>An endpoint is single-use: it is opened once, delivers frames, and is
 * closed. Reconnecting means creating a new endpoint through an
 * {@link EventStreamEndpointFactory}.</p>
 *
 * <p>Implementations may be backed by Netty or a test double.</p>
 */
public interface EventStreamEndpoint
{
    /**
     * Register the listener that receives frames and lifecycle events.
     *
     * <p>This must be called before {@link #open()}.</p>
     */
    void setListener(EventStreamEndpointListener listener);

    /**
     * Connect and send the subscription request. Returns immediately; the
     * outcome is reported through the listener.
     */
    void open();

    /**
     * Release all transport resources. Idempotent. No listener callbacks are
     * delivered after this returns.
     */
    void close();

    /**
     * Informs the endpoint of the stream id the controller assigned, for
     * transports that must quote it when unsubscribing.
     */
    default void streamIdAssigned(String streamId) {
    }
}
