package com.questrail.homeshadow.protocol.isy.transport;

/**
 * EventStreamEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link EventStreamEndpoint}.
 *
 * <p>Callbacks for one endpoint are delivered serially (Netty endpoints deliver
 * them on the channel's event loop).</p>
 */
public interface EventStreamEndpointListener
{
    /**
     * The connection is up and the subscription request has been sent.
     * Called at most once.
     */
    void onTransportUp();

    /**
     * One complete frame of the event stream, exactly as received.
     */
    void onFrame(String frame);

    /**
     * The connection failed or was closed by the remote side. Called at most
     * once, and never after {@link EventStreamEndpoint#close()}.
     *
     * @param cause never {@code null}
     */
    void onTransportDown(Throwable cause);
}
