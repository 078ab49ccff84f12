package com.questrail.homeshadow.protocol.isy.config;

/**
 * How the client subscribes to the controller's event stream.
 */
public enum TransportKind
{
    /** {@code /rest/subscribe} websocket, sub-protocol {@code ISYSUB}. */
    WEBSOCKET,

    /** SOAP subscription over a raw socket that stays open for the stream. */
    TCP_SOCKET
}
