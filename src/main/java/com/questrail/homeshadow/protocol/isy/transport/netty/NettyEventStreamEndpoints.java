package com.questrail.homeshadow.protocol.isy.transport.netty;

import com.questrail.homeshadow.protocol.isy.config.IsyConnectionConfig;
import com.questrail.homeshadow.protocol.isy.transport.EventStreamEndpointFactory;

import java.util.Objects;

/**
 * Endpoint factories for the Netty transports.
 */
public final class NettyEventStreamEndpoints
{
    private NettyEventStreamEndpoints() {
    }

    /**
     * @return a factory creating a fresh endpoint of the configured transport
     *         kind for every session
     */
    public static EventStreamEndpointFactory forConfig(IsyConnectionConfig config) {
        Objects.requireNonNull(config, "config");
        return switch (config.transport()) {
            case WEBSOCKET -> () -> new NettyWebSocketEventStreamEndpoint(config);
            case TCP_SOCKET -> () -> new NettyTcpEventStreamEndpoint(config);
        };
    }
}
