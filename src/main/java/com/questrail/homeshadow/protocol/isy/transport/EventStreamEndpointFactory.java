package com.questrail.homeshadow.protocol.isy.transport;

/**
 * Creates a fresh endpoint for every stream session.
 */
@FunctionalInterface
public interface EventStreamEndpointFactory
{
    EventStreamEndpoint create();
}
