package com.questrail.homeshadow.protocol.isy.transport;

/**
 * The controller refused or broke the event-stream protocol: bad credentials,
 * too many subscribers, or a response the client cannot frame.
 */
public final class EventStreamProtocolException extends RuntimeException
{
    public EventStreamProtocolException(String message) {
        super(message);
    }

    public EventStreamProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
