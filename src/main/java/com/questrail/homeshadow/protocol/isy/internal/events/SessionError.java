package com.questrail.homeshadow.protocol.isy.internal.events;

import java.util.Objects;

/**
 * Why a stream session ended. Fatal to the session, never to the client.
 */
public record SessionError(long sessionId, Kind kind, Throwable cause)
{
    public enum Kind
    {
        /** Connect failure, socket error or remote close. */
        TRANSPORT,
        /** The controller rejected the subscription (credentials, subscriber limit). */
        PROTOCOL
    }

    public SessionError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(cause, "cause");
    }

    @Override
    public String toString() {
        return "SessionError{session=" + sessionId + ", kind=" + kind + ", cause=" + cause + "}";
    }
}
