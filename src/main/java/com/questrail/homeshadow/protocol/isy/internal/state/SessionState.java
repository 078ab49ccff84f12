package com.questrail.homeshadow.protocol.isy.internal.state;

/**
 * Lifecycle state of the event stream as tracked by the supervisor.
 */
public enum SessionState
{
    /** No session, and none scheduled. */
    DISCONNECTED,
    /** A session is opening its transport. */
    CONNECTING,
    /** Transport up, subscription request sent. */
    SUBSCRIBING,
    /** Frames are flowing. */
    LIVE,
    /** The last session failed; a reconnect is scheduled. */
    DEGRADED,
    /** The client is closed. Terminal. */
    CLOSING;

    /** True while a session is open or opening. */
    public boolean hasActiveSession() {
        return this == CONNECTING || this == SUBSCRIBING || this == LIVE;
    }
}
