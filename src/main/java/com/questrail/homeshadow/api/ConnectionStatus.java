package com.questrail.homeshadow.api;

/**
 * ConnectionStatus
 * -----------------------------------------------------------------------------
 * Client-wide view of the event stream, published on the connection-status
 * feed. This is the only channel through which session failures reach the
 * application.
 *
 * <p>
 * A reconnect cycle is observed as exactly one {@link #RECONNECTING} followed
 * by one {@link #CONNECTED}. Intermediate connect and subscribe steps are not
 * published.
 * </p>
 */
public enum ConnectionStatus
{
    /** A session is live and the shadow is being kept current. */
    CONNECTED,

    /**
     * No session, and none is being attempted: not started yet, closed, or
     * auto-reconnect disabled after a failure.
     */
    DISCONNECTED,

    /** The last session failed; a replacement is being attempted. */
    RECONNECTING,

    /**
     * The configured retry ceiling was exhausted. The client stays
     * disconnected until reconnect is requested explicitly.
     */
    FAILED
}
