package com.questrail.homeshadow.protocol.isy.observability;

import java.time.Instant;

/**
 * Record representing a transport-level occurrence for one session: the
 * connection came up, or went down with a cause.
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    long sessionId,
    Kind kind,
    Throwable cause
) {
    public enum Kind {
        OPENED,
        UP,
        DOWN,
        CLOSED
    }
}
