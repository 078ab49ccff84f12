package com.questrail.homeshadow.protocol.isy.internal.events;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * No frame of any kind arrived from session {@code sessionId} within the
 * watchdog window. Handled exactly like a session failure.
 */
public final class WatchdogExpired extends ShadowEvent.Base
{
    private final long sessionId;
    private final Duration silence;

    public WatchdogExpired(long sessionId, Duration silence, Instant timestamp) {
        super(timestamp);
        this.sessionId = sessionId;
        this.silence = Objects.requireNonNull(silence, "silence");
    }

    public long sessionId() {
        return sessionId;
    }

    public Duration silence() {
        return silence;
    }
}
