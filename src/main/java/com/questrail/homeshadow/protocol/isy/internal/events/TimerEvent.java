package com.questrail.homeshadow.protocol.isy.internal.events;

import java.time.Instant;

/**
 * Expiry of a timer armed by the supervisor's intent executor.
 */
public sealed interface TimerEvent extends ShadowEvent
        permits TimerEvent.BackoffElapsed, TimerEvent.WatchdogTick
{
    /** The reconnect delay for retry {@code attempt} has passed. */
    final class BackoffElapsed extends ShadowEvent.Base implements TimerEvent {
        private final int attempt;

        public BackoffElapsed(int attempt, Instant timestamp) {
            super(timestamp);
            this.attempt = attempt;
        }

        public int attempt() {
            return attempt;
        }
    }

    /** Periodic activity check for session {@code sessionId}. */
    final class WatchdogTick extends ShadowEvent.Base implements TimerEvent {
        private final long sessionId;

        public WatchdogTick(long sessionId, Instant timestamp) {
            super(timestamp);
            this.sessionId = sessionId;
        }

        public long sessionId() {
            return sessionId;
        }
    }
}
