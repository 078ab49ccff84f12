package com.questrail.homeshadow.protocol.isy.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * SessionEvent
 * -----------------------------------------------------------------------------
 * Events reported by a stream session to its owner. Every event carries the id
 * of the session that produced it; the owner discards events from sessions it
 * has already replaced.
 */
public sealed interface SessionEvent extends ShadowEvent
        permits SessionEvent.SessionSubscribing, SessionEvent.SessionLive, SessionEvent.SessionFailed,
                SessionEvent.FrameReceived
{
    long sessionId();

    /** Transport connected; the subscription request is out. */
    final class SessionSubscribing extends ShadowEvent.Base implements SessionEvent {
        private final long sessionId;

        public SessionSubscribing(long sessionId, Instant timestamp) {
            super(timestamp);
            this.sessionId = sessionId;
        }

        @Override
        public long sessionId() {
            return sessionId;
        }
    }

    /** The controller acknowledged the subscription or started streaming. */
    final class SessionLive extends ShadowEvent.Base implements SessionEvent {
        private final long sessionId;
        private final String streamId;

        public SessionLive(long sessionId, String streamId, Instant timestamp) {
            super(timestamp);
            this.sessionId = sessionId;
            this.streamId = Objects.requireNonNull(streamId, "streamId");
        }

        @Override
        public long sessionId() {
            return sessionId;
        }

        /** Stream id reported by the controller; empty when none was sent. */
        public String streamId() {
            return streamId;
        }
    }

    /** The session ended for a reason other than its owner closing it. */
    final class SessionFailed extends ShadowEvent.Base implements SessionEvent {
        private final SessionError error;

        public SessionFailed(SessionError error, Instant timestamp) {
            super(timestamp);
            this.error = Objects.requireNonNull(error, "error");
        }

        @Override
        public long sessionId() {
            return error.sessionId();
        }

        public SessionError error() {
            return error;
        }
    }

    /** A decoded frame to apply to the shadow. */
    final class FrameReceived extends ShadowEvent.Base implements SessionEvent {
        private final long sessionId;
        private final StreamEvent event;

        public FrameReceived(long sessionId, StreamEvent event, Instant timestamp) {
            super(timestamp);
            this.sessionId = sessionId;
            this.event = Objects.requireNonNull(event, "event");
        }

        @Override
        public long sessionId() {
            return sessionId;
        }

        public StreamEvent event() {
            return event;
        }
    }
}
