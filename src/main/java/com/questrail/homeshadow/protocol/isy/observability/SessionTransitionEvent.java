package com.questrail.homeshadow.protocol.isy.observability;

import com.questrail.homeshadow.protocol.isy.internal.events.ShadowEvent;
import com.questrail.homeshadow.protocol.isy.internal.state.SupervisorIntents;
import com.questrail.homeshadow.protocol.isy.internal.state.SupervisorState;

import java.time.Instant;

/**
 * Record representing one step of the reconnection supervisor.
 */
public record SessionTransitionEvent(
    Instant timestamp,
    SupervisorState oldState,
    SupervisorState newState,
    ShadowEvent triggeringEvent,
    SupervisorIntents resultingIntents
) {
    /**
     * Checks if the session lifecycle state changed during this transition.
     */
    public boolean isSessionStateChange() {
        return oldState.sessionState() != newState.sessionState();
    }

    /**
     * Checks if a new session was opened during this transition.
     */
    public boolean isNewSession() {
        return oldState.sessionId() != newState.sessionId();
    }

    public boolean isStatusChange() {
        return oldState.status() != newState.status();
    }
}
