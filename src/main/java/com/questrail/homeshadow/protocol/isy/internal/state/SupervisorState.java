package com.questrail.homeshadow.protocol.isy.internal.state;

import com.questrail.homeshadow.api.ConnectionStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * SupervisorState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of the reconnection supervisor's <em>logical</em> state.
 *
 * <h2>Role in the architecture</h2>
 * Consumed and produced by {@link SupervisorReducer}. It holds protocol facts
 * only; the session object, timers and feeds belong to the intent executor.
 *
 * <ul>
 *   <li>{@code sessionId}: id of the most recently opened session. Ids only
 *       grow; an event carrying any other id comes from a superseded session.</li>
 *   <li>{@code attempt}: consecutive failed attempts since the stream was last
 *       live.</li>
 *   <li>{@code status}: the connection status last published.</li>
 *   <li>{@code everLive}: whether any session has reached live, which makes
 *       the next live session a reconnect.</li>
 * </ul>
 */
public final class SupervisorState
{
    private final SessionState sessionState;
    private final long sessionId;
    private final int attempt;
    private final boolean autoReconnect;
    private final ConnectionStatus status;
    private final boolean everLive;
    private final Instant lastTransition;

    private SupervisorState(SessionState sessionState,
                            long sessionId,
                            int attempt,
                            boolean autoReconnect,
                            ConnectionStatus status,
                            boolean everLive,
                            Instant lastTransition) {
        this.sessionState = Objects.requireNonNull(sessionState, "sessionState");
        this.sessionId = sessionId;
        this.attempt = attempt;
        this.autoReconnect = autoReconnect;
        this.status = Objects.requireNonNull(status, "status");
        this.everLive = everLive;
        this.lastTransition = Objects.requireNonNull(lastTransition, "lastTransition");
    }

    public static SupervisorState initial(Instant now) {
        return new SupervisorState(SessionState.DISCONNECTED, 0, 0, true,
                ConnectionStatus.DISCONNECTED, false, now);
    }

    public SessionState sessionState() {
        return sessionState;
    }

    public long sessionId() {
        return sessionId;
    }

    public int attempt() {
        return attempt;
    }

    public boolean autoReconnect() {
        return autoReconnect;
    }

    public ConnectionStatus status() {
        return status;
    }

    public boolean everLive() {
        return everLive;
    }

    public boolean isClosed() {
        return sessionState == SessionState.CLOSING;
    }

    public Instant lastTransition() {
        return lastTransition;
    }

    /**
     * True when {@code id} names the session the supervisor is currently
     * waiting on.
     */
    public boolean isCurrentSession(long id) {
        return sessionState.hasActiveSession() && id == sessionId;
    }

    // ---------------------------------------------------------------------
    // Withers
    // ---------------------------------------------------------------------

    public SupervisorState withSessionState(SessionState newState, Instant now) {
        return new SupervisorState(newState, sessionId, attempt, autoReconnect, status, everLive, now);
    }

    /** Allocates the next session id and enters {@link SessionState#CONNECTING}. */
    public SupervisorState withNewSession(Instant now) {
        return new SupervisorState(SessionState.CONNECTING, sessionId + 1, attempt, autoReconnect, status,
                everLive, now);
    }

    public SupervisorState withAttempt(int newAttempt, Instant now) {
        return new SupervisorState(sessionState, sessionId, newAttempt, autoReconnect, status, everLive, now);
    }

    public SupervisorState withAutoReconnect(boolean enabled, Instant now) {
        return new SupervisorState(sessionState, sessionId, attempt, enabled, status, everLive, now);
    }

    public SupervisorState withStatus(ConnectionStatus newStatus, Instant now) {
        return new SupervisorState(sessionState, sessionId, attempt, autoReconnect, newStatus, everLive, now);
    }

    public SupervisorState withEverLive(Instant now) {
        return new SupervisorState(sessionState, sessionId, attempt, autoReconnect, status, true, now);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SupervisorState)) return false;
        SupervisorState that = (SupervisorState) o;
        return sessionId == that.sessionId
                && attempt == that.attempt
                && autoReconnect == that.autoReconnect
                && everLive == that.everLive
                && sessionState == that.sessionState
                && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionState, sessionId, attempt, autoReconnect, status, everLive);
    }

    @Override
    public String toString() {
        return "SupervisorState{" +
                "state=" + sessionState +
                ", session=" + sessionId +
                ", attempt=" + attempt +
                ", autoReconnect=" + autoReconnect +
                ", status=" + status +
                '}';
    }
}
