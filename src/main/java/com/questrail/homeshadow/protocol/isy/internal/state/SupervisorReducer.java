package com.questrail.homeshadow.protocol.isy.internal.state;

import com.questrail.homeshadow.api.ConnectionStatus;
import com.questrail.homeshadow.protocol.isy.config.ReseedPolicy;
import com.questrail.homeshadow.protocol.isy.internal.events.ClientCommand;
import com.questrail.homeshadow.protocol.isy.internal.events.SessionEvent;
import com.questrail.homeshadow.protocol.isy.internal.events.ShadowEvent;
import com.questrail.homeshadow.protocol.isy.internal.events.TimerEvent;
import com.questrail.homeshadow.protocol.isy.internal.events.WatchdogExpired;
import com.questrail.homeshadow.protocol.isy.internal.exec.ReconnectPolicy;
import com.questrail.homeshadow.protocol.isy.internal.state.SupervisorIntents.Kind;

import java.time.Instant;
import java.util.Objects;

/**
 * SupervisorReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic state machine of the reconnection supervisor.
 *
 * <h2>Role in the architecture</h2>
 * Given a {@link SupervisorState} and one {@link ShadowEvent}, the reducer
 * computes the next state and the {@link SupervisorIntents} that realize it.
 * It performs no I/O, arms no timers and reads no clock; every timestamp comes
 * from the event.
 *
 * <h2>Transitions</h2>
 * <pre>
 *   DISCONNECTED --Connect--------------------&gt; CONNECTING
 *   CONNECTING   --SessionSubscribing---------&gt; SUBSCRIBING
 *   CONNECTING | SUBSCRIBING --SessionLive----&gt; LIVE
 *   CONNECTING | SUBSCRIBING | LIVE
 *                --SessionFailed | WatchdogExpired --&gt; DEGRADED (retry scheduled)
 *                                                 or DISCONNECTED (no auto-reconnect, ceiling)
 *   DEGRADED     --BackoffElapsed-------------&gt; CONNECTING (new session)
 *   any          --Close----------------------&gt; CLOSING (terminal)
 * </pre>
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Session events are honored only for the current session id; reports
 *       from a superseded session are ignored.</li>
 *   <li>A backoff expiry is honored only for the attempt that scheduled it.</li>
 *   <li>The connection status is published only when it changes, so one
 *       outage yields exactly one {@code RECONNECTING} and one
 *       {@code CONNECTED}.</li>
 *   <li>After {@code Close} every event is ignored.</li>
 * </ul>
 */
public final class SupervisorReducer
{
    /**
     * Result of applying an event to a supervisor state.
     *
     * @param newState the updated state
     * @param intents  actions for the executor
     */
    public record Result(SupervisorState newState, SupervisorIntents intents) {}

    private final ReconnectPolicy policy;
    private final ReseedPolicy reseedPolicy;

    public SupervisorReducer(ReconnectPolicy policy, ReseedPolicy reseedPolicy) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.reseedPolicy = Objects.requireNonNull(reseedPolicy, "reseedPolicy");
    }

    public Result apply(SupervisorState state, ShadowEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (state.isClosed()) {
            return unchanged(state);
        }

        if (event instanceof ClientCommand.Connect e) {
            return onConnect(state, e);
        }
        if (event instanceof SessionEvent.SessionSubscribing e) {
            return onSubscribing(state, e);
        }
        if (event instanceof SessionEvent.SessionLive e) {
            return onLive(state, e);
        }
        if (event instanceof SessionEvent.SessionFailed e) {
            return onSessionLost(state, e.sessionId(), e.timestamp());
        }
        if (event instanceof WatchdogExpired e) {
            return onSessionLost(state, e.sessionId(), e.timestamp());
        }
        if (event instanceof TimerEvent.BackoffElapsed e) {
            return onBackoffElapsed(state, e);
        }
        if (event instanceof ClientCommand.DisableAutoReconnect e) {
            return onDisableAutoReconnect(state, e);
        }
        if (event instanceof ClientCommand.Reconnect e) {
            return onReconnect(state, e);
        }
        if (event instanceof ClientCommand.Close e) {
            return onClose(state, e);
        }

        // Frames, seeds and watchdog ticks are not supervisor events.
        return unchanged(state);
    }

    // ---------------------------------------------------------------------
    // Event handlers
    // ---------------------------------------------------------------------

    private Result onConnect(SupervisorState state, ClientCommand.Connect e) {
        if (state.sessionState() != SessionState.DISCONNECTED) {
            return unchanged(state);
        }
        SupervisorState next = state.withNewSession(e.timestamp());
        return new Result(next, SupervisorIntents.builder().openSession(next.sessionId()).build());
    }

    private Result onSubscribing(SupervisorState state, SessionEvent.SessionSubscribing e) {
        if (!state.isCurrentSession(e.sessionId()) || state.sessionState() != SessionState.CONNECTING) {
            return unchanged(state);
        }
        return new Result(state.withSessionState(SessionState.SUBSCRIBING, e.timestamp()), SupervisorIntents.none());
    }

    private Result onLive(SupervisorState state, SessionEvent.SessionLive e) {
        if (!state.isCurrentSession(e.sessionId()) || state.sessionState() == SessionState.LIVE) {
            return unchanged(state);
        }

        Instant now = e.timestamp();
        boolean reconnect = state.everLive();

        SupervisorIntents.Builder intents = SupervisorIntents.builder().armWatchdog(state.sessionId());
        if (reconnect && reseedPolicy == ReseedPolicy.ON_RECONNECT) {
            intents.add(Kind.RESEED);
        }

        SupervisorState next = state
                .withSessionState(SessionState.LIVE, now)
                .withAttempt(0, now)
                .withEverLive(now);
        next = publishIfChanged(next, ConnectionStatus.CONNECTED, intents, now);

        return new Result(next, intents.build());
    }

    private Result onSessionLost(SupervisorState state, long sessionId, Instant now) {
        if (!state.isCurrentSession(sessionId)) {
            return unchanged(state);
        }

        SupervisorIntents.Builder intents = SupervisorIntents.builder()
                .add(Kind.CLOSE_SESSION)
                .add(Kind.DISARM_WATCHDOG);

        if (!state.autoReconnect()) {
            SupervisorState next = state.withSessionState(SessionState.DISCONNECTED, now);
            next = publishIfChanged(next, ConnectionStatus.DISCONNECTED, intents, now);
            return new Result(next, intents.build());
        }

        int attempt = state.attempt() + 1;
        if (policy.retryCeilingReached(attempt)) {
            SupervisorState next = state
                    .withSessionState(SessionState.DISCONNECTED, now)
                    .withAttempt(attempt - 1, now);
            next = publishIfChanged(next, ConnectionStatus.FAILED, intents, now);
            return new Result(next, intents.build());
        }

        intents.scheduleRetry(attempt);
        SupervisorState next = state
                .withSessionState(SessionState.DEGRADED, now)
                .withAttempt(attempt, now);
        next = publishIfChanged(next, ConnectionStatus.RECONNECTING, intents, now);
        return new Result(next, intents.build());
    }

    private Result onBackoffElapsed(SupervisorState state, TimerEvent.BackoffElapsed e) {
        if (state.sessionState() != SessionState.DEGRADED
                || !state.autoReconnect()
                || e.attempt() != state.attempt()) {
            return unchanged(state);
        }
        SupervisorState next = state.withNewSession(e.timestamp());
        return new Result(next, SupervisorIntents.builder().openSession(next.sessionId()).build());
    }

    private Result onDisableAutoReconnect(SupervisorState state, ClientCommand.DisableAutoReconnect e) {
        Instant now = e.timestamp();
        SupervisorState next = state.withAutoReconnect(false, now);

        if (state.sessionState() != SessionState.DEGRADED) {
            return new Result(next, SupervisorIntents.none());
        }

        SupervisorIntents.Builder intents = SupervisorIntents.builder().add(Kind.CANCEL_RETRY);
        next = next.withSessionState(SessionState.DISCONNECTED, now);
        next = publishIfChanged(next, ConnectionStatus.DISCONNECTED, intents, now);
        return new Result(next, intents.build());
    }

    private Result onReconnect(SupervisorState state, ClientCommand.Reconnect e) {
        Instant now = e.timestamp();
        SupervisorState next = state.withAutoReconnect(true, now);

        if (state.sessionState().hasActiveSession()) {
            return new Result(next, SupervisorIntents.none());
        }

        SupervisorIntents.Builder intents = SupervisorIntents.builder().add(Kind.CANCEL_RETRY);
        next = next.withAttempt(0, now).withNewSession(now);
        intents.openSession(next.sessionId());
        if (state.everLive() || state.status() == ConnectionStatus.FAILED) {
            next = publishIfChanged(next, ConnectionStatus.RECONNECTING, intents, now);
        }
        return new Result(next, intents.build());
    }

    private Result onClose(SupervisorState state, ClientCommand.Close e) {
        Instant now = e.timestamp();
        SupervisorIntents.Builder intents = SupervisorIntents.builder()
                .add(Kind.CANCEL_RETRY)
                .add(Kind.DISARM_WATCHDOG)
                .add(Kind.CLOSE_SESSION);

        SupervisorState next = state.withSessionState(SessionState.CLOSING, now);
        next = publishIfChanged(next, ConnectionStatus.DISCONNECTED, intents, now);
        return new Result(next, intents.build());
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static SupervisorState publishIfChanged(SupervisorState state,
                                                    ConnectionStatus status,
                                                    SupervisorIntents.Builder intents,
                                                    Instant now) {
        if (state.status() == status) {
            return state;
        }
        intents.publish(status);
        return state.withStatus(status, now);
    }

    private static Result unchanged(SupervisorState state) {
        return new Result(state, SupervisorIntents.none());
    }
}
