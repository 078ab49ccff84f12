package com.questrail.homeshadow.protocol.isy.observability;

import com.questrail.homeshadow.api.ConnectionStatus;
import com.questrail.homeshadow.protocol.isy.config.ReseedPolicy;
import com.questrail.homeshadow.protocol.isy.internal.events.ClientCommand;
import com.questrail.homeshadow.protocol.isy.internal.events.SessionError;
import com.questrail.homeshadow.protocol.isy.internal.events.SessionEvent;
import com.questrail.homeshadow.protocol.isy.internal.events.ShadowEvent;
import com.questrail.homeshadow.protocol.isy.internal.events.TimerEvent;
import com.questrail.homeshadow.protocol.isy.internal.exec.ReconnectPolicy;
import com.questrail.homeshadow.protocol.isy.internal.state.SupervisorReducer;
import com.questrail.homeshadow.protocol.isy.internal.state.SupervisorState;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Slf4jShadowObservabilitySinkTest
 * -----------------------------------------------------------------------------
 * Feeds the logging sink the transitions of a session that goes live, drops
 * and exhausts its retries, plus transport and error events with and without
 * causes. Logging must never throw back into the dispatch loop.
 */
class Slf4jShadowObservabilitySinkTest {

    private final Instant now = Instant.parse("2024-01-01T00:00:00Z");
    private final Slf4jShadowObservabilitySink sink = new Slf4jShadowObservabilitySink();

    private SessionEvent.SessionFailed failed(long sessionId) {
        return new SessionEvent.SessionFailed(
                new SessionError(sessionId, SessionError.Kind.TRANSPORT, new IOException("reset")), now);
    }

    private List<SessionTransitionEvent> transitionsUntilFailed() {
        SupervisorReducer reducer = new SupervisorReducer(
                ReconnectPolicy.defaults().withMaxAttempts(1), ReseedPolicy.NEVER);
        List<SessionTransitionEvent> transitions = new ArrayList<>();
        SupervisorState state = SupervisorState.initial(now);

        List<ShadowEvent> script = new ArrayList<>();
        script.add(new ClientCommand.Connect(now));
        script.add(new SessionEvent.SessionLive(1, "uuid:1", now));
        script.add(failed(1));
        script.add(new TimerEvent.BackoffElapsed(1, now));
        script.add(failed(2));
        for (ShadowEvent event : script) {
            SupervisorReducer.Result result = reducer.apply(state, event);
            transitions.add(new SessionTransitionEvent(now, state, result.newState(), event, result.intents()));
            state = result.newState();
        }
        return transitions;
    }

    @Test
    void sessionTransitionsAreLogged() {
        List<SessionTransitionEvent> transitions = transitionsUntilFailed();

        assertEquals(ConnectionStatus.CONNECTED, transitions.get(1).newState().status());
        assertEquals(ConnectionStatus.FAILED, transitions.get(4).newState().status());
        assertTrue(transitions.get(4).isStatusChange());
        transitions.forEach(t -> assertDoesNotThrow(() -> sink.onSessionTransition(t)));
    }

    @Test
    void transportEventsWithAndWithoutCauseAreLogged() {
        assertDoesNotThrow(() -> sink.onTransportEvent(
                new TransportObservabilityEvent(now, 1, TransportObservabilityEvent.Kind.UP, null)));
        assertDoesNotThrow(() -> sink.onTransportEvent(
                new TransportObservabilityEvent(now, 1, TransportObservabilityEvent.Kind.DOWN,
                        new IOException("connection reset"))));
    }

    @Test
    void errorsAreLogged() {
        assertDoesNotThrow(() -> sink.onError(
                new ShadowErrorEvent(now, "Event processing error", new IllegalStateException("boom"))));
        assertDoesNotThrow(() -> sink.onError(new ShadowErrorEvent(now, "No cause", null)));
    }
}
