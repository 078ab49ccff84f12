package com.questrail.homeshadow.protocol.isy.internal.exec;

import com.questrail.homeshadow.core.ShadowTree;
import com.questrail.homeshadow.protocol.isy.internal.events.ClientCommand;
import com.questrail.homeshadow.protocol.isy.internal.events.SessionEvent;
import com.questrail.homeshadow.protocol.isy.internal.events.ShadowEvent;
import com.questrail.homeshadow.protocol.isy.internal.events.TimerEvent;
import com.questrail.homeshadow.protocol.isy.internal.state.SupervisorReducer;
import com.questrail.homeshadow.protocol.isy.internal.state.SupervisorState;
import com.questrail.homeshadow.protocol.isy.internal.time.WallClock;
import com.questrail.homeshadow.protocol.isy.observability.NullObservabilitySink;
import com.questrail.homeshadow.protocol.isy.observability.SessionTransitionEvent;
import com.questrail.homeshadow.protocol.isy.observability.ShadowObservabilitySink;
import com.questrail.homeshadow.protocol.isy.observability.TransportObservabilityEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * ShadowCoordinator
 * =============================================================================
 * Processes one {@link ShadowEvent} at a time: the body of the dispatch loop.
 *
 * <h2>Routing</h2>
 * <ul>
 *   <li>{@link SessionEvent.FrameReceived} from the current live session goes
 *       to the {@link StreamEventDispatcher}; frames from any other session
 *       are dropped.</li>
 *   <li>{@link ClientCommand.Seed} loads or merges entries into the tree.</li>
 *   <li>{@link TimerEvent.WatchdogTick} asks the executor to sample session
 *       activity; an expiry is fed to the supervisor.</li>
 *   <li>Everything else advances the supervisor: reducer first, then intent
 *       execution.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Not thread-safe. Exactly one thread calls {@link #process(ShadowEvent)} at
 * a time; {@link #currentState()} may be read from any thread.
 */
public final class ShadowCoordinator
{
    private static final Logger log = LoggerFactory.getLogger(ShadowCoordinator.class);

    private final SupervisorReducer reducer;
    private final SupervisorIntentExecutor executor;
    private final ShadowTree tree;
    private final StreamEventDispatcher dispatcher;
    private final WallClock wallClock;
    private final ShadowObservabilitySink observability;

    private volatile SupervisorState state;

    public ShadowCoordinator(SupervisorReducer reducer,
                             SupervisorIntentExecutor executor,
                             ShadowTree tree,
                             StreamEventDispatcher dispatcher,
                             WallClock wallClock,
                             ShadowObservabilitySink observability)
    {
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.tree = Objects.requireNonNull(tree, "tree");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observability = Objects.requireNonNullElse(observability, NullObservabilitySink.INSTANCE);
        this.state = SupervisorState.initial(wallClock.now());
    }

    public SupervisorState currentState() {
        return state;
    }

    public void process(ShadowEvent event) {
        Objects.requireNonNull(event, "event");

        if (event instanceof SessionEvent.FrameReceived frame) {
            onFrame(frame);
            return;
        }
        if (event instanceof ClientCommand.Seed seed) {
            tree.seed(seed.entries(), seed.timestamp());
            return;
        }
        if (event instanceof TimerEvent.WatchdogTick tick) {
            if (state.isCurrentSession(tick.sessionId())) {
                executor.checkWatchdog(tick.sessionId(), tick.timestamp()).ifPresent(this::advance);
            }
            return;
        }

        reportTransport(event);
        advance(event);
    }

    private void onFrame(SessionEvent.FrameReceived frame) {
        SupervisorState current = state;
        if (!current.isCurrentSession(frame.sessionId())) {
            log.debug("Dropping frame from superseded session {} (current {})",
                    frame.sessionId(), current.sessionId());
            return;
        }
        dispatcher.dispatch(frame.event(), frame.timestamp());
    }

    private void advance(ShadowEvent event) {
        SupervisorState oldState = state;
        SupervisorReducer.Result result = reducer.apply(oldState, event);
        state = result.newState();

        observability.onSessionTransition(new SessionTransitionEvent(
                wallClock.now(),
                oldState,
                result.newState(),
                event,
                result.intents()
        ));

        if (!result.intents().isEmpty()) {
            executor.execute(result.intents());
        }
    }

    private void reportTransport(ShadowEvent event) {
        if (event instanceof SessionEvent.SessionSubscribing e && state.isCurrentSession(e.sessionId())) {
            observability.onTransportEvent(new TransportObservabilityEvent(
                    e.timestamp(), e.sessionId(), TransportObservabilityEvent.Kind.UP, null));
        } else if (event instanceof SessionEvent.SessionFailed e && state.isCurrentSession(e.sessionId())) {
            observability.onTransportEvent(new TransportObservabilityEvent(
                    e.timestamp(), e.sessionId(), TransportObservabilityEvent.Kind.DOWN, e.error().cause()));
        }
    }
}
