package com.questrail.homeshadow.protocol.isy.internal.exec;

import com.questrail.homeshadow.api.ConnectionStatus;
import com.questrail.homeshadow.api.EntitySnapshot;
import com.questrail.homeshadow.api.SnapshotSource;
import com.questrail.homeshadow.notify.NotificationFeed;
import com.questrail.homeshadow.protocol.isy.codec.EventFrameDecoder;
import com.questrail.homeshadow.protocol.isy.internal.events.ClientCommand;
import com.questrail.homeshadow.protocol.isy.internal.events.SessionError;
import com.questrail.homeshadow.protocol.isy.internal.events.SessionEvent;
import com.questrail.homeshadow.protocol.isy.internal.events.ShadowEvent;
import com.questrail.homeshadow.protocol.isy.internal.events.TimerEvent;
import com.questrail.homeshadow.protocol.isy.internal.events.WatchdogExpired;
import com.questrail.homeshadow.protocol.isy.internal.session.StreamSession;
import com.questrail.homeshadow.protocol.isy.internal.state.SupervisorIntents;
import com.questrail.homeshadow.protocol.isy.internal.time.Cancellable;
import com.questrail.homeshadow.protocol.isy.internal.time.MonotonicClock;
import com.questrail.homeshadow.protocol.isy.internal.time.MonotonicScheduler;
import com.questrail.homeshadow.protocol.isy.internal.time.WallClock;
import com.questrail.homeshadow.protocol.isy.observability.NullObservabilitySink;
import com.questrail.homeshadow.protocol.isy.observability.ShadowErrorEvent;
import com.questrail.homeshadow.protocol.isy.observability.ShadowObservabilitySink;
import com.questrail.homeshadow.protocol.isy.observability.TransportObservabilityEvent;
import com.questrail.homeshadow.protocol.isy.transport.EventStreamEndpoint;
import com.questrail.homeshadow.protocol.isy.transport.EventStreamEndpointFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * SessionIntentExecutor
 * =============================================================================
 * Production {@link SupervisorIntentExecutor}: realizes supervisor intents
 * against real sessions and timers.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Holds the current {@link StreamSession}; at most one exists at a
 *       time, and it is closed before its replacement opens.</li>
 *   <li>Arms the watchdog as a periodic {@link TimerEvent.WatchdogTick} and
 *       judges silence against the policy's effective window.</li>
 *   <li>Arms the reconnect delay as a {@link TimerEvent.BackoffElapsed}.</li>
 *   <li>Fetches a fresh snapshot for {@code RESEED} off the dispatch loop and
 *       feeds it back as a {@link ClientCommand.Seed}.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * All methods run on the dispatch loop. Timer callbacks only enqueue events
 * through {@code sink}; they never touch executor state.
 */
public final class SessionIntentExecutor implements SupervisorIntentExecutor
{
    private static final Logger log = LoggerFactory.getLogger(SessionIntentExecutor.class);

    private final EventStreamEndpointFactory endpointFactory;
    private final EventFrameDecoder decoder;
    private final Consumer<ShadowEvent> sink;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MonotonicScheduler scheduler;
    private final ReconnectPolicy policy;
    private final NotificationFeed<ConnectionStatus> connectionFeed;
    private final SnapshotSource snapshotSource;
    private final ShadowObservabilitySink observability;

    private StreamSession session;
    private Cancellable retryTimer;
    private Cancellable watchdogTimer;
    private long watchedSessionId = -1;

    public SessionIntentExecutor(EventStreamEndpointFactory endpointFactory,
                                 EventFrameDecoder decoder,
                                 Consumer<ShadowEvent> sink,
                                 MonotonicClock clock,
                                 WallClock wallClock,
                                 MonotonicScheduler scheduler,
                                 ReconnectPolicy policy,
                                 NotificationFeed<ConnectionStatus> connectionFeed,
                                 SnapshotSource snapshotSource,
                                 ShadowObservabilitySink observability)
    {
        this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.connectionFeed = Objects.requireNonNull(connectionFeed, "connectionFeed");
        this.snapshotSource = snapshotSource;
        this.observability = Objects.requireNonNullElse(observability, NullObservabilitySink.INSTANCE);
    }

    @Override
    public void execute(SupervisorIntents intents) {
        Objects.requireNonNull(intents, "intents");

        for (SupervisorIntents.Kind kind : SupervisorIntents.Kind.values()) {
            if (!intents.contains(kind)) {
                continue;
            }
            switch (kind) {
                case CANCEL_RETRY -> cancelRetry();
                case DISARM_WATCHDOG -> disarmWatchdog();
                case CLOSE_SESSION -> closeSession();
                case OPEN_SESSION -> openSession(intents.sessionId());
                case ARM_WATCHDOG -> armWatchdog(intents.sessionId());
                case SCHEDULE_RETRY -> scheduleRetry(intents.retryAttempt());
                case RESEED -> reseed();
                case PUBLISH_STATUS -> intents.status().ifPresent(this::publishStatus);
            }
        }
    }

    @Override
    public Optional<WatchdogExpired> checkWatchdog(long sessionId, Instant now) {
        StreamSession current = session;
        if (current == null || current.sessionId() != sessionId || watchedSessionId != sessionId) {
            return Optional.empty();
        }

        boolean expired = false;
        try {
            Duration silence = Duration.ofNanos(clock.nowNanos() - current.silenceSinceNanos());
            Duration window = policy.effectiveWatchdogWindow(current.advertisedHeartbeat());
            if (silence.compareTo(window) > 0) {
                log.warn("Session {} silent for {} ms (window {} ms)",
                        sessionId, silence.toMillis(), window.toMillis());
                expired = true;
                return Optional.of(new WatchdogExpired(sessionId, silence, now));
            }
            return Optional.empty();
        } finally {
            // a check that throws still leaves the watchdog running
            if (expired) {
                watchdogTimer = null;
                watchedSessionId = -1;
            } else {
                armWatchdog(sessionId);
            }
        }
    }

    /** The open session, if any. */
    public Optional<StreamSession> currentSession() {
        return Optional.ofNullable(session);
    }

    public boolean isRetryPending() {
        return retryTimer != null;
    }

    public boolean isWatchdogArmed() {
        return watchdogTimer != null;
    }

    // -------------------------------------------------------------------------
    // Intent handlers
    // -------------------------------------------------------------------------

    private void openSession(long sessionId) {
        // A new session consumes any retry that was pending.
        cancelRetry();
        if (session != null) {
            closeSession();
        }

        try {
            EventStreamEndpoint endpoint = endpointFactory.create();
            session = new StreamSession(sessionId, endpoint, decoder, sink, clock, wallClock);
        } catch (RuntimeException e) {
            log.warn("Cannot create endpoint for session {}", sessionId, e);
            sink.accept(new SessionEvent.SessionFailed(
                    new SessionError(sessionId, SessionError.Kind.TRANSPORT, e), wallClock.now()));
            return;
        }

        log.info("Opening session {}", sessionId);
        observability.onTransportEvent(new TransportObservabilityEvent(
                wallClock.now(), sessionId, TransportObservabilityEvent.Kind.OPENED, null));
        session.open();
    }

    private void closeSession() {
        StreamSession closing = session;
        if (closing == null) {
            return;
        }
        session = null;
        closing.close();
        observability.onTransportEvent(new TransportObservabilityEvent(
                wallClock.now(), closing.sessionId(), TransportObservabilityEvent.Kind.CLOSED, null));
    }

    private void armWatchdog(long sessionId) {
        if (watchdogTimer != null) {
            watchdogTimer.cancel();
        }
        watchedSessionId = sessionId;
        watchdogTimer = scheduler.scheduleAfter(policy.watchdogCheckPeriod(), clock,
                () -> sink.accept(new TimerEvent.WatchdogTick(sessionId, wallClock.now())));
    }

    private void disarmWatchdog() {
        if (watchdogTimer != null) {
            watchdogTimer.cancel();
            watchdogTimer = null;
        }
        watchedSessionId = -1;
    }

    private void scheduleRetry(int attempt) {
        cancelRetry();
        Duration delay = policy.backoffFor(attempt);
        log.info("Reconnect attempt {} in {} ms", attempt, delay.toMillis());
        retryTimer = scheduler.scheduleAfter(delay, clock,
                () -> sink.accept(new TimerEvent.BackoffElapsed(attempt, wallClock.now())));
    }

    private void cancelRetry() {
        if (retryTimer != null) {
            retryTimer.cancel();
            retryTimer = null;
        }
    }

    private void reseed() {
        if (snapshotSource == null) {
            log.debug("Re-seed requested but no snapshot source is configured");
            return;
        }
        scheduler.scheduleAfter(Duration.ZERO, clock, this::fetchSnapshot);
    }

    private void fetchSnapshot() {
        try {
            Collection<EntitySnapshot> entries = snapshotSource.fetch();
            log.info("Fetched snapshot of {} entities for re-seed", entries.size());
            sink.accept(new ClientCommand.Seed(entries, wallClock.now()));
        } catch (RuntimeException e) {
            observability.onError(new ShadowErrorEvent(wallClock.now(), "Snapshot fetch for re-seed failed", e));
        }
    }

    private void publishStatus(ConnectionStatus status) {
        log.debug("Publishing connection status {}", status);
        connectionFeed.publish(status);
    }
}
