package com.questrail.homeshadow.protocol.isy.internal.session;

import com.questrail.homeshadow.protocol.isy.codec.EventDecodeException;
import com.questrail.homeshadow.protocol.isy.codec.EventFrameDecoder;
import com.questrail.homeshadow.protocol.isy.internal.events.SessionError;
import com.questrail.homeshadow.protocol.isy.internal.events.SessionEvent;
import com.questrail.homeshadow.protocol.isy.internal.events.ShadowEvent;
import com.questrail.homeshadow.protocol.isy.internal.events.StreamEvent;
import com.questrail.homeshadow.protocol.isy.internal.time.MonotonicClock;
import com.questrail.homeshadow.protocol.isy.internal.time.WallClock;
import com.questrail.homeshadow.protocol.isy.transport.EventStreamEndpoint;
import com.questrail.homeshadow.protocol.isy.transport.EventStreamEndpointListener;
import com.questrail.homeshadow.protocol.isy.transport.EventStreamProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * StreamSession
 * =============================================================================
 * One connection attempt to the controller's event stream.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Owns exactly one {@link EventStreamEndpoint} for its whole life.</li>
 *   <li>Decodes every frame; decode failures are logged and dropped.</li>
 *   <li>Tracks activity: any frame, valid or not, refreshes
 *       {@link #lastActivityNanos()}.</li>
 *   <li>Consumes heartbeats and the subscription acknowledgement itself and
 *       forwards every other event as a {@link SessionEvent.FrameReceived}.</li>
 * </ul>
 *
 * <h2>What it does not do</h2>
 * A session never retries and never touches the shadow. Its owner decides what
 * a failure means; the session reports it once, as a
 * {@link SessionEvent.SessionFailed}, and stops.
 *
 * <h2>Threading</h2>
 * Endpoint callbacks arrive on the transport thread. The session forwards
 * events to {@code sink}, which is expected to enqueue them on the dispatch
 * loop; {@link #close()} may be called from any thread.
 */
public final class StreamSession implements EventStreamEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(StreamSession.class);

    public enum State
    {
        CONNECTING, SUBSCRIBING, LIVE, CLOSING
    }

    private final long sessionId;
    private final EventStreamEndpoint endpoint;
    private final EventFrameDecoder decoder;
    private final Consumer<ShadowEvent> sink;
    private final MonotonicClock clock;
    private final WallClock wallClock;

    private final Object lock = new Object();
    private State state = State.CONNECTING;
    private boolean opened;

    private volatile long openedNanos;
    private volatile long lastActivityNanos;
    private volatile Duration advertisedHeartbeat = Duration.ZERO;
    private volatile long lastHeartbeatSequence = -1;
    private volatile String streamId = "";

    public StreamSession(long sessionId,
                         EventStreamEndpoint endpoint,
                         EventFrameDecoder decoder,
                         Consumer<ShadowEvent> sink,
                         MonotonicClock clock,
                         WallClock wallClock)
    {
        this.sessionId = sessionId;
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.openedNanos = clock.nowNanos();
        this.lastActivityNanos = openedNanos;
    }

    /**
     * Opens the endpoint. A session can be opened once.
     */
    public void open() {
        synchronized (lock) {
            if (opened) {
                throw new IllegalStateException("Session " + sessionId + " already opened");
            }
            opened = true;
        }
        openedNanos = clock.nowNanos();
        lastActivityNanos = openedNanos;
        endpoint.setListener(this);
        try {
            endpoint.open();
        } catch (RuntimeException e) {
            fail(e);
        }
    }

    /**
     * Closes the endpoint. Idempotent; no event is reported afterwards.
     */
    public void close() {
        synchronized (lock) {
            if (state == State.CLOSING) {
                return;
            }
            state = State.CLOSING;
        }
        log.debug("Closing session {}", sessionId);
        endpoint.close();
    }

    public long sessionId() {
        return sessionId;
    }

    public State state() {
        synchronized (lock) {
            return state;
        }
    }

    public long lastActivityNanos() {
        return lastActivityNanos;
    }

    public long openedNanos() {
        return openedNanos;
    }

    /**
     * Start of the current silence: the last frame once live, the open time
     * before that. A session that never becomes live times out like a silent
     * one.
     */
    public long silenceSinceNanos() {
        return state() == State.LIVE ? lastActivityNanos : openedNanos;
    }

    /**
     * Heartbeat interval announced by the controller; {@link Duration#ZERO}
     * until the first heartbeat.
     */
    public Duration advertisedHeartbeat() {
        return advertisedHeartbeat;
    }

    /** Stream id assigned by the controller; empty until acknowledged. */
    public String streamId() {
        return streamId;
    }

    // -------------------------------------------------------------------------
    // Endpoint callbacks
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        lastActivityNanos = clock.nowNanos();
        synchronized (lock) {
            if (state != State.CONNECTING) {
                return;
            }
            state = State.SUBSCRIBING;
        }
        log.debug("Session {} subscribing", sessionId);
        sink.accept(new SessionEvent.SessionSubscribing(sessionId, wallClock.now()));
    }

    @Override
    public void onFrame(String frame) {
        lastActivityNanos = clock.nowNanos();
        if (state() == State.CLOSING) {
            return;
        }
        if (log.isTraceEnabled()) {
            log.trace("Session {} frame: {}", sessionId, frame);
        }

        Optional<StreamEvent> decoded;
        try {
            decoded = decoder.decode(frame);
        } catch (EventDecodeException e) {
            log.warn("Session {} dropped undecodable frame: {}", sessionId, e.getMessage());
            return;
        } catch (RuntimeException e) {
            // a bad frame must never reach the transport's exception path
            log.warn("Session {} dropped frame that failed to decode", sessionId, e);
            return;
        }
        if (decoded.isEmpty()) {
            return;
        }

        StreamEvent event = decoded.get();
        if (event instanceof StreamEvent.SubscriptionAck ack) {
            streamId = ack.streamId();
            endpoint.streamIdAssigned(ack.streamId());
            goLive();
            return;
        }

        goLive();

        if (event instanceof StreamEvent.Heartbeat heartbeat) {
            onHeartbeat(heartbeat);
            return;
        }

        sink.accept(new SessionEvent.FrameReceived(sessionId, event, wallClock.now()));
    }

    @Override
    public void onTransportDown(Throwable cause) {
        fail(cause);
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private void goLive() {
        synchronized (lock) {
            if (state != State.CONNECTING && state != State.SUBSCRIBING) {
                return;
            }
            state = State.LIVE;
        }
        log.info("Session {} live (stream id '{}')", sessionId, streamId);
        sink.accept(new SessionEvent.SessionLive(sessionId, streamId, wallClock.now()));
    }

    private void onHeartbeat(StreamEvent.Heartbeat heartbeat) {
        long previous = lastHeartbeatSequence;
        if (previous >= 0 && heartbeat.sequence() != previous + 1) {
            log.debug("Session {} heartbeat sequence gap {} -> {}", sessionId, previous, heartbeat.sequence());
        }
        lastHeartbeatSequence = heartbeat.sequence();
        if (!heartbeat.interval().isZero()) {
            advertisedHeartbeat = heartbeat.interval();
        }
        log.debug("Session {} heartbeat {} (interval {}s)", sessionId,
                heartbeat.sequence(), heartbeat.interval().toSeconds());
    }

    private void fail(Throwable cause) {
        synchronized (lock) {
            if (state == State.CLOSING) {
                return;
            }
            state = State.CLOSING;
        }

        SessionError.Kind kind = cause instanceof EventStreamProtocolException
                ? SessionError.Kind.PROTOCOL
                : SessionError.Kind.TRANSPORT;
        log.info("Session {} failed ({}): {}", sessionId, kind, cause.toString());

        endpoint.close();
        sink.accept(new SessionEvent.SessionFailed(new SessionError(sessionId, kind, cause), wallClock.now()));
    }
}
