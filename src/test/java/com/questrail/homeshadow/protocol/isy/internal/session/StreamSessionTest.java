package com.questrail.homeshadow.protocol.isy.internal.session;

import com.questrail.homeshadow.protocol.isy.codec.impl.DefaultEventFrameDecoder;
import com.questrail.homeshadow.protocol.isy.internal.events.SessionError;
import com.questrail.homeshadow.protocol.isy.internal.events.SessionEvent;
import com.questrail.homeshadow.protocol.isy.internal.events.ShadowEvent;
import com.questrail.homeshadow.protocol.isy.internal.events.StreamEvent;
import com.questrail.homeshadow.protocol.isy.time.ManualMonotonicClock;
import com.questrail.homeshadow.protocol.isy.transport.EventStreamProtocolException;
import com.questrail.homeshadow.protocol.isy.transport.FakeEventStreamEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StreamSessionTest
 * -----------------------------------------------------------------------------
 * Lifecycle of a single session against a {@link FakeEventStreamEndpoint}.
 *
 * Events the session reports are collected in a list instead of a dispatch
 * loop, so every assertion sees them synchronously.
 */
class StreamSessionTest {

    private static final String ACK =
            "<s:Envelope><s:Body><SubscriptionResponse><SID>uuid:9</SID></SubscriptionResponse></s:Body></s:Envelope>";
    private static final String HEARTBEAT =
            "<Event seqnum=\"1\"><control>_0</control><action>120</action><node></node></Event>";
    private static final String STATUS =
            "<Event seqnum=\"2\"><control>ST</control><action>255</action><node>1A 2B 3C 1</node></Event>";

    private ManualMonotonicClock clock;
    private FakeEventStreamEndpoint endpoint;
    private List<ShadowEvent> events;
    private StreamSession session;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        endpoint = new FakeEventStreamEndpoint();
        events = new ArrayList<>();
        Instant t0 = Instant.parse("2024-01-01T00:00:00Z");
        session = new StreamSession(7, endpoint, new DefaultEventFrameDecoder(), events::add, clock, () -> t0);
    }

    @Test
    void subscriptionAckMakesSessionLive() {
        session.open();
        assertTrue(endpoint.isOpened());

        endpoint.transportUp();
        assertEquals(StreamSession.State.SUBSCRIBING, session.state());
        assertInstanceOf(SessionEvent.SessionSubscribing.class, events.get(0));

        endpoint.injectFrame(ACK);

        assertEquals(StreamSession.State.LIVE, session.state());
        assertEquals("uuid:9", session.streamId());
        assertEquals("uuid:9", endpoint.streamId());
        SessionEvent.SessionLive live = assertInstanceOf(SessionEvent.SessionLive.class, events.get(1));
        assertEquals(7, live.sessionId());
        assertEquals("uuid:9", live.streamId());
    }

    @Test
    void firstEventFrameMakesSessionLiveWithoutAck() {
        session.open();
        endpoint.transportUp();

        endpoint.injectFrame(STATUS);

        assertEquals(StreamSession.State.LIVE, session.state());
        assertInstanceOf(SessionEvent.SessionLive.class, events.get(1));
        SessionEvent.FrameReceived frame = assertInstanceOf(SessionEvent.FrameReceived.class, events.get(2));
        assertEquals(7, frame.sessionId());
        assertInstanceOf(StreamEvent.PropertyUpdate.class, frame.event());
    }

    @Test
    void heartbeatIsConsumedAndRecordsInterval() {
        session.open();
        endpoint.transportUp();
        endpoint.injectFrame(ACK);
        int before = events.size();

        endpoint.injectFrame(HEARTBEAT);

        assertEquals(before, events.size());
        assertEquals(Duration.ofSeconds(120), session.advertisedHeartbeat());
    }

    @Test
    void anyFrameRefreshesActivityEvenWhenUndecodable() {
        session.open();
        endpoint.transportUp();
        endpoint.injectFrame(ACK);
        clock.advance(Duration.ofSeconds(10));

        endpoint.injectFrame("<not-xml");

        assertEquals(clock.nowNanos(), session.lastActivityNanos());
        assertEquals(clock.nowNanos(), session.silenceSinceNanos());
        assertEquals(StreamSession.State.LIVE, session.state());
    }

    @Test
    void negativePrecisionFrameIsDroppedAndStreamContinues() {
        session.open();
        endpoint.transportUp();
        endpoint.injectFrame(ACK);
        int before = events.size();

        assertDoesNotThrow(() -> endpoint.injectFrame(
                "<Event><control>ST</control><action uom=\"17\" prec=\"-1\">725</action>"
                        + "<node>1A 2B 3C 1</node></Event>"));
        assertEquals(before, events.size());

        endpoint.injectFrame(STATUS);

        assertEquals(StreamSession.State.LIVE, session.state());
        assertEquals(before + 1, events.size());
        SessionEvent.FrameReceived frame = assertInstanceOf(SessionEvent.FrameReceived.class, events.get(before));
        StreamEvent.PropertyUpdate update = assertInstanceOf(StreamEvent.PropertyUpdate.class, frame.event());
        assertEquals(255L, update.value().value().getAsLong());
    }

    @Test
    void unexpectedDecoderFailureDoesNotEscapeToTransport() {
        StreamSession fragile = new StreamSession(8, endpoint, frame -> {
            throw new IllegalStateException("decoder bug");
        }, events::add, clock, () -> Instant.parse("2024-01-01T00:00:00Z"));
        fragile.open();
        endpoint.transportUp();
        events.clear();

        assertDoesNotThrow(() -> endpoint.injectFrame(STATUS));

        assertTrue(events.isEmpty());
        assertEquals(StreamSession.State.SUBSCRIBING, fragile.state());
        assertFalse(endpoint.isClosed());
    }

    @Test
    void silenceIsMeasuredFromOpenUntilLive() {
        session.open();
        long opened = clock.nowNanos();
        clock.advance(Duration.ofSeconds(3));
        endpoint.transportUp();

        assertEquals(opened, session.silenceSinceNanos());
    }

    @Test
    void transportFailureIsReportedOnceAndClosesEndpoint() {
        session.open();
        endpoint.transportUp();

        endpoint.fail(new IOException("connection reset"));

        SessionEvent.SessionFailed failed = assertInstanceOf(SessionEvent.SessionFailed.class,
                events.get(events.size() - 1));
        assertEquals(SessionError.Kind.TRANSPORT, failed.error().kind());
        assertEquals(7, failed.sessionId());
        assertTrue(endpoint.isClosed());
        assertEquals(StreamSession.State.CLOSING, session.state());

        int count = events.size();
        session.onTransportDown(new IOException("again"));
        assertEquals(count, events.size());
    }

    @Test
    void protocolRejectionIsClassified() {
        session.open();

        endpoint.fail(new EventStreamProtocolException("too many subscribers"));

        SessionEvent.SessionFailed failed = assertInstanceOf(SessionEvent.SessionFailed.class, events.get(0));
        assertEquals(SessionError.Kind.PROTOCOL, failed.error().kind());
    }

    @Test
    void closedSessionReportsNothing() {
        session.open();
        endpoint.transportUp();
        int count = events.size();

        session.close();
        session.close();
        session.onFrame(STATUS);
        session.onTransportDown(new IOException("late"));

        assertEquals(count, events.size());
        assertEquals(1, endpoint.closeCalls());
    }

    @Test
    void openTwiceIsRejected() {
        session.open();
        assertThrows(IllegalStateException.class, () -> session.open());
    }
}
