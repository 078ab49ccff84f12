package com.questrail.homeshadow.protocol.isy.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FakeEventStreamEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link EventStreamEndpoint} implementation.
 *
 * <p>It contains no event-stream semantics; tests drive the listener directly
 * with {@link #transportUp()}, {@link #injectFrame(String)} and
 * {@link #fail(Throwable)}. Like the real endpoints, it delivers nothing after
 * {@link #close()}.</p>
 */
public final class FakeEventStreamEndpoint implements EventStreamEndpoint {

    private volatile EventStreamEndpointListener listener;
    private volatile boolean opened;
    private volatile boolean closed;
    private volatile int closeCalls;
    private volatile String streamId;

    @Override
    public void setListener(EventStreamEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void open() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        opened = true;
    }

    @Override
    public void close() {
        closeCalls++;
        closed = true;
    }

    @Override
    public void streamIdAssigned(String streamId) {
        this.streamId = streamId;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void transportUp() {
        if (!closed) {
            requireListener().onTransportUp();
        }
    }

    public void injectFrame(String frame) {
        if (!closed) {
            requireListener().onFrame(frame);
        }
    }

    public void fail(Throwable cause) {
        if (!closed) {
            requireListener().onTransportDown(cause);
        }
    }

    public boolean isOpened() {
        return opened;
    }

    public boolean isClosed() {
        return closed;
    }

    public int closeCalls() {
        return closeCalls;
    }

    public String streamId() {
        return streamId;
    }

    private EventStreamEndpointListener requireListener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }

    /**
     * Factory that records every endpoint it creates.
     */
    public static final class Factory implements EventStreamEndpointFactory {
        private final List<FakeEventStreamEndpoint> created = new ArrayList<>();

        @Override
        public synchronized EventStreamEndpoint create() {
            FakeEventStreamEndpoint endpoint = new FakeEventStreamEndpoint();
            created.add(endpoint);
            return endpoint;
        }

        public synchronized List<FakeEventStreamEndpoint> created() {
            return Collections.unmodifiableList(new ArrayList<>(created));
        }

        public synchronized FakeEventStreamEndpoint last() {
            if (created.isEmpty()) {
                throw new IllegalStateException("No endpoint created yet");
            }
            return created.get(created.size() - 1);
        }

        public synchronized int count() {
            return created.size();
        }
    }
}
