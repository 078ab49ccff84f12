package com.questrail.homeshadow.protocol.isy.runtime;

import com.questrail.homeshadow.api.ConnectionStatus;
import com.questrail.homeshadow.api.ControlReceived;
import com.questrail.homeshadow.api.EntityAddress;
import com.questrail.homeshadow.api.EntityChange;
import com.questrail.homeshadow.api.EntitySnapshot;
import com.questrail.homeshadow.api.FeedListener;
import com.questrail.homeshadow.api.ShadowClient;
import com.questrail.homeshadow.api.SnapshotSource;
import com.questrail.homeshadow.api.StatusChange;
import com.questrail.homeshadow.api.Subscription;
import com.questrail.homeshadow.api.SystemStatus;
import com.questrail.homeshadow.core.ShadowTree;
import com.questrail.homeshadow.notify.NotificationFeed;
import com.questrail.homeshadow.protocol.isy.codec.EventFrameDecoder;
import com.questrail.homeshadow.protocol.isy.codec.impl.DefaultEventFrameDecoder;
import com.questrail.homeshadow.protocol.isy.config.IsyConnectionConfig;
import com.questrail.homeshadow.protocol.isy.config.ReseedPolicy;
import com.questrail.homeshadow.protocol.isy.config.ShadowRuntimeConfig;
import com.questrail.homeshadow.protocol.isy.internal.events.ClientCommand;
import com.questrail.homeshadow.protocol.isy.internal.events.ShadowEvent;
import com.questrail.homeshadow.protocol.isy.internal.exec.ReconnectPolicy;
import com.questrail.homeshadow.protocol.isy.internal.exec.SessionIntentExecutor;
import com.questrail.homeshadow.protocol.isy.internal.exec.ShadowCoordinator;
import com.questrail.homeshadow.protocol.isy.internal.exec.ShadowEventLoop;
import com.questrail.homeshadow.protocol.isy.internal.exec.StreamEventDispatcher;
import com.questrail.homeshadow.protocol.isy.internal.state.SupervisorReducer;
import com.questrail.homeshadow.protocol.isy.internal.state.SupervisorState;
import com.questrail.homeshadow.protocol.isy.internal.time.MonotonicClock;
import com.questrail.homeshadow.protocol.isy.internal.time.MonotonicScheduler;
import com.questrail.homeshadow.protocol.isy.internal.time.ScheduledExecutorScheduler;
import com.questrail.homeshadow.protocol.isy.internal.time.SystemMonotonicClock;
import com.questrail.homeshadow.protocol.isy.internal.time.SystemWallClock;
import com.questrail.homeshadow.protocol.isy.internal.time.WallClock;
import com.questrail.homeshadow.protocol.isy.observability.NullObservabilitySink;
import com.questrail.homeshadow.protocol.isy.observability.ShadowObservabilitySink;
import com.questrail.homeshadow.protocol.isy.transport.EventStreamEndpointFactory;
import com.questrail.homeshadow.protocol.isy.transport.netty.NettyEventStreamEndpoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * IsyShadowRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the ISY shadow client.
 *
 * <p>Wires the shadow tree, the reconnection supervisor, the stream session
 * executor and the dispatch loop, and exposes them as a {@link ShadowClient}.</p>
 *
 * <pre>
 *   IsyShadowRuntime client = IsyShadowRuntime.builder()
 *           .withConfig(config)
 *           .withObservabilitySink(new Slf4jShadowObservabilitySink())
 *           .build();
 *   client.seed(snapshot);
 *   client.start();
 *   ...
 *   client.close();
 * </pre>
 */
public final class IsyShadowRuntime implements ShadowClient
{
    private static final Logger log = LoggerFactory.getLogger(IsyShadowRuntime.class);

    private final ShadowTree tree;
    private final NotificationFeed<ConnectionStatus> connectionFeed;
    private final NotificationFeed<SystemStatus> systemFeed;
    private final ShadowCoordinator coordinator;
    private final ShadowEventLoop loop;
    private final WallClock wallClock;
    private final ScheduledExecutorService ownedSchedulerExecutor;

    private final Object lifecycleLock = new Object();
    private boolean started;
    private boolean closed;

    private IsyShadowRuntime(ShadowTree tree,
                             NotificationFeed<ConnectionStatus> connectionFeed,
                             NotificationFeed<SystemStatus> systemFeed,
                             ShadowCoordinator coordinator,
                             ShadowEventLoop loop,
                             WallClock wallClock,
                             ScheduledExecutorService ownedSchedulerExecutor) {
        this.tree = tree;
        this.connectionFeed = connectionFeed;
        this.systemFeed = systemFeed;
        this.coordinator = coordinator;
        this.loop = loop;
        this.wallClock = wallClock;
        this.ownedSchedulerExecutor = ownedSchedulerExecutor;
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Loads entries into the shadow. Before {@link #start()} the entries are
     * applied immediately on the calling thread; afterwards they are merged on
     * the dispatch loop.
     */
    @Override
    public void seed(Collection<? extends EntitySnapshot> entries) {
        Objects.requireNonNull(entries, "entries");
        ClientCommand.Seed seed = new ClientCommand.Seed(entries, wallClock.now());
        synchronized (lifecycleLock) {
            if (closed) {
                throw new IllegalStateException("Shadow client is closed");
            }
            if (!started) {
                coordinator.process(seed);
                return;
            }
        }
        loop.submit(seed);
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (closed) {
                throw new IllegalStateException("Shadow client is closed");
            }
            if (started) {
                return;
            }
            started = true;
        }
        log.info("Starting shadow client with {} seeded entities", tree.size());
        loop.start();
        loop.submit(new ClientCommand.Connect(wallClock.now()));
    }

    @Override
    public void reconnect() {
        loop.submit(new ClientCommand.Reconnect(wallClock.now()));
    }

    @Override
    public void disableAutoReconnect() {
        loop.submit(new ClientCommand.DisableAutoReconnect(wallClock.now()));
    }

    @Override
    public void close() {
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            closed = true;
        }

        if (!loop.stop(new ClientCommand.Close(wallClock.now()))) {
            log.warn("Dispatch thread still busy; it will close the session when its current event completes");
        }

        if (ownedSchedulerExecutor != null) {
            ownedSchedulerExecutor.shutdownNow();
            try {
                if (!ownedSchedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Timer thread did not terminate");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Shadow client closed");
    }

    // -------------------------------------------------------------------------
    // Observation
    // -------------------------------------------------------------------------

    @Override
    public Optional<EntitySnapshot> lookup(EntityAddress address) {
        return tree.lookup(address);
    }

    @Override
    public Collection<EntitySnapshot> entities() {
        return tree.snapshots();
    }

    @Override
    public Subscription subscribeStatus(EntityAddress address, FeedListener<? super StatusChange> listener) {
        return tree.subscribeStatus(address, listener);
    }

    @Override
    public Subscription subscribeControl(EntityAddress address, FeedListener<? super ControlReceived> listener) {
        return tree.subscribeControl(address, listener);
    }

    @Override
    public Subscription subscribeEntityChanges(FeedListener<? super EntityChange> listener) {
        return tree.subscribeEntityChanges(listener);
    }

    @Override
    public Subscription subscribeConnectionStatus(FeedListener<? super ConnectionStatus> listener) {
        return connectionFeed.subscribe(listener);
    }

    @Override
    public Subscription subscribeSystemStatus(FeedListener<? super SystemStatus> listener) {
        return systemFeed.subscribe(listener);
    }

    @Override
    public ConnectionStatus connectionStatus() {
        return coordinator.currentState().status();
    }

    /** Current supervisor state, for diagnostics. */
    public SupervisorState supervisorState() {
        return coordinator.currentState();
    }

    /** Submits an event to the dispatch loop. */
    public boolean submitEvent(ShadowEvent event) {
        return loop.submit(event);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private IsyConnectionConfig connection;
        private ReconnectPolicy reconnectPolicy = ReconnectPolicy.defaults();
        private ReseedPolicy reseedPolicy = ReseedPolicy.NEVER;
        private EventStreamEndpointFactory endpointFactory;
        private EventFrameDecoder decoder = new DefaultEventFrameDecoder();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private ShadowObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private SnapshotSource snapshotSource;
        private ZoneId controllerZone = ZoneId.systemDefault();
        private ShadowTree tree;

        public Builder withConfig(ShadowRuntimeConfig config) {
            Objects.requireNonNull(config, "config");
            this.connection = config.connection();
            this.reconnectPolicy = config.reconnectPolicy();
            this.reseedPolicy = config.reseedPolicy();
            return this;
        }

        public Builder withConnection(IsyConnectionConfig connection) {
            this.connection = connection;
            return this;
        }

        public Builder withReconnectPolicy(ReconnectPolicy policy) {
            this.reconnectPolicy = policy;
            return this;
        }

        public Builder withReseedPolicy(ReseedPolicy policy) {
            this.reseedPolicy = policy;
            return this;
        }

        /**
         * Replaces the Netty transport selected by the connection config.
         */
        public Builder withEndpointFactory(EventStreamEndpointFactory factory) {
            this.endpointFactory = factory;
            return this;
        }

        public Builder withDecoder(EventFrameDecoder decoder) {
            this.decoder = decoder;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Supplies the timer scheduler. The runtime then owns no timer thread.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withObservabilitySink(ShadowObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withSnapshotSource(SnapshotSource source) {
            this.snapshotSource = source;
            return this;
        }

        /** Time zone the controller reports program run times in. */
        public Builder withControllerZone(ZoneId zone) {
            this.controllerZone = zone;
            return this;
        }

        public Builder withShadowTree(ShadowTree tree) {
            this.tree = tree;
            return this;
        }

        public IsyShadowRuntime build() {
            Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
            Objects.requireNonNull(reseedPolicy, "reseedPolicy");
            Objects.requireNonNull(decoder, "decoder");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(controllerZone, "controllerZone");

            // 1. Transport
            EventStreamEndpointFactory factory = endpointFactory;
            if (factory == null) {
                Objects.requireNonNull(connection, "connection (or an endpoint factory) is required");
                factory = NettyEventStreamEndpoints.forConfig(connection);
            }

            // 2. Timers
            ScheduledExecutorService ownedExec = null;
            MonotonicScheduler timerScheduler = scheduler;
            if (timerScheduler == null) {
                ownedExec = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "isy-shadow-timer");
                    t.setDaemon(true);
                    return t;
                });
                timerScheduler = new ScheduledExecutorScheduler(ownedExec, clock);
            }

            ShadowObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            // 3. Shadow and feeds
            ShadowTree shadow = tree != null ? tree : new ShadowTree();
            NotificationFeed<ConnectionStatus> connectionFeed = new NotificationFeed<>("connection-status");
            NotificationFeed<SystemStatus> systemFeed = new NotificationFeed<>("system-status");

            // 4. Executor submits into the loop, which does not exist yet
            AtomicReference<ShadowEventLoop> loopRef = new AtomicReference<>();
            Consumer<ShadowEvent> submit = event -> {
                ShadowEventLoop l = loopRef.get();
                if (l != null) {
                    l.submit(event);
                }
            };

            SessionIntentExecutor executor = new SessionIntentExecutor(
                    factory,
                    decoder,
                    submit,
                    clock,
                    wallClock,
                    timerScheduler,
                    reconnectPolicy,
                    connectionFeed,
                    snapshotSource,
                    sink
            );

            // 5. Coordinator and loop
            ShadowCoordinator coordinator = new ShadowCoordinator(
                    new SupervisorReducer(reconnectPolicy, reseedPolicy),
                    executor,
                    shadow,
                    new StreamEventDispatcher(shadow, systemFeed, controllerZone),
                    wallClock,
                    sink
            );
            ShadowEventLoop loop = new ShadowEventLoop(coordinator, wallClock, sink);
            loopRef.set(loop);

            return new IsyShadowRuntime(shadow, connectionFeed, systemFeed, coordinator, loop,
                    wallClock, ownedExec);
        }
    }
}
