package com.questrail.homeshadow.api;

import java.util.Collection;
import java.util.Optional;

/**
 * ShadowClient
 * -----------------------------------------------------------------------------
 * {@code ShadowClient} is the semantic façade over a live, in-memory mirror of
 * a remote home-automation controller.
 *
 * <h2>Core Responsibilities</h2>
 * <ul>
 *   <li>Answering point-in-time lookups of entity state (OBSERVATION)</li>
 *   <li>Delivering typed notifications when entities change</li>
 *   <li>Reporting the health of the event stream at a semantic level</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Issuing commands to devices</li>
 *   <li>Fetching the initial snapshot (callers seed it)</li>
 *   <li>Persisting state across restarts</li>
 * </ul>
 *
 * <h2>Subscriptions</h2>
 * Subscriptions belong to the client, not to a connection. They survive
 * reconnects and may be registered for an address before that address has been
 * seeded. Every subscribe call returns a {@link Subscription} handle.
 *
 * <h2>Threading</h2>
 * Lookups and subscribe calls are safe from any thread. Listeners are invoked
 * on a single dispatch thread, in subscription order, and must not block.
 *
 * <h2>Lifecycle</h2>
 * {@code seed} → {@code start} → (stream runs, reconnecting as needed) →
 * {@code close}. Connection health is visible only through
 * {@link #connectionStatus()} and the connection-status feed, never through
 * exceptions.
 */
public interface ShadowClient extends AutoCloseable
{
    /**
     * Loads the initial snapshot. Intended to be called once before
     * {@link #start()}; a later call merges the entries into the shadow.
     */
    void seed(Collection<? extends EntitySnapshot> entries);

    /**
     * Opens the event stream. Idempotent.
     */
    void start();

    /**
     * @return the current snapshot for {@code address}, or empty when the
     *         address is not in the shadow
     */
    Optional<EntitySnapshot> lookup(EntityAddress address);

    /**
     * @return snapshots of every entity currently in the shadow
     */
    Collection<EntitySnapshot> entities();

    Subscription subscribeStatus(EntityAddress address, FeedListener<? super StatusChange> listener);

    Subscription subscribeControl(EntityAddress address, FeedListener<? super ControlReceived> listener);

    Subscription subscribeEntityChanges(FeedListener<? super EntityChange> listener);

    Subscription subscribeConnectionStatus(FeedListener<? super ConnectionStatus> listener);

    Subscription subscribeSystemStatus(FeedListener<? super SystemStatus> listener);

    ConnectionStatus connectionStatus();

    /**
     * Re-enables automatic reconnection and, when no session is active,
     * starts a new one immediately.
     */
    void reconnect();

    /**
     * Stops automatic reconnection. A live session keeps running; after the
     * next failure the client stays disconnected until {@link #reconnect()}.
     */
    void disableAutoReconnect();

    /**
     * Closes the stream and cancels every pending timer. Idempotent.
     */
    @Override
    void close();
}
