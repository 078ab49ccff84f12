package com.questrail.homeshadow.notify;

import com.questrail.homeshadow.api.FeedListener;
import com.questrail.homeshadow.api.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NotificationFeed
 * =============================================================================
 * A named, typed fan-out point with any number of listeners.
 *
 * <h2>Delivery</h2>
 * <ul>
 *   <li>Listeners are invoked in subscription order.</li>
 *   <li>Each publish iterates a snapshot of the listener list taken when the
 *       publish starts. Subscribing or unsubscribing during a publish takes
 *       effect on the next publish.</li>
 *   <li>A listener that throws is logged and skipped; the remaining listeners
 *       still receive the event.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Subscribe and unsubscribe are safe from any thread, including from inside a
 * callback. Publishing is expected from the client's single dispatch thread.
 *
 * @param <T> payload type
 */
public final class NotificationFeed<T>
{
    private static final Logger log = LoggerFactory.getLogger(NotificationFeed.class);

    private final String name;
    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    public NotificationFeed(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    public Subscription subscribe(FeedListener<? super T> listener) {
        Objects.requireNonNull(listener, "listener");
        Registration registration = new Registration(listener);
        registrations.add(registration);
        return registration;
    }

    /**
     * Equivalent to {@link Subscription#unsubscribe()}.
     */
    public void unsubscribe(Subscription subscription) {
        Objects.requireNonNull(subscription, "subscription");
        subscription.unsubscribe();
    }

    /**
     * Delivers {@code event} to every listener registered when the call starts.
     *
     * @return number of listeners that completed without throwing
     */
    public int publish(T event) {
        Objects.requireNonNull(event, "event");

        int delivered = 0;
        for (Registration registration : registrations) {
            try {
                registration.listener.onEvent(event);
                delivered++;
            } catch (RuntimeException e) {
                log.warn("Listener failure on feed '{}' for event {}", name, event, e);
            }
        }
        return delivered;
    }

    public int listenerCount() {
        return registrations.size();
    }

    public boolean hasListeners() {
        return !registrations.isEmpty();
    }

    @Override
    public String toString() {
        return "NotificationFeed{" + name + ", listeners=" + registrations.size() + "}";
    }

    private final class Registration implements Subscription
    {
        private final FeedListener<? super T> listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(FeedListener<? super T> listener) {
            this.listener = listener;
        }

        @Override
        public void unsubscribe() {
            if (active.compareAndSet(true, false)) {
                registrations.remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
