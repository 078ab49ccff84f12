package com.questrail.homeshadow.notify;

import com.questrail.homeshadow.api.FeedListener;
import com.questrail.homeshadow.api.Subscription;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NotificationFeedTest
 * -----------------------------------------------------------------------------
 * Delivery order, listener isolation and unsubscribe semantics.
 */
class NotificationFeedTest {

    @Test
    void deliversInSubscriptionOrder() {
        NotificationFeed<String> feed = new NotificationFeed<>("test");
        List<String> calls = new ArrayList<>();

        feed.subscribe(e -> calls.add("a:" + e));
        feed.subscribe(e -> calls.add("b:" + e));
        feed.subscribe(e -> calls.add("c:" + e));

        assertEquals(3, feed.publish("x"));
        assertEquals(List.of("a:x", "b:x", "c:x"), calls);
    }

    @Test
    void failingListenerDoesNotStopDelivery() {
        NotificationFeed<String> feed = new NotificationFeed<>("test");
        List<String> calls = new ArrayList<>();

        feed.subscribe(e -> calls.add("first"));
        feed.subscribe(e -> {
            throw new IllegalStateException("boom");
        });
        feed.subscribe(e -> calls.add("third"));

        int delivered = feed.publish("x");

        assertEquals(2, delivered);
        assertEquals(List.of("first", "third"), calls);
    }

    @Test
    void selfUnsubscribingListenerIsSkippedOnNextPublish() {
        NotificationFeed<String> feed = new NotificationFeed<>("test");
        List<String> calls = new ArrayList<>();
        AtomicReference<Subscription> self = new AtomicReference<>();

        self.set(feed.subscribe(e -> {
            calls.add("once:" + e);
            self.get().unsubscribe();
        }));
        feed.subscribe(e -> calls.add("always:" + e));

        feed.publish("1");
        feed.publish("2");

        assertEquals(List.of("once:1", "always:1", "always:2"), calls);
        assertFalse(self.get().isActive());
        assertEquals(1, feed.listenerCount());
    }

    @Test
    void listenerRemovedDuringPublishStillReceivesCurrentEvent() {
        NotificationFeed<String> feed = new NotificationFeed<>("test");
        List<String> calls = new ArrayList<>();
        AtomicReference<Subscription> second = new AtomicReference<>();

        feed.subscribe(e -> second.get().unsubscribe());
        second.set(feed.subscribe(e -> calls.add("second:" + e)));

        feed.publish("1");
        feed.publish("2");

        assertEquals(List.of("second:1"), calls);
    }

    @Test
    void unsubscribeIsIdempotent() {
        NotificationFeed<String> feed = new NotificationFeed<>("test");
        Subscription subscription = feed.subscribe(e -> { });

        feed.unsubscribe(subscription);
        subscription.unsubscribe();

        assertFalse(subscription.isActive());
        assertFalse(feed.hasListeners());
        assertEquals(0, feed.publish("x"));
    }

    @Test
    void sameListenerSubscribedTwiceGetsTwoIndependentHandles() {
        NotificationFeed<String> feed = new NotificationFeed<>("test");
        List<String> calls = new ArrayList<>();
        FeedListener<String> listener = calls::add;

        Subscription first = feed.subscribe(listener);
        feed.subscribe(listener);
        first.unsubscribe();

        feed.publish("x");

        assertEquals(List.of("x"), calls);
    }
}
