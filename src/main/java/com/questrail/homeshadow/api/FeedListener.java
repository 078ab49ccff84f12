package com.questrail.homeshadow.api;

/**
 * Receives events published on a notification feed.
 *
 * <p>Listeners run on the client's dispatch thread and must not block. A
 * listener that throws is logged and skipped; delivery to the remaining
 * listeners continues.</p>
 */
@FunctionalInterface
public interface FeedListener<T>
{
    void onEvent(T event);
}
