package com.questrail.homeshadow.api;

/**
 * Handle returned by every subscribe call.
 *
 * <p>{@link #unsubscribe()} is idempotent and may be called from any thread,
 * including from inside the listener's own callback. A publish already in
 * progress still completes; the listener is not invoked on later
 * publishes.</p>
 */
public interface Subscription
{
    void unsubscribe();

    boolean isActive();
}
