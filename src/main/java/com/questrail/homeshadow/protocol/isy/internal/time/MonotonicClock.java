package com.questrail.homeshadow.protocol.isy.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for the watchdog window, frame activity tracking and reconnect
 * backoff.
 *
 * <h2>Binding invariant</h2>
 * Every elapsed-time decision made by the session and the supervisor uses this
 * clock. Wall-clock time ({@link WallClock}) only stamps entity timestamps and
 * observability events.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between two readings are meaningful.
     */
    long nowNanos();
}
