package com.questrail.homeshadow.protocol.isy.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Timer port behind the reconnect backoff, the watchdog tick and the re-seed
 * fetch.
 *
 * <p>Deadlines are expressed on a {@link MonotonicClock}; wall-clock instants
 * are never used to decide when a timer fires. Implementations run tasks off
 * the dispatch thread, so a task only submits events back into the loop.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Runs {@code task} once the monotonic clock reaches {@code deadlineNanos}.
     * A deadline already in the past runs as soon as possible.
     *
     * @return handle that cancels the task if it has not started
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Relative form of {@link #scheduleAtNanos(long, Runnable)}.
     *
     * @throws IllegalArgumentException if {@code delay} is negative
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Negative timer delay: " + delay);
        }
        long deadline = clock.nowNanos() + delay.toNanos();
        return scheduleAtNanos(deadline, task);
    }
}
