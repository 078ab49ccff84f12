package com.questrail.homeshadow.protocol.isy.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a scheduled reconnect delay or watchdog check.
 *
 * <p>
 * The supervisor keeps at most one handle per timer role and cancels it when
 * the role is disarmed or the client closes.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if the task had not yet run and is now cancelled;
     *         {@code false} if it already ran or was cancelled before.
     */
    boolean cancel();
}
