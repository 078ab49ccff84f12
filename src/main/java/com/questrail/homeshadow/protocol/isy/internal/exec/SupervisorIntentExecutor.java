package com.questrail.homeshadow.protocol.isy.internal.exec;

import com.questrail.homeshadow.protocol.isy.internal.events.WatchdogExpired;
import com.questrail.homeshadow.protocol.isy.internal.state.SupervisorIntents;

import java.time.Instant;
import java.util.Optional;

/**
 * SupervisorIntentExecutor
 * -----------------------------------------------------------------------------
 * Execution boundary between the pure supervisor state machine and the impure
 * world of sessions, timers and feeds.
 *
 * <h2>Role in the architecture</h2>
 * It is the ONLY layer allowed to:
 * <ul>
 *   <li>Open and close stream sessions</li>
 *   <li>Arm or cancel the watchdog and the reconnect delay</li>
 *   <li>Publish on the connection-status feed</li>
 * </ul>
 *
 * Outcomes (a session going live, a timer expiring) come back only as
 * {@code ShadowEvent}s on the dispatch loop. Calls are made from the dispatch
 * loop and must not block.
 */
public interface SupervisorIntentExecutor
{
    /**
     * Execute the supplied intents, in {@link SupervisorIntents.Kind}
     * declaration order.
     */
    void execute(SupervisorIntents intents);

    /**
     * Samples the activity of session {@code sessionId} after a watchdog tick.
     * Re-arms the watchdog when the session is still within its window.
     *
     * @return the expiry to feed to the supervisor, or empty when the session
     *         is healthy, superseded or no longer watched
     */
    Optional<WatchdogExpired> checkWatchdog(long sessionId, Instant now);
}
