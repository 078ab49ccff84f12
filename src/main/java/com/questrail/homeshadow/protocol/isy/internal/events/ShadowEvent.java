package com.questrail.homeshadow.protocol.isy.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * ShadowEvent
 * -----------------------------------------------------------------------------
 * Marker interface for every event processed by the client's dispatch loop.
 *
 * <h2>Role in the architecture</h2>
 * The client is modeled as an actor: the shadow tree, the supervisor state and
 * the current session handle change only in response to {@link ShadowEvent}s
 * that are serialized and processed one at a time. This includes:
 * <ul>
 *   <li>decoded frames from the current stream session</li>
 *   <li>session lifecycle reports (live, failed)</li>
 *   <li>timer expiries (backoff, watchdog)</li>
 *   <li>caller commands (connect, reconnect, seed, close)</li>
 * </ul>
 *
 * <h2>Design constraints</h2>
 * Events are immutable and carry only what is needed to advance state.
 */
public interface ShadowEvent
{
    /**
     * Wall-clock time at which the event was generated. Used for entity
     * timestamps and tracing only.
     */
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements ShadowEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }
    }
}
