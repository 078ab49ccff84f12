package com.questrail.homeshadow.protocol.isy.internal.events;

import com.questrail.homeshadow.api.EntitySnapshot;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * ClientCommand
 * -----------------------------------------------------------------------------
 * Requests from the application, serialized through the dispatch loop like
 * every other event.
 */
public sealed interface ClientCommand extends ShadowEvent
        permits ClientCommand.Connect, ClientCommand.Reconnect, ClientCommand.DisableAutoReconnect,
                ClientCommand.Close, ClientCommand.Seed
{
    /** Open the first session. */
    final class Connect extends ShadowEvent.Base implements ClientCommand {
        public Connect(Instant timestamp) {
            super(timestamp);
        }
    }

    /** Re-enable auto-reconnect and open a session if none is active. */
    final class Reconnect extends ShadowEvent.Base implements ClientCommand {
        public Reconnect(Instant timestamp) {
            super(timestamp);
        }
    }

    final class DisableAutoReconnect extends ShadowEvent.Base implements ClientCommand {
        public DisableAutoReconnect(Instant timestamp) {
            super(timestamp);
        }
    }

    /** Terminal: close the session and cancel every timer. */
    final class Close extends ShadowEvent.Base implements ClientCommand {
        public Close(Instant timestamp) {
            super(timestamp);
        }
    }

    /** Load or merge a snapshot into the shadow. */
    final class Seed extends ShadowEvent.Base implements ClientCommand {
        private final List<EntitySnapshot> entries;

        public Seed(Collection<? extends EntitySnapshot> entries, Instant timestamp) {
            super(timestamp);
            this.entries = List.copyOf(entries);
        }

        public List<EntitySnapshot> entries() {
            return entries;
        }
    }
}
