package com.questrail.homeshadow.protocol.isy.internal.time;

import java.time.Instant;

/**
 * Production {@link WallClock} backed by {@link Instant#now()}.
 *
 * <p>Used to stamp {@code lastChanged}/{@code lastUpdate} on shadow entities and
 * the timestamps of feed payloads. Never consulted for timeouts.</p>
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
