package com.questrail.homeshadow.protocol.isy.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for entity timestamps and notifications.
 *
 * <p>
 * May jump with NTP or manual adjustment, so it MUST NOT drive the watchdog or
 * the reconnect backoff.
 * </p>
 */
public interface WallClock
{
    Instant now();
}
