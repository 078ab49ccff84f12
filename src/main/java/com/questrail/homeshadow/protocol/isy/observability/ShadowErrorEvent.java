package com.questrail.homeshadow.protocol.isy.observability;

import java.time.Instant;

/**
 * Record representing an unexpected error in the shadow client's dispatch loop
 * or intent execution.
 */
public record ShadowErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
