package com.questrail.homeshadow.api;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Payload of the per-entity control feed. Raised for every control message
 * received for the entity, repeated codes included.
 */
public record ControlReceived(
        EntityAddress address,
        String control,
        Optional<PropertyValue> value,
        Instant timestamp)
{
    public ControlReceived {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(control, "control");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
