package com.questrail.homeshadow.api;

import java.time.Instant;
import java.util.Objects;

/**
 * Payload of the per-entity status feed: a property moved from one value to
 * another. {@code property} is {@link #STATUS} for the primary status.
 */
public record StatusChange(
        EntityAddress address,
        String property,
        PropertyValue oldValue,
        PropertyValue newValue,
        Instant timestamp)
{
    public static final String STATUS = "ST";

    public StatusChange {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(property, "property");
        Objects.requireNonNull(oldValue, "oldValue");
        Objects.requireNonNull(newValue, "newValue");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public boolean isStatus() {
        return STATUS.equals(property);
    }
}
